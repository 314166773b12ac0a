package org.netpreserve.docketcrawl.cdp.protocol;

import java.io.ByteArrayOutputStream;

/**
 * Splits the pipe transport's byte stream into messages. Every message ends with a NUL byte and may arrive spread
 * over several reads.
 */
final class MessageFramer {
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private final Sink sink;

    MessageFramer(Sink sink) {
        this.sink = sink;
    }

    void feed(byte[] buffer, int length) {
        int start = 0;
        for (int i = 0; i < length; i++) {
            if (buffer[i] != 0) continue;
            if (pending.size() == 0) {
                if (i > start) sink.message(buffer, start, i - start);
            } else {
                pending.write(buffer, start, i - start);
                byte[] message = pending.toByteArray();
                pending.reset();
                sink.message(message, 0, message.length);
            }
            start = i + 1;
        }
        if (start < length) {
            pending.write(buffer, start, length - start);
        }
    }

    /**
     * Bytes of an incomplete message held back until its terminator arrives.
     */
    int pendingBytes() {
        return pending.size();
    }

    @FunctionalInterface
    interface Sink {
        void message(byte[] data, int offset, int length);
    }
}
