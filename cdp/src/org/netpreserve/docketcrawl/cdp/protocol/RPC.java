package org.netpreserve.docketcrawl.cdp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.netpreserve.docketcrawl.util.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Message transport for the DevTools protocol.
 */
public interface RPC {
    /**
     * Captured attachment bodies come back base64 encoded inside a single message.
     */
    int MAX_MESSAGE_CHARS = 300 * 1024 * 1024;

    ObjectMapper JSON = new ObjectMapper(new JsonFactoryBuilder()
            .streamReadConstraints(StreamReadConstraints.builder().maxStringLength(MAX_MESSAGE_CHARS).build())
            .build())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * @throws IOException if the transport is closed or the write fails
     */
    void send(Command message) throws IOException;

    void close();

    record Command(long id, String method, Map<String, Object> params, String sessionId) {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
    @JsonSubTypes({@JsonSubTypes.Type(Event.class), @JsonSubTypes.Type(Response.class)})
    interface ServerMessage {
        String sessionId();
    }

    record Event(String method, ObjectNode params, String sessionId) implements ServerMessage {
    }

    record Response(long id, ObjectNode result, Error error, String sessionId) implements ServerMessage {
    }

    record Error(int code, String message) {
    }

    /**
     * WebSocket transport, used when the browser can't be given pipe file descriptors.
     */
    class Socket implements RPC {
        private static final Logger log = LoggerFactory.getLogger(Socket.class);
        private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
        private final WebSocket webSocket;
        private final Consumer<ServerMessage> messageHandler;
        private final Runnable closeHandler;
        private final AtomicBoolean closed = new AtomicBoolean();
        private final AtomicBoolean closeReported = new AtomicBoolean();

        public Socket(URI devtoolsUrl, Consumer<ServerMessage> messageHandler, Runnable closeHandler)
                throws IOException {
            this.messageHandler = messageHandler;
            this.closeHandler = closeHandler;
            try {
                this.webSocket = HttpClient.newHttpClient().newWebSocketBuilder()
                        .connectTimeout(CONNECT_TIMEOUT)
                        .buildAsync(devtoolsUrl, new Listener())
                        .get(CONNECT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw new IOException("Unable to connect to " + devtoolsUrl, e.getCause());
            } catch (TimeoutException e) {
                throw new IOException("Timed out connecting to " + devtoolsUrl, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted connecting to " + devtoolsUrl, e);
            }
            log.atDebug().addKeyValue("url", devtoolsUrl).log("Connected to DevTools socket");
        }

        @Override
        public void send(Command message) throws IOException {
            if (closed.get()) throw new IOException("DevTools socket closed");
            String json = JSON.writeValueAsString(message);
            if (log.isTraceEnabled()) log.trace("-> {}", LogUtils.ellipses(json));
            webSocket.sendText(json, true);
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) return;
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "");
            webSocket.abort();
        }

        private void reportClosed() {
            if (closeReported.compareAndSet(false, true)) closeHandler.run();
        }

        private class Listener implements WebSocket.Listener {
            private final StringBuilder partial = new StringBuilder();

            @Override
            public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                partial.append(data);
                if (last) {
                    String text = partial.toString();
                    partial.setLength(0);
                    if (log.isTraceEnabled()) log.trace("<- {}", LogUtils.ellipses(text));
                    try {
                        messageHandler.accept(JSON.readValue(text, ServerMessage.class));
                    } catch (JsonProcessingException e) {
                        log.atWarn().addKeyValue("message", LogUtils.abbreviate(text, 200))
                                .log("Unparseable DevTools message: {}", e.getOriginalMessage());
                    }
                }
                webSocket.request(1);
                return null;
            }

            @Override
            public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                log.atDebug().addKeyValue("status", statusCode).log("DevTools socket closed: {}", reason);
                reportClosed();
                return null;
            }

            @Override
            public void onError(WebSocket webSocket, Throwable error) {
                log.error("DevTools socket error", error);
                reportClosed();
            }
        }
    }

    /**
     * Pipe transport: NUL-terminated JSON messages over the browser's stdin and stdout.
     */
    class Pipe implements RPC {
        private static final Logger log = LoggerFactory.getLogger(Pipe.class);
        private static final int READ_BUFFER_SIZE = 256 * 1024;
        private final InputStream inputStream;
        private final OutputStream outputStream;
        private final Consumer<ServerMessage> messageHandler;
        private final Runnable closeHandler;
        private final Lock writeLock = new ReentrantLock();
        private final AtomicBoolean closed = new AtomicBoolean();

        public Pipe(InputStream inputStream, OutputStream outputStream, Consumer<ServerMessage> messageHandler,
                    Runnable closeHandler) {
            this.inputStream = inputStream;
            this.outputStream = outputStream;
            this.messageHandler = messageHandler;
            this.closeHandler = closeHandler;
            var reader = new Thread(this::readLoop, "cdp-pipe-reader");
            reader.setDaemon(true);
            reader.start();
        }

        private void readLoop() {
            var framer = new MessageFramer(this::dispatch);
            byte[] buffer = new byte[READ_BUFFER_SIZE];
            try {
                int length;
                while ((length = inputStream.read(buffer)) >= 0) {
                    framer.feed(buffer, length);
                }
                log.atDebug().addKeyValue("pendingBytes", framer.pendingBytes()).log("Browser closed the pipe");
            } catch (IOException e) {
                if (!closed.get()) log.error("Error reading CDP pipe", e);
            } finally {
                close();
                closeHandler.run();
            }
        }

        private void dispatch(byte[] data, int offset, int length) {
            if (log.isTraceEnabled()) log.trace("<- {}", LogUtils.ellipses(new String(data, offset, length, UTF_8)));
            ServerMessage message;
            try {
                message = JSON.readValue(data, offset, length, ServerMessage.class);
            } catch (IOException e) {
                log.atWarn().addKeyValue("message", LogUtils.abbreviate(new String(data, offset, length, UTF_8), 200))
                        .log("Unparseable DevTools message: {}", e.getMessage());
                return;
            }
            messageHandler.accept(message);
        }

        @Override
        public void send(Command message) throws IOException {
            byte[] json = JSON.writeValueAsBytes(message);
            if (log.isTraceEnabled()) log.trace("-> {}", LogUtils.ellipses(new String(json, UTF_8)));
            writeLock.lock();
            try {
                if (closed.get()) throw new IOException("CDP pipe closed");
                outputStream.write(json);
                outputStream.write(0);
                outputStream.flush();
            } finally {
                writeLock.unlock();
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) return;
            try {
                outputStream.close();
            } catch (IOException e) {
                log.debug("Error closing CDP pipe output", e);
            }
            try {
                inputStream.close();
            } catch (IOException e) {
                log.debug("Error closing CDP pipe input", e);
            }
        }
    }
}
