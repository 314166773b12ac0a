package org.netpreserve.docketcrawl.cdp.protocol;

import org.netpreserve.docketcrawl.cdp.domains.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Browser-level connection. Messages carrying a session id are routed to the matching {@link CDPSession}.
 */
public class CDPClient extends CDPBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CDPClient.class);
    private final AtomicLong commandIds = new AtomicLong();
    private final CountDownLatch disconnected = new CountDownLatch(1);
    private final Map<String, CDPSession> sessions = new ConcurrentHashMap<>();
    final RPC rpc;

    public CDPClient(URI devtoolsUrl) throws IOException {
        this.rpc = new RPC.Socket(devtoolsUrl, this::handleMessage, this::handleRpcClose);
        watchDetachedSessions();
    }

    public CDPClient(InputStream inputStream, OutputStream outputStream) {
        this.rpc = new RPC.Pipe(inputStream, outputStream, this::handleMessage, this::handleRpcClose);
        watchDetachedSessions();
    }

    /**
     * For tests: a client over an arbitrary transport.
     */
    CDPClient(Function<CDPClient, RPC> transportFactory) {
        this.rpc = transportFactory.apply(this);
        watchDetachedSessions();
    }

    private void watchDetachedSessions() {
        domain(Target.class).onDetachedFromTarget(event -> {
            var session = sessions.get(event.sessionId());
            if (session != null) session.detached();
        });
    }

    void register(CDPSession session) {
        sessions.put(session.sessionId(), session);
    }

    void unregister(CDPSession session) {
        sessions.remove(session.sessionId(), session);
    }

    @Override
    public void close() {
        rpc.close();
        super.close();
    }

    @Override
    protected void handleMessage(RPC.ServerMessage message) {
        if (message.sessionId() == null) {
            super.handleMessage(message);
            return;
        }
        var session = sessions.get(message.sessionId());
        if (session != null) {
            session.handleMessage(message);
        } else {
            log.atDebug().addKeyValue("session", message.sessionId()).log("Ignoring message for unknown session");
        }
    }

    @Override
    protected void handleRpcClose() {
        super.handleRpcClose();
        sessions.values().forEach(CDPBase::handleRpcClose);
        disconnected.countDown();
    }

    /**
     * Waits for the browser end of the connection to close.
     */
    public boolean waitClose(Duration timeout) throws InterruptedException {
        return disconnected.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isClosed() {
        return disconnected.getCount() == 0;
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        rpc.send(new RPC.Command(commandId, method, params, null));
    }

    @Override
    protected long nextCommandId() {
        return commandIds.incrementAndGet();
    }
}
