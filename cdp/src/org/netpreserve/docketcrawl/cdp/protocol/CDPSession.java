package org.netpreserve.docketcrawl.cdp.protocol;

import org.netpreserve.docketcrawl.cdp.domains.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A flattened session attached to one tab. Commands share the browser connection and carry the session id.
 * Closing the session closes its tab.
 */
public class CDPSession extends CDPBase {
    private static final Logger log = LoggerFactory.getLogger(CDPSession.class);
    private final String sessionId;
    private final String targetId;
    private final CDPClient client;
    private final AtomicBoolean closed = new AtomicBoolean();

    public CDPSession(CDPClient client, String sessionId, String targetId) {
        this.client = client;
        this.sessionId = sessionId;
        this.targetId = targetId;
        client.register(this);
    }

    String sessionId() {
        return sessionId;
    }

    public String targetId() {
        return targetId;
    }

    public boolean isClosed() {
        return closed.get() || client.isClosed();
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        if (isClosed()) throw new CDPClosedException();
        client.rpc.send(new RPC.Command(commandId, method, params, sessionId));
    }

    @Override
    protected long nextCommandId() {
        return client.nextCommandId();
    }

    /**
     * The browser ended the session (tab closed or crashed): pending commands fail at once.
     */
    void detached() {
        if (closed.compareAndSet(false, true)) {
            log.atDebug().addKeyValue("target", targetId).log("Session detached");
            handleRpcClose();
            client.unregister(this);
            super.close();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        if (!client.isClosed()) {
            try {
                client.domain(Target.class).closeTarget(targetId);
            } catch (CDPException e) {
                log.atWarn().addKeyValue("target", targetId).log("Unable to close tab: {}", e.getMessage());
            }
        }
        handleRpcClose();
        client.unregister(this);
        super.close();
    }
}
