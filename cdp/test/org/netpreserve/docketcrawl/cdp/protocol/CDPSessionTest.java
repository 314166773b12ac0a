package org.netpreserve.docketcrawl.cdp.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CDPSessionTest {
    private final List<RPC.Command> sent = new CopyOnWriteArrayList<>();
    private CDPClient client;

    interface Tab {
        CompletionStage<Void> reloadAsync();

        void stopLoading();
    }

    @BeforeEach
    void setUp() {
        client = new CDPClient(owner -> new RPC() {
            @Override
            public void send(Command message) {
                sent.add(message);
                // only browser-level commands get an answer
                if (message.sessionId() == null) {
                    owner.handleMessage(new Response(message.id(), RPC.JSON.createObjectNode(), null, null));
                }
            }

            @Override
            public void close() {
            }
        });
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    @Test
    void commandsCarryTheSessionId() {
        var session = new CDPSession(client, "s1", "t1");
        session.domain(Tab.class).reloadAsync();
        assertEquals("Tab.reload", sent.get(0).method());
        assertEquals("s1", sent.get(0).sessionId());
    }

    @Test
    void detachFailsPendingCommands() throws Exception {
        var session = new CDPSession(client, "s1", "t1");
        var pending = session.domain(Tab.class).reloadAsync().toCompletableFuture();

        client.handleMessage(new RPC.Event("Target.detachedFromTarget",
                (ObjectNode) RPC.JSON.readTree("{\"sessionId\":\"s1\",\"targetId\":\"t1\"}"), null));

        var e = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        assertInstanceOf(CDPClosedException.class, e.getCause());
        assertTrue(session.isClosed());
        assertThrows(CDPClosedException.class, () -> session.domain(Tab.class).stopLoading());
    }

    @Test
    void closeClosesTheTabOnce() {
        var session = new CDPSession(client, "s1", "t1");
        session.close();
        session.close();
        assertEquals(1, sent.stream().filter(command -> command.method().equals("Target.closeTarget")).count());
        assertEquals("t1", sent.get(0).params().get("targetId"));
        assertTrue(session.isClosed());
    }
}
