package org.netpreserve.docketcrawl.cdp.domains;

import java.util.function.Consumer;

public interface Target {
    CreateTarget createTarget(String url, Boolean newWindow, Boolean background, Integer width, Integer height);

    AttachToTarget attachToTarget(String targetId, boolean flatten);

    void closeTarget(String targetId);

    /**
     * Fires when a tab closes or crashes and its session ends.
     */
    void onDetachedFromTarget(Consumer<DetachedFromTarget> handler);

    record CreateTarget(String targetId) {
    }

    record AttachToTarget(String sessionId) {
    }

    record DetachedFromTarget(String sessionId, String targetId) {
    }
}
