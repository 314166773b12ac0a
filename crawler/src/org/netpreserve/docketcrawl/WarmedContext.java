package org.netpreserve.docketcrawl;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.docketcrawl.cdp.Window;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * The primary window after it has passed the challenge, with its warmth bookkeeping.
 */
public class WarmedContext {
    public enum Status {COLD, WARM, STALE}

    private final Window window;
    private final Clock clock;
    private final Duration idleThreshold;
    private volatile boolean cold;
    private volatile Instant lastActivity;
    private volatile String lastAttachmentUrl;

    WarmedContext(Window window, Clock clock, Duration idleThreshold) {
        this.window = window;
        this.clock = clock;
        this.idleThreshold = idleThreshold;
        this.lastActivity = clock.instant();
    }

    public Window window() {
        return window;
    }

    public Status status() {
        if (cold) return Status.COLD;
        if (Duration.between(lastActivity, clock.instant()).compareTo(idleThreshold) > 0) return Status.STALE;
        return Status.WARM;
    }

    /**
     * Records activity on the session, postponing staleness.
     */
    public void touch() {
        lastActivity = clock.instant();
    }

    public void recordAttachmentUrl(String url) {
        lastAttachmentUrl = url;
        touch();
    }

    @Nullable
    public String lastAttachmentUrl() {
        return lastAttachmentUrl;
    }

    void markCold() {
        cold = true;
    }

    void markWarm() {
        cold = false;
        touch();
    }
}
