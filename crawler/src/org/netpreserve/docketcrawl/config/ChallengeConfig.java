package org.netpreserve.docketcrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.docketcrawl.util.jackson.DurationDeserializer;

import java.time.Duration;

/**
 * Challenge handshake and session warmth.
 *
 * @param readySelector        element that only appears once the challenge has been passed
 * @param handshakeTimeout     how long one acquisition attempt may take
 * @param maxAcquireAttempts   acquisition attempts before giving up
 * @param acquireRetryDelay    pause between acquisition attempts
 * @param rewarmIdleThreshold  idle time after which a warm session is considered stale
 * @param rewarmSettle         pause after a re-warm before real fetches resume
 * @param warmupUrl            attachment-shaped URL fetched during re-warm when no attachment has been fetched yet
 */
public record ChallengeConfig(
        String readySelector,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration handshakeTimeout,
        int maxAcquireAttempts,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration acquireRetryDelay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration rewarmIdleThreshold,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration rewarmSettle,
        String warmupUrl
) {
}
