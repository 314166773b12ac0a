package org.netpreserve.docketcrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.docketcrawl.util.jackson.DurationDeserializer;

import java.time.Duration;

/**
 * Attachment fetching.
 *
 * @param timeout                          capture timeout for one attempt
 * @param maxRetries                       attempts per document before it is skipped
 * @param retryBaseDelay                   backoff unit, doubled on every attempt
 * @param retryJitter                      random extra backoff
 * @param maxConcurrent                    attachment fetches in flight at once
 * @param consecutiveFailuresBeforeRewarm  skipped documents in a row that trigger a session re-warm
 */
public record FetchConfig(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        int maxRetries,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration retryBaseDelay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration retryJitter,
        int maxConcurrent,
        int consecutiveFailuresBeforeRewarm
) {
}
