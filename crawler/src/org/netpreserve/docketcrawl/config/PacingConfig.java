package org.netpreserve.docketcrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.docketcrawl.util.jackson.DurationDeserializer;

import java.time.Duration;

/**
 * Human-like delays. Every delay is its base plus a uniformly random share of its jitter.
 *
 * @param documentsBeforeBreak a break is taken after roughly this many documents
 * @param breakEveryJitter     the break threshold varies by up to this many documents either way
 */
public record PacingConfig(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration betweenDocuments,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration betweenDocumentsJitter,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration betweenPages,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration betweenPagesJitter,
        int documentsBeforeBreak,
        int breakEveryJitter,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration breakDuration,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration breakJitter
) {
}
