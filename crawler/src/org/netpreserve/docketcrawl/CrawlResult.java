package org.netpreserve.docketcrawl;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * Summary of one crawl run.
 *
 * @param discovered distinct documents listed over all tabs
 * @param fetched    documents fetched in this run
 * @param skipped    documents given up on in this run
 * @param completed  documents completed overall, including earlier runs
 */
public record CrawlResult(
        CrawlOutcome outcome,
        Path caseDirectory,
        int discovered,
        int fetched,
        int skipped,
        int completed,
        @Nullable String pausedReason
) {
    public int exitCode() {
        return switch (outcome) {
            case COMPLETED -> 0;
            case PAUSED -> CrawlException.RATE_LIMITED;
            case INTERRUPTED -> CrawlException.INTERRUPTED;
            case FAILED -> CrawlException.FATAL;
        };
    }
}
