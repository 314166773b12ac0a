package org.netpreserve.docketcrawl;

public enum CrawlOutcome {
    COMPLETED,
    PAUSED,
    INTERRUPTED,
    FAILED
}
