package org.netpreserve.docketcrawl;

/**
 * The archive is throttling the session. The crawl pauses and can be resumed later.
 */
public class RateLimitedException extends CrawlException {
    private final String phrase;

    public RateLimitedException(String phrase) {
        super("Rate limited: page says '" + phrase + "'", RATE_LIMITED);
        this.phrase = phrase;
    }

    public String phrase() {
        return phrase;
    }
}
