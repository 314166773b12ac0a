package org.netpreserve.docketcrawl;

/**
 * A single attachment capture attempt failed. Retryable.
 */
public abstract class CaptureException extends CrawlException {
    private final String url;

    protected CaptureException(String message, String url) {
        super(message + ": " + url, FATAL);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
