package org.netpreserve.docketcrawl;

public class CrawlInterruptedException extends CrawlException {
    public CrawlInterruptedException(String message) {
        super(message, INTERRUPTED);
    }

    public CrawlInterruptedException(String message, Throwable cause) {
        super(message, INTERRUPTED, cause);
    }
}
