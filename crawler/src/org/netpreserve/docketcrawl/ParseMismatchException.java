package org.netpreserve.docketcrawl;

/**
 * The page structure didn't match what the page adapter expects.
 */
public class ParseMismatchException extends CrawlException {
    public ParseMismatchException(String message) {
        super(message, FATAL);
    }
}
