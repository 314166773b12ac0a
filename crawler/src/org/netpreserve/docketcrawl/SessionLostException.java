package org.netpreserve.docketcrawl;

/**
 * The primary window could no longer reach archive content and has to be acquired again.
 */
public class SessionLostException extends CrawlException {
    public SessionLostException(String message, Throwable cause) {
        super(message, CHALLENGE_FAILED, cause);
    }
}
