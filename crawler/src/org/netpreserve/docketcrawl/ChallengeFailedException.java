package org.netpreserve.docketcrawl;

/**
 * The archive never showed post-challenge content.
 */
public class ChallengeFailedException extends CrawlException {
    public ChallengeFailedException(String message) {
        super(message, CHALLENGE_FAILED);
    }

    public ChallengeFailedException(String message, Throwable cause) {
        super(message, CHALLENGE_FAILED, cause);
    }
}
