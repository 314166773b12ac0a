package org.netpreserve.docketcrawl;

/**
 * Base class of every error a crawl can end with. Each carries the process exit code the CLI reports for it.
 */
public class CrawlException extends RuntimeException {
    public static final int FATAL = 1;
    public static final int INVALID_CASE_NUMBER = 2;
    public static final int CHALLENGE_FAILED = 3;
    public static final int RATE_LIMITED = 4;
    public static final int NOT_FOUND = 5;
    public static final int INTERRUPTED = 130;

    private final int exitCode;

    public CrawlException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public CrawlException(String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
