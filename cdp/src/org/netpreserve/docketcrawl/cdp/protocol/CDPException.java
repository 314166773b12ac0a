package org.netpreserve.docketcrawl.cdp.protocol;

/**
 * Error reported by the browser in response to a command.
 */
public class CDPException extends RuntimeException {
    private final int code;

    public CDPException(int code, String message) {
        super(message + " [" + code + "]");
        this.code = code;
    }

    // responses are completed on the event thread so the stack trace is filled in by the waiting caller instead
    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }

    public void actuallyFillInStackTrace() {
        super.fillInStackTrace();
    }

    public int getCode() {
        return code;
    }
}
