package org.netpreserve.docketcrawl.cdp.protocol;

/**
 * The connection to the browser was closed before a response arrived.
 */
public class CDPClosedException extends CDPException {
    public CDPClosedException() {
        super(0, "CDP connection closed");
        actuallyFillInStackTrace();
    }
}
