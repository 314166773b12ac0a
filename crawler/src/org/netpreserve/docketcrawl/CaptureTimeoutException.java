package org.netpreserve.docketcrawl;

public class CaptureTimeoutException extends CaptureException {
    public CaptureTimeoutException(String url) {
        super("No attachment response arrived in time", url);
    }
}
