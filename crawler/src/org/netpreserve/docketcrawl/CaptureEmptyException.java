package org.netpreserve.docketcrawl;

/**
 * An attachment-shaped response arrived but its body was empty, not of the expected type, or not a valid
 * attachment.
 */
public class CaptureEmptyException extends CaptureException {
    public CaptureEmptyException(String detail, String url) {
        super(detail, url);
    }
}
