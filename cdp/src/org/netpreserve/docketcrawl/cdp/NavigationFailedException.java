package org.netpreserve.docketcrawl.cdp;

public class NavigationFailedException extends NavigationException {
    private final String errorText;

    public NavigationFailedException(String url, String errorText) {
        super(url, errorText);
        this.errorText = errorText;
    }

    /**
     * Network error text reported by the browser, e.g. "net::ERR_ABORTED".
     */
    public String errorText() {
        return errorText;
    }
}
