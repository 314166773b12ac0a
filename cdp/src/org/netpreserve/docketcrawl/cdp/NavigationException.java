package org.netpreserve.docketcrawl.cdp;

public class NavigationException extends Exception {
    protected final String url;

    public NavigationException(String url, String message) {
        super(message + " for " + url);
        this.url = url;
    }

    public NavigationException(String url, String message, Throwable cause) {
        super(message + " for " + url, cause);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
