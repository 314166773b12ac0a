package org.netpreserve.docketcrawl.cdp;

public class NavigationTimedOutException extends NavigationException {
    public NavigationTimedOutException(String url, String message) {
        super(url, message);
    }
}
