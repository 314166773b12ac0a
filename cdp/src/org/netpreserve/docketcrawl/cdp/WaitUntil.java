package org.netpreserve.docketcrawl.cdp;

/**
 * Page lifecycle milestone a navigation waits for.
 */
public enum WaitUntil {
    DOM_CONTENT_LOADED("DOMContentLoaded"),
    LOAD("load");

    private final String lifecycleEventName;

    WaitUntil(String lifecycleEventName) {
        this.lifecycleEventName = lifecycleEventName;
    }

    public String lifecycleEventName() {
        return lifecycleEventName;
    }
}
