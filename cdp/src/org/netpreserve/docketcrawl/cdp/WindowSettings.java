package org.netpreserve.docketcrawl.cdp;

/**
 * Per-window emulation overrides. Null fields leave the browser default in place.
 */
public record WindowSettings(String userAgent, String acceptLanguage, String locale, String timezoneId) {
    public static final WindowSettings DEFAULTS = new WindowSettings(null, null, null, null);
}
