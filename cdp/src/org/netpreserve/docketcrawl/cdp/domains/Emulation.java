package org.netpreserve.docketcrawl.cdp.domains;

public interface Emulation {
    void setUserAgentOverride(String userAgent, String acceptLanguage, String platform);

    void setLocaleOverride(String locale);

    void setTimezoneOverride(String timezoneId);
}
