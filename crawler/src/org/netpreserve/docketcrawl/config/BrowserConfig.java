package org.netpreserve.docketcrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.docketcrawl.cdp.WindowSettings;
import org.netpreserve.docketcrawl.util.jackson.ArgumentListDeserializer;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration for the browser.
 *
 * @param executable     binary to invoke (e.g. "chromium"), probed for when absent
 * @param headless       run without a visible window
 * @param options        extra command-line options
 * @param profileDir     persistent user data directory, a temporary one when absent
 * @param userAgent      User-Agent override
 * @param acceptLanguage Accept-Language override, only applied together with userAgent
 * @param locale         ICU locale override, e.g. "ru-RU"
 * @param timezone       time zone override, e.g. "Europe/Moscow"
 */
public record BrowserConfig(
        String executable,
        boolean headless,
        @JsonDeserialize(using = ArgumentListDeserializer.class)
        List<String> options,
        Path profileDir,
        String userAgent,
        String acceptLanguage,
        String locale,
        String timezone
) {
    public WindowSettings windowSettings() {
        return new WindowSettings(userAgent, acceptLanguage, locale, timezone);
    }
}
