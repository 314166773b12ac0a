package org.netpreserve.docketcrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.docketcrawl.util.jackson.DurationDeserializer;

import java.time.Duration;

/**
 * Timeouts for driving the primary window.
 *
 * @param pageLoadTimeout  navigation to the card page
 * @param cardTimeout      wait for the card content after navigation
 * @param suggestTimeout   wait for the search suggestion dropdown
 * @param tabTimeout       wait for a tab or an accordion to open
 * @param pageSwitchTimeout wait for a pagination click to take effect
 * @param keystrokeDelay   delay between typed characters
 * @param popupSettle      wait before looking for the promo popup
 */
public record NavigationConfig(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration pageLoadTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration cardTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration suggestTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration tabTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration pageSwitchTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration keystrokeDelay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration popupSettle
) {
}
