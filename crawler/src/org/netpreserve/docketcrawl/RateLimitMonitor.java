package org.netpreserve.docketcrawl;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Recognizes the archive's throttling pages by exact phrase containment, ignoring case.
 */
public class RateLimitMonitor {
    private final List<String> phrases;

    public RateLimitMonitor(List<String> phrases) {
        this.phrases = phrases.stream()
                .filter(phrase -> !phrase.isBlank())
                .toList();
    }

    public RateLimitStatus check(@Nullable String pageText) {
        if (pageText == null || pageText.isEmpty()) return RateLimitStatus.CLEAR;
        String text = pageText.toLowerCase(Locale.ROOT);
        for (String phrase : phrases) {
            if (text.contains(phrase.toLowerCase(Locale.ROOT))) return new RateLimitStatus(true, phrase);
        }
        return RateLimitStatus.CLEAR;
    }

    /**
     * @throws RateLimitedException if the text contains a throttling phrase
     */
    public void checkOrThrow(@Nullable String pageText) {
        var status = check(pageText);
        if (status.rateLimited()) throw new RateLimitedException(status.phrase());
    }

    /**
     * @param phrase the phrase that matched, null when clear
     */
    public record RateLimitStatus(boolean rateLimited, @Nullable String phrase) {
        public static final RateLimitStatus CLEAR = new RateLimitStatus(false, null);
    }
}
