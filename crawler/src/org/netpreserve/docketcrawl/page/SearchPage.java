package org.netpreserve.docketcrawl.page;

import org.jsoup.nodes.Element;
import org.netpreserve.docketcrawl.cdp.Window;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * The archive's front page: case number input with a suggestion dropdown.
 */
public class SearchPage {
    public static final String FORM = "#sug-cases";
    static final String INPUT = "#sug-cases input";
    static final String SUGGESTIONS = "#b-suggest li a, .b-suggest li a";
    static final String PROMO_CLOSE = "a.js-promo_notification-popup-close";
    static final String ZERO_GUID = "00000000-0000-0000-0000-000000000000";
    private final Window window;

    public SearchPage(Window window) {
        this.window = window;
    }

    public boolean waitForForm(Duration timeout) throws InterruptedException {
        return window.waitForSelector(FORM, timeout);
    }

    /**
     * Closes the promotional popup if it is showing.
     *
     * @return whether a popup was closed
     */
    public boolean dismissPromo() {
        return window.count(PROMO_CLOSE) > 0 && window.click(PROMO_CLOSE);
    }

    public void enterCaseNumber(String caseNumber, Duration keystrokeDelay) throws InterruptedException {
        window.click(INPUT);
        window.typeText(INPUT, caseNumber, keystrokeDelay);
    }

    public boolean waitForSuggestions(Duration timeout) throws InterruptedException {
        return window.waitForSelector(SUGGESTIONS, timeout);
    }

    /**
     * Suggestions in dropdown order, without placeholder entries that carry no case GUID.
     */
    public List<Suggestion> suggestions() {
        var suggestions = new ArrayList<Suggestion>();
        int count = window.count(SUGGESTIONS);
        for (int i = 0; i < count; i++) {
            Element link = Snapshots.element(window, SUGGESTIONS, i);
            if (link == null) continue;
            String guid = link.id().strip();
            if (guid.isEmpty() || guid.equals(ZERO_GUID)) continue;
            suggestions.add(new Suggestion(guid, link.text().strip()));
        }
        return suggestions;
    }

    public record Suggestion(String caseGuid, String text) {
    }
}
