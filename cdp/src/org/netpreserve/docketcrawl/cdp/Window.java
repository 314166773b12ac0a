package org.netpreserve.docketcrawl.cdp;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A browser window (page target) that can be navigated, queried and clicked.
 * <p>
 * Selectors are CSS selectors evaluated by the page's {@code querySelectorAll}. Element indexes are zero-based in
 * document order.
 */
public interface Window extends AutoCloseable {

    /**
     * Navigates to a URL and waits for the given lifecycle milestone of the new document.
     *
     * @throws NavigationFailedException if the browser reports a network error for the navigation
     * @throws NavigationTimedOutException if the milestone is not reached within the timeout
     */
    void navigate(String url, WaitUntil waitUntil, Duration timeout) throws NavigationException, InterruptedException;

    String currentUrl();

    /**
     * Visible text of the document body, or the empty string while there is no body.
     */
    String bodyText();

    /**
     * Outer HTML of the first element matching the selector, or null if none matches.
     */
    @Nullable
    default String outerHtml(String selector) {
        return outerHtml(selector, 0);
    }

    /**
     * Outer HTML of the index'th element matching the selector, or null if there is no such element.
     */
    @Nullable
    String outerHtml(String selector, int index);

    int count(String selector);

    /**
     * Clicks the first element matching the selector.
     *
     * @return false if no element matched
     */
    default boolean click(String selector) {
        return click(selector, 0);
    }

    boolean click(String selector, int index);

    /**
     * Clicks the first element matching selector inside the index'th element matching scopeSelector.
     *
     * @return false if either element is missing
     */
    boolean clickWithin(String scopeSelector, int index, String selector);

    /**
     * Waits until at least one element matches the selector.
     *
     * @return false if the timeout elapsed first
     */
    boolean waitForSelector(String selector, Duration timeout) throws InterruptedException;

    /**
     * Focuses the element matching selector, clears it and enters the text one character at a time.
     */
    void typeText(String selector, String text, Duration keystrokeDelay) throws InterruptedException;

    /**
     * Registers a listener for responses to requests made by this window whose URL matches the filter. The
     * listener is armed when this method returns and stays registered until the window is closed. Listeners are
     * called on the protocol event thread and must not block.
     */
    void interceptResponses(Predicate<String> urlFilter, Consumer<InterceptedResponse> listener);

    @Override
    void close();
}
