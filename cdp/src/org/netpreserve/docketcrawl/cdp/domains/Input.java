package org.netpreserve.docketcrawl.cdp.domains;

public interface Input {
    /**
     * Emulates text entry by an input method, firing input events on the focused element.
     */
    void insertText(String text);
}
