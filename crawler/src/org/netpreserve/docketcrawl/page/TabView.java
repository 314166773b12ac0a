package org.netpreserve.docketcrawl.page;

import org.netpreserve.docketcrawl.SourceTab;

import java.util.List;

/**
 * Adapter for one document-listing tab of the case card. Holds every selector the tab depends on.
 */
public interface TabView {
    SourceTab tab();

    /**
     * Shows the tab in the window.
     *
     * @throws org.netpreserve.docketcrawl.ParseMismatchException if the tab's button or content is missing
     */
    void open() throws InterruptedException;

    /**
     * The independently paginated parts of the open tab, in display order.
     */
    List<? extends TabSection> sections();
}
