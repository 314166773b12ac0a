package org.netpreserve.docketcrawl.page;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.docketcrawl.InstanceRecord;

import java.util.List;

/**
 * A paginated list of documents within a tab: the whole tab for flat tabs, one instance accordion on the cards tab.
 */
public interface TabSection {
    /**
     * The judicial instance this section belongs to, null for flat tabs.
     */
    @Nullable
    default InstanceRecord instance() {
        return null;
    }

    /**
     * Rows listed outside the pagination (the instance header), reported as page 0.
     */
    default List<DocumentRow> headerRows() {
        return List.of();
    }

    /**
     * Makes the paginated list visible and returns its page count, or 0 if the section has no list.
     */
    int open() throws InterruptedException;

    /**
     * Switches the list to the given page.
     */
    void showPage(int page) throws InterruptedException;

    /**
     * Rows on the page currently shown.
     */
    List<DocumentRow> rows();
}
