package org.netpreserve.docketcrawl.page;

import org.apache.commons.lang3.math.NumberUtils;
import org.jsoup.nodes.Element;
import org.netpreserve.docketcrawl.ParseMismatchException;
import org.netpreserve.docketcrawl.cdp.Window;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * The chrono pager used by the cards and case-file tabs.
 */
public final class Pagination {
    static final String PAGER_ITEM = ".js-chrono-pagination-pager-item[data-page_num]";
    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private Pagination() {
    }

    /**
     * Highest page number over all pager items in the scope, read in one pass. Missing, zero or unparsable page
     * numbers mean a single page.
     */
    public static int maxPage(Element scope) {
        int max = 1;
        for (Element item : scope.select(PAGER_ITEM)) {
            max = Math.max(max, NumberUtils.toInt(item.attr("data-page_num").strip(), 0));
        }
        return max;
    }

    /**
     * Page number of the active pager item, 1 if none is marked active.
     */
    public static int activePage(Element scope) {
        Element active = scope.selectFirst(PAGER_ITEM + ".active");
        return active == null ? 1 : Math.max(1, NumberUtils.toInt(active.attr("data-page_num").strip(), 1));
    }

    static String itemFor(int page) {
        return ".js-chrono-pagination-pager-item[data-page_num='" + page + "']";
    }

    /**
     * Clicks the pager item for the page inside the index'th scope element and waits for the listing to change to
     * it: either the item becomes active or the list of links differs from what it was before the click.
     *
     * @throws ParseMismatchException if there is no such pager item or the listing never changed
     */
    static void switchTo(Window window, String scopeSelector, int index, String linkSelector, int page,
                         Duration timeout) throws InterruptedException {
        Element before = Snapshots.element(window, scopeSelector, index);
        List<String> linksBefore = before == null ? List.of() : before.select(linkSelector).eachAttr("href");
        if (!window.clickWithin(scopeSelector, index, itemFor(page))) {
            throw new ParseMismatchException("No pager item for page " + page + " in " + scopeSelector);
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Element after = Snapshots.element(window, scopeSelector, index);
            if (after != null) {
                Element item = after.selectFirst(itemFor(page));
                boolean active = item != null && item.className().contains("active");
                if (active || !Objects.equals(linksBefore, after.select(linkSelector).eachAttr("href"))) return;
            }
            if (System.nanoTime() >= deadline) {
                throw new ParseMismatchException("Page " + page + " of " + scopeSelector + " did not load");
            }
            Thread.sleep(POLL_INTERVAL.toMillis());
        }
    }
}
