package org.netpreserve.docketcrawl.page;

import org.jsoup.nodes.Element;
import org.netpreserve.docketcrawl.ParseMismatchException;
import org.netpreserve.docketcrawl.SourceTab;
import org.netpreserve.docketcrawl.cdp.Window;

import java.time.Duration;
import java.util.List;

/**
 * "Электронное дело": every filing of the case in one paginated list.
 */
public class CaseFileTab implements TabView {
    static final String BUTTON = "div.js-case-chrono-button--ed";
    static final String CONTENT = "#chrono_ed_content";
    static final String VISIBLE_CONTENT = "#chrono_ed_content:not(.g-hidden)";
    static final String LINKS = "a.b-case-chrono-ed-item-link[href*='PdfDocument']";
    private final Window window;
    private final Duration tabTimeout;
    private final Duration pageSwitchTimeout;

    public CaseFileTab(Window window, Duration tabTimeout, Duration pageSwitchTimeout) {
        this.window = window;
        this.tabTimeout = tabTimeout;
        this.pageSwitchTimeout = pageSwitchTimeout;
    }

    @Override
    public SourceTab tab() {
        return SourceTab.ELECTRONIC_CASE;
    }

    @Override
    public void open() throws InterruptedException {
        if (!window.click(BUTTON)) throw new ParseMismatchException("Case file tab button " + BUTTON + " not found");
        if (!window.waitForSelector(VISIBLE_CONTENT, tabTimeout)) {
            throw new ParseMismatchException("Case file tab content " + CONTENT + " did not open");
        }
    }

    @Override
    public List<TabSection> sections() {
        return List.of(new TabSection() {
            @Override
            public int open() throws InterruptedException {
                Element content = content();
                int pages = Pagination.maxPage(content);
                // a list left on a later page by an earlier pass starts over
                if (pages > 1 && Pagination.activePage(content) != 1) showPage(1);
                return pages;
            }

            @Override
            public void showPage(int page) throws InterruptedException {
                Pagination.switchTo(window, CONTENT, 0, LINKS, page, pageSwitchTimeout);
            }

            @Override
            public List<DocumentRow> rows() {
                return DocumentRows.parse(content(), LINKS);
            }
        });
    }

    private Element content() {
        Element content = Snapshots.element(window, CONTENT);
        if (content == null) throw new ParseMismatchException("Case file tab content disappeared");
        return content;
    }
}
