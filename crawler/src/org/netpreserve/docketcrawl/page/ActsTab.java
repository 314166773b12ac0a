package org.netpreserve.docketcrawl.page;

import org.jsoup.nodes.Element;
import org.netpreserve.docketcrawl.ParseMismatchException;
import org.netpreserve.docketcrawl.SourceTab;
import org.netpreserve.docketcrawl.cdp.Window;

import java.time.Duration;
import java.util.List;

/**
 * "Судебные акты": a single unpaginated list of the court's decisions.
 */
public class ActsTab implements TabView {
    static final String BUTTON = "#case_acts";
    static final String CONTAINER = "#gr_case_acts";
    static final String LINKS = "a[href*='PdfDocument']";
    private final Window window;
    private final Duration timeout;

    public ActsTab(Window window, Duration timeout) {
        this.window = window;
        this.timeout = timeout;
    }

    @Override
    public SourceTab tab() {
        return SourceTab.COURT_ACTS;
    }

    @Override
    public void open() throws InterruptedException {
        // the acts are usually shown without clicking
        window.click(BUTTON);
        if (!window.waitForSelector(CONTAINER, timeout)) {
            throw new ParseMismatchException("Court acts container " + CONTAINER + " not found");
        }
    }

    @Override
    public List<TabSection> sections() {
        return List.of(new TabSection() {
            @Override
            public int open() {
                return 1;
            }

            @Override
            public void showPage(int page) {
                throw new IllegalArgumentException("Court acts are not paginated");
            }

            @Override
            public List<DocumentRow> rows() {
                Element container = Snapshots.element(window, CONTAINER);
                if (container == null) throw new ParseMismatchException("Court acts container disappeared");
                return DocumentRows.parse(container, LINKS);
            }
        });
    }
}
