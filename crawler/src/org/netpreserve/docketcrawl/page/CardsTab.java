package org.netpreserve.docketcrawl.page;

import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.Element;
import org.netpreserve.docketcrawl.InstanceRecord;
import org.netpreserve.docketcrawl.ParseMismatchException;
import org.netpreserve.docketcrawl.SourceTab;
import org.netpreserve.docketcrawl.cdp.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "Карточки": one accordion per judicial instance. Each header carries the instance's main decision and expands into
 * the instance's own paginated list of documents.
 */
public class CardsTab implements TabView {
    private static final Logger log = LoggerFactory.getLogger(CardsTab.class);
    static final String BUTTON = "div.js-case-chrono-button--cards";
    static final String VISIBLE_CONTENT = "#chrono_list_content:not(.g-hidden)";
    static final String HEADER = "#chrono_list_content .b-chrono-item-header.js-chrono-item-header";
    static final String HEADER_NAME = "div.l-col strong";
    static final String HEADER_REG_DATE = "div.l-col .b-reg-date";
    static final String HEADER_CASE_NUMBER = "div.r-col .b-case-link";
    static final String HEADER_COURT = "div.r-col .instantion-name";
    static final String COLLAPSE = ".b-collapse.js-collapse";
    static final String CONTAINER = ".b-chrono-items-container.js-chrono-items-container";
    static final String LINKS = "a[href*='PdfDocument']";
    private static final Pattern DATE = Pattern.compile("\\d{2}\\.\\d{2}\\.\\d{4}");
    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final Window window;
    private final String courtCode;
    private final Duration tabTimeout;
    private final Duration pageSwitchTimeout;

    /**
     * @param courtCode court prefix of the case number, recorded on every instance
     */
    public CardsTab(Window window, String courtCode, Duration tabTimeout, Duration pageSwitchTimeout) {
        this.window = window;
        this.courtCode = courtCode;
        this.tabTimeout = tabTimeout;
        this.pageSwitchTimeout = pageSwitchTimeout;
    }

    @Override
    public SourceTab tab() {
        return SourceTab.CARDS;
    }

    @Override
    public void open() throws InterruptedException {
        if (!window.click(BUTTON)) throw new ParseMismatchException("Cards tab button " + BUTTON + " not found");
        if (!window.waitForSelector(VISIBLE_CONTENT, tabTimeout)) {
            throw new ParseMismatchException("Cards tab content did not open");
        }
    }

    @Override
    public List<InstanceSection> sections() {
        int count = window.count(HEADER);
        var sections = new ArrayList<InstanceSection>(count);
        for (int i = 0; i < count; i++) {
            Element header = Snapshots.element(window, HEADER, i);
            if (header == null) throw new ParseMismatchException("Instance header " + i + " disappeared");
            sections.add(new InstanceSection(i, header));
        }
        return sections;
    }

    InstanceRecord parseInstance(Element header, int index) {
        String instanceId = header.attr("data-id");
        if (instanceId.isBlank()) instanceId = "inst_" + index;
        String regDate = textOf(header, HEADER_REG_DATE);
        if (regDate == null) {
            Element left = header.selectFirst("div.l-col");
            if (left != null) {
                Matcher m = DATE.matcher(left.text());
                if (m.find()) regDate = m.group();
            }
        }
        return new InstanceRecord(courtCode, instanceId, textOf(header, HEADER_NAME), regDate,
                textOf(header, HEADER_CASE_NUMBER), textOf(header, HEADER_COURT), index + 1);
    }

    @Nullable
    private static String textOf(Element scope, String selector) {
        Element element = scope.selectFirst(selector);
        if (element == null || element.text().isBlank()) return null;
        return element.text().strip();
    }

    public class InstanceSection implements TabSection {
        private final int index;
        private final Element header;
        private final InstanceRecord instance;

        InstanceSection(int index, Element header) {
            this.index = index;
            this.header = header;
            this.instance = parseInstance(header, index);
        }

        @Override
        public InstanceRecord instance() {
            return instance;
        }

        @Override
        public List<DocumentRow> headerRows() {
            return DocumentRows.parse(header, LINKS);
        }

        @Override
        public int open() throws InterruptedException {
            if (header.selectFirst(COLLAPSE) == null) {
                log.atDebug().addKeyValue("instance", instance.instanceId()).log("Instance has no document list");
                return 0;
            }
            Element container = Snapshots.element(window, CONTAINER, index);
            if (container == null) {
                throw new ParseMismatchException("No document container for instance " + instance.instanceId());
            }
            if (Snapshots.isHidden(container)) {
                window.clickWithin(HEADER, index, COLLAPSE);
                container = awaitExpanded();
                if (container == null) {
                    log.atWarn().addKeyValue("instance", instance.instanceId())
                            .log("Instance document list did not expand, skipping it");
                    return 0;
                }
            }
            int pages = Pagination.maxPage(container);
            if (pages > 1 && Pagination.activePage(container) != 1) showPage(1);
            return pages;
        }

        @Nullable
        private Element awaitExpanded() throws InterruptedException {
            long deadline = System.nanoTime() + tabTimeout.toNanos();
            while (true) {
                Element container = Snapshots.element(window, CONTAINER, index);
                if (container != null && !Snapshots.isHidden(container)) return container;
                if (System.nanoTime() >= deadline) return null;
                Thread.sleep(POLL_INTERVAL.toMillis());
            }
        }

        @Override
        public void showPage(int page) throws InterruptedException {
            Pagination.switchTo(window, CONTAINER, index, LINKS, page, pageSwitchTimeout);
        }

        @Override
        public List<DocumentRow> rows() {
            Element container = Snapshots.element(window, CONTAINER, index);
            if (container == null) {
                throw new ParseMismatchException("Document container for instance " + instance.instanceId()
                                                 + " disappeared");
            }
            return DocumentRows.parse(container, LINKS);
        }
    }
}
