package org.netpreserve.docketcrawl;

import org.netpreserve.docketcrawl.cdp.NavigationException;
import org.netpreserve.docketcrawl.cdp.WaitUntil;
import org.netpreserve.docketcrawl.cdp.Window;
import org.netpreserve.docketcrawl.config.CrawlerConfig;
import org.netpreserve.docketcrawl.config.NavigationConfig;
import org.netpreserve.docketcrawl.page.ActsTab;
import org.netpreserve.docketcrawl.page.CardPage;
import org.netpreserve.docketcrawl.page.CardsTab;
import org.netpreserve.docketcrawl.page.CaseFileTab;
import org.netpreserve.docketcrawl.page.SearchPage;
import org.netpreserve.docketcrawl.page.TabSection;
import org.netpreserve.docketcrawl.page.TabView;
import org.netpreserve.docketcrawl.util.Pacer;
import org.netpreserve.docketcrawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives the primary window through search, the case card and its document tabs. Not thread-safe: the primary
 * window has a single user.
 */
public class NavigationEngine {
    private static final Logger log = LoggerFactory.getLogger(NavigationEngine.class);

    public enum State {SEARCH, CARD_OPEN, ACTS_TAB, CARDS_TAB, EFILE_TAB, DONE}

    private final WarmedContext context;
    private final CaseNumber caseNumber;
    private final CrawlerConfig config;
    private final NavigationConfig navigation;
    private final RateLimitMonitor rateLimitMonitor;
    private final Pacer pacer;
    private final Sleeper sleeper;
    private final Clock clock;
    private State state = State.SEARCH;
    private String cardUrl;
    private String courtCode;

    /**
     * @param caseNumber the case being crawled, used when the card header doesn't name it
     */
    public NavigationEngine(WarmedContext context, CaseNumber caseNumber, CrawlerConfig config,
                            RateLimitMonitor rateLimitMonitor, Pacer pacer, Sleeper sleeper, Clock clock) {
        this.context = context;
        this.caseNumber = caseNumber;
        this.courtCode = caseNumber.courtCode();
        this.config = config;
        this.navigation = config.navigation();
        this.rateLimitMonitor = rateLimitMonitor;
        this.pacer = pacer;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public State state() {
        return state;
    }

    public boolean isCardOpen() {
        return cardUrl != null;
    }

    private Window window() {
        return context.window();
    }

    /**
     * Looks the case up through the search suggestions.
     *
     * @throws CaseNotFoundException     if nothing or only an unrelated case is suggested
     * @throws AmbiguousResultException  if several suggestions appear and the first isn't the case
     */
    public SearchResult search(CaseNumber caseNumber) throws InterruptedException {
        transition(State.SEARCH);
        var page = new SearchPage(window());
        if (!page.waitForForm(navigation.suggestTimeout())) {
            checkRateLimit();
            throw new SessionLostException("Search form " + SearchPage.FORM + " is not present", null);
        }
        sleeper.sleep(navigation.popupSettle());
        if (page.dismissPromo()) log.info("Closed promo popup");
        page.enterCaseNumber(caseNumber.value(), navigation.keystrokeDelay());
        boolean shown = page.waitForSuggestions(navigation.suggestTimeout());
        checkRateLimit();
        var result = choose(caseNumber, shown ? page.suggestions() : List.of());
        log.atInfo().addKeyValue("case", caseNumber).addKeyValue("guid", result.caseGuid()).log("Found case");
        return result;
    }

    /**
     * Picks the first suggestion if it is the requested case, otherwise escalates.
     */
    static SearchResult choose(CaseNumber caseNumber, List<SearchPage.Suggestion> suggestions) {
        if (suggestions.isEmpty()) {
            throw new CaseNotFoundException("No search suggestion for " + caseNumber);
        }
        var first = suggestions.get(0);
        if (CaseNumber.find(first.text()).map(caseNumber::equals).orElse(false)) {
            var fields = new LinkedHashMap<String, String>();
            fields.put("suggestion", first.text());
            fields.put("suggestion_count", String.valueOf(suggestions.size()));
            return new SearchResult(first.caseGuid(), fields);
        }
        if (suggestions.size() > 1) {
            throw new AmbiguousResultException(caseNumber.value(),
                    suggestions.stream().map(SearchPage.Suggestion::text).toList());
        }
        throw new CaseNotFoundException("The only suggestion for " + caseNumber + " is a different case: "
                                        + first.text());
    }

    /**
     * Opens the case card and reads its header.
     *
     * @throws SessionLostException if the card doesn't load
     */
    public CaseRecord openCard(String caseGuid) throws InterruptedException {
        this.cardUrl = config.archive().cardUrl(caseGuid);
        loadCard();
        transition(State.CARD_OPEN);
        var card = new CardPage(window()).parse();
        String caseNumber = card.caseNumber() != null ? card.caseNumber() : this.caseNumber.value();
        courtCode = CaseNumber.find(caseNumber).map(CaseNumber::courtCode)
                .orElse(caseNumber.contains("-") ? caseNumber.substring(0, caseNumber.indexOf('-'))
                        : this.caseNumber.courtCode());
        log.atInfo().addKeyValue("case", caseNumber).addKeyValue("status", card.status()).log("Opened case card");
        return new CaseRecord(caseNumber, card.caseGuid() != null ? card.caseGuid() : caseGuid, card.status(),
                cardUrl, card.parties(), Map.of(), clock.instant(), List.of(), 0, Map.of());
    }

    /**
     * A lazy listing of the documents on a tab. Every iteration re-opens the tab.
     */
    public TabListing listTab(SourceTab tab) {
        return new TabListing(this, tab, config.archive().identityMarker());
    }

    public void finish() {
        transition(State.DONE);
    }

    TabView openTab(SourceTab tab) throws InterruptedException {
        ensureOnCard();
        TabView view = switch (tab) {
            case COURT_ACTS -> new ActsTab(window(), navigation.tabTimeout());
            case CARDS -> new CardsTab(window(), courtCode, navigation.tabTimeout(), navigation.pageSwitchTimeout());
            case ELECTRONIC_CASE -> new CaseFileTab(window(), navigation.tabTimeout(), navigation.pageSwitchTimeout());
        };
        transition(switch (tab) {
            case COURT_ACTS -> State.ACTS_TAB;
            case CARDS -> State.CARDS_TAB;
            case ELECTRONIC_CASE -> State.EFILE_TAB;
        });
        onPage(() -> {
            view.open();
            return null;
        });
        return view;
    }

    int openSection(TabSection section) throws InterruptedException {
        return onPage(section::open);
    }

    void showPage(TabSection section, int page) throws InterruptedException {
        pacer.betweenPages();
        onPage(() -> {
            section.showPage(page);
            return null;
        });
    }

    /**
     * Runs an action on the card and then checks for a throttling page. The check also runs when the action
     * failed to find its markup, since a throttling page replaces the tab content.
     */
    private <T> T onPage(PageAction<T> action) throws InterruptedException {
        T result;
        try {
            result = action.run();
        } catch (ParseMismatchException e) {
            checkRateLimit();
            throw e;
        }
        checkRateLimit();
        return result;
    }

    @FunctionalInterface
    private interface PageAction<T> {
        T run() throws InterruptedException;
    }

    /**
     * @throws RateLimitedException if the primary window shows a throttling page
     */
    void checkRateLimit() {
        rateLimitMonitor.checkOrThrow(window().bodyText());
        context.touch();
    }

    private void ensureOnCard() throws InterruptedException {
        if (cardUrl == null) throw new IllegalStateException("No case card has been opened");
        String current;
        try {
            current = window().currentUrl();
        } catch (RuntimeException e) {
            log.debug("Unable to read current URL: {}", e.toString());
            current = "";
        }
        if (current == null || !current.startsWith(cardUrl)) {
            loadCard();
        }
    }

    private void loadCard() throws InterruptedException {
        try {
            window().navigate(cardUrl, WaitUntil.DOM_CONTENT_LOADED, navigation.pageLoadTimeout());
        } catch (NavigationException e) {
            context.markCold();
            throw new SessionLostException("Unable to load case card " + cardUrl, e);
        }
        boolean ready = window().waitForSelector(CardPage.READY, navigation.cardTimeout());
        checkRateLimit();
        if (!ready) {
            context.markCold();
            throw new SessionLostException("Case card " + cardUrl + " did not show its content", null);
        }
    }

    private void transition(State next) {
        if (state != next) {
            log.atDebug().addKeyValue("from", state).addKeyValue("to", next).log("Navigation state");
            state = next;
        }
    }
}
