package org.netpreserve.docketcrawl;

import org.netpreserve.docketcrawl.cdp.WindowFactory;
import org.netpreserve.docketcrawl.config.CrawlerConfig;
import org.netpreserve.docketcrawl.config.FetchConfig;
import org.netpreserve.docketcrawl.config.PacingConfig;
import org.netpreserve.docketcrawl.page.SearchPage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An in-memory stand-in for the archive site: an entry page with the search form, one case card with its three
 * document tabs, and attachments served through intercepted responses.
 */
class FakeArchive implements WindowFactory {
    static final String ENTRY_URL = "https://kad.test/";
    static final String CASE_GUID = "11111111-2222-3333-4444-555555555555";
    static final String CASE_NUMBER = "А60-100/2023";
    static final String CARD_URL = "https://kad.test/Card/" + CASE_GUID;
    static final String THROTTLE_TEXT = "Слишком много запросов. Повторите позже.";

    final List<SearchPage.Suggestion> suggestions = new ArrayList<>(
            List.of(new SearchPage.Suggestion(CASE_GUID, CASE_NUMBER + " ООО \"Ромашка\" - ИП Иванов")));
    final List<String> acts = new ArrayList<>();
    final List<List<String>> caseFilePages = new ArrayList<>();
    final List<Instance> instances = new ArrayList<>();
    final Map<String, Integer> failuresLeft = new ConcurrentHashMap<>();
    final Set<String> throttled = ConcurrentHashMap.newKeySet();
    final List<String> navigations = Collections.synchronizedList(new ArrayList<>());
    final List<String> attachmentRequests = Collections.synchronizedList(new ArrayList<>());
    final AtomicInteger windowsCreated = new AtomicInteger();
    final AtomicInteger windowsOpen = new AtomicInteger();
    private final Map<String, byte[]> pdfs = new ConcurrentHashMap<>();
    volatile boolean challengePasses = true;
    volatile boolean caseFileTabPresent = true;
    volatile String cardBanner = "";
    volatile boolean cardShowsCaseNumber = true;
    /**
     * Tab ("acts", "cards" or "ed") whose button leads to a throttling page instead of the tab content.
     */
    volatile String throttledTab;

    record Instance(String id, String name, String headerDocument, List<List<String>> pages) {
    }

    /**
     * A small case: two acts, two instances and a two-page case file, with documents repeated across tabs.
     */
    static FakeArchive sampleCase() {
        var archive = new FakeArchive();
        archive.acts.addAll(List.of("act-1", "act-2"));
        archive.instances.add(new Instance("inst-1", "Первая инстанция", "act-1",
                List.of(List.of("c1", "c2"), List.of("c3"), List.of("c4"))));
        archive.instances.add(new Instance("inst-2", "Апелляционная инстанция", "act-2", List.of()));
        archive.caseFilePages.add(List.of("e1", "c1"));
        archive.caseFilePages.add(List.of("e2"));
        return archive;
    }

    static String documentUrl(String docGuid) {
        return "https://kad.test/Kad/PdfDocument/" + CASE_GUID + "/" + docGuid + "/A60-100-2023_20230105_Opredelenie.pdf";
    }

    static DocumentIdentity identity(String docGuid) {
        return new DocumentIdentity(CASE_GUID, docGuid);
    }

    /**
     * Settings with short timeouts and no waiting.
     */
    static CrawlerConfig config() {
        try {
            return CrawlerConfig.loadWithOverrides("""
                    archive:
                      entryUrl: https://kad.test/
                      cardUrlTemplate: https://kad.test/Card/{guid}
                    challenge:
                      maxAcquireAttempts: 2
                      acquireRetryDelay: 0s
                      rewarmSettle: 0s
                      warmupUrl: https://kad.test/Kad/PdfDocument/warm/up/file.pdf
                    navigation:
                      tabTimeout: 300ms
                      pageSwitchTimeout: 300ms
                      popupSettle: 0s
                      keystrokeDelay: 0s
                    fetch:
                      timeout: 200ms
                      maxRetries: 2
                      retryBaseDelay: 0s
                      retryJitter: 0s
                    """);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static CrawlerConfig withFetch(CrawlerConfig config, int maxConcurrent, int failuresBeforeRewarm) {
        var fetch = config.fetch();
        return new CrawlerConfig(config.archive(), config.browser(), config.challenge(), config.navigation(),
                new FetchConfig(fetch.timeout(), fetch.maxRetries(), fetch.retryBaseDelay(), fetch.retryJitter(),
                        maxConcurrent, failuresBeforeRewarm),
                config.pacing(), config.rateLimit(), config.storage());
    }

    static CrawlerConfig withBreakEvery(CrawlerConfig config, int documents) {
        var pacing = config.pacing();
        return new CrawlerConfig(config.archive(), config.browser(), config.challenge(), config.navigation(),
                config.fetch(),
                new PacingConfig(pacing.betweenDocuments(), pacing.betweenDocumentsJitter(), pacing.betweenPages(),
                        pacing.betweenPagesJitter(), documents, 0, pacing.breakDuration(), Duration.ZERO),
                config.rateLimit(), config.storage());
    }

    long requestsFor(String docGuid) {
        synchronized (attachmentRequests) {
            return attachmentRequests.stream().filter(docGuid::equals).count();
        }
    }

    byte[] pdf(String docGuid) {
        return pdfs.computeIfAbsent(docGuid, guid -> TestPdfs.withText(
                "Document " + guid + " of case A60-100/2023. The court has considered the application.",
                "Having heard the parties, the court decided to grant the claim in full."));
    }

    @Override
    public FakeWindow newWindow() {
        windowsCreated.incrementAndGet();
        windowsOpen.incrementAndGet();
        return new FakeWindow(this);
    }

    @Override
    public void close() {
    }
}
