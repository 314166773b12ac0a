package org.netpreserve.docketcrawl;

import org.netpreserve.docketcrawl.cdp.WindowFactory;
import org.netpreserve.docketcrawl.config.CrawlerConfig;
import org.netpreserve.docketcrawl.config.FetchConfig;
import org.netpreserve.docketcrawl.util.Pacer;
import org.netpreserve.docketcrawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Crawls one case end to end: challenge, search, case card, the three document tabs, then the attachments of every
 * document not completed by an earlier run.
 * <p>
 * The calling thread owns the primary window and is the only writer of output files and of the checkpoint.
 * Attachments are captured on a small pool of fetch threads, each in its own disposable window.
 */
public class CrawlOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestrator.class);
    private static final List<SourceTab> TAB_ORDER = List.of(SourceTab.COURT_ACTS, SourceTab.CARDS,
            SourceTab.ELECTRONIC_CASE);

    private final CrawlerConfig config;
    private final Clock clock;
    private final Random random;
    private final Sleeper sleeper;
    private final RateLimitMonitor rateLimitMonitor;
    private final ResponseCapture capture;
    private final ChallengeSession challengeSession;
    private final DocumentTextExtractor textExtractor = new DocumentTextExtractor();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);

    public CrawlOrchestrator(CrawlerConfig config, WindowFactory windows) {
        this(config, windows, null, Clock.systemUTC(), new Random());
    }

    /**
     * @param sleeper delay implementation, null for real sleeps that end early on cancellation
     */
    CrawlOrchestrator(CrawlerConfig config, WindowFactory windows, Sleeper sleeper, Clock clock, Random random) {
        this.config = config;
        this.clock = clock;
        this.random = random;
        Sleeper base = sleeper != null ? sleeper : this::sleepUnlessCancelled;
        this.sleeper = duration -> {
            base.sleep(duration);
            checkCancelled();
        };
        this.rateLimitMonitor = new RateLimitMonitor(config.rateLimit().phrases());
        this.capture = new ResponseCapture(windows, config.archive(), rateLimitMonitor);
        this.challengeSession = new ChallengeSession(windows, config, capture, rateLimitMonitor, clock, this.sleeper);
    }

    /**
     * Asks a running crawl to stop: no new navigations or fetches are started, fetches in flight are allowed to
     * finish and the checkpoint is committed.
     */
    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits for a crawl to return after {@link #cancel()}.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void sleepUnlessCancelled(Duration duration) throws InterruptedException {
        if (!duration.isNegative() && !duration.isZero()) {
            cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void checkCancelled() {
        if (isCancelled()) throw new CrawlInterruptedException("Crawl cancelled");
    }

    /**
     * Crawls a case into {@code <outputRoot>/case_<number>/}.
     *
     * @param resume continue from the existing checkpoint, otherwise it is moved aside and everything is fetched
     *               again
     * @return how the run ended; a rate limit ends it as PAUSED
     * @throws InvalidCaseNumberException before any browser activity if the case number is malformed
     * @throws ChallengeFailedException   if no session could be established
     * @throws CaseNotFoundException      if search doesn't find the case
     * @throws AmbiguousResultException   if search can't tell which case is meant
     */
    public CrawlResult crawl(String caseIdentifier, Path outputRoot, boolean resume) {
        try {
            CaseNumber caseNumber = CaseNumber.parse(caseIdentifier);
            var store = new ProgressStore(outputRoot, clock);
            String id = caseNumber.value();
            try {
                if (resume) {
                    store.load(id);
                } else {
                    store.archive(id);
                }
            } catch (IOException e) {
                throw new CrawlException("Unable to read progress of " + id + ": " + e.getMessage(),
                        CrawlException.FATAL, e);
            }
            store.markStarted(id);
            try (var run = new Run(caseNumber, store)) {
                return run.execute();
            }
        } finally {
            finished.countDown();
        }
    }

    /**
     * Result of all fetch attempts for one document.
     */
    private record FetchOutcome(DocumentIdentity identity, DocumentReference reference, byte[] body,
                                ExtractedText text, String failure) {
    }

    private class Run implements AutoCloseable {
        private final CaseNumber caseNumber;
        private final String id;
        private final ProgressStore store;
        private final CaseOutput output;
        private final Pacer pacer;
        private final DedupIndex dedup;
        private final Map<SourceTab, List<DocumentReference>> listings = new EnumMap<>(SourceTab.class);
        private final Map<String, InstanceRecord> instances = new LinkedHashMap<>();
        private final AtomicInteger inFlight = new AtomicInteger();
        private volatile WarmedContext context;
        private NavigationEngine engine;
        private CaseRecord caseRecord;
        private ExecutorService pool;
        private ExecutorCompletionService<FetchOutcome> completions;
        private int sessionRecoveries;
        private int fetched;
        private int skipped;

        Run(CaseNumber caseNumber, ProgressStore store) {
            this.caseNumber = caseNumber;
            this.id = caseNumber.value();
            this.store = store;
            this.output = new CaseOutput(store.caseDirectory(id));
            this.pacer = new Pacer(config.pacing(), sleeper, random);
            this.dedup = new DedupIndex(store.current(id).completed());
        }

        CrawlResult execute() {
            try {
                checkCancelled();
                acquire();
                SearchResult found = withSession(engine -> engine.search(caseNumber));
                caseRecord = withSession(engine -> engine.openCard(found.caseGuid()))
                        .withSearchResultFields(found.fields());
                output.writeCase(caseRecord);

                for (SourceTab tab : TAB_ORDER) {
                    checkCancelled();
                    listTab(tab);
                }
                writeListings();
                fetchAll();
                finish();
                store.markOutcome(id, CrawlOutcome.COMPLETED);
                return result(CrawlOutcome.COMPLETED, null);
            } catch (RateLimitedException e) {
                drain();
                log.atWarn().addKeyValue("case", id).log("Pausing crawl: {}", e.getMessage());
                store.markPaused(id, e.getMessage());
                return result(CrawlOutcome.PAUSED, e.getMessage());
            } catch (CrawlInterruptedException e) {
                drain();
                log.atWarn().addKeyValue("case", id).log("Crawl interrupted: {}", e.getMessage());
                store.markOutcome(id, CrawlOutcome.INTERRUPTED);
                return result(CrawlOutcome.INTERRUPTED, null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                drain();
                log.atWarn().addKeyValue("case", id).log("Crawl interrupted");
                store.markOutcome(id, CrawlOutcome.INTERRUPTED);
                return result(CrawlOutcome.INTERRUPTED, null);
            } catch (IOException e) {
                drain();
                store.markOutcome(id, CrawlOutcome.FAILED);
                throw new CrawlException("Unable to write output for " + id + ": " + e.getMessage(),
                        CrawlException.FATAL, e);
            } catch (RuntimeException e) {
                drain();
                store.markOutcome(id, CrawlOutcome.FAILED);
                throw e;
            }
        }

        private CrawlResult result(CrawlOutcome outcome, String pausedReason) {
            return new CrawlResult(outcome, output.directory(), dedup.size(), fetched, skipped,
                    store.current(id).completed().size(), pausedReason);
        }

        private void acquire() throws InterruptedException {
            if (context != null) {
                context.window().close();
            }
            context = challengeSession.acquire();
            engine = new NavigationEngine(context, caseNumber, config, rateLimitMonitor, pacer, sleeper, clock);
        }

        /**
         * Runs a step against the primary window, acquiring a fresh session and retrying when it is lost.
         */
        private <T> T withSession(SessionStep<T> step) throws InterruptedException {
            while (true) {
                try {
                    return step.run(engine);
                } catch (SessionLostException e) {
                    sessionRecoveries++;
                    if (sessionRecoveries > config.challenge().maxAcquireAttempts()) {
                        throw new ChallengeFailedException("Session lost too many times", e);
                    }
                    log.atWarn().addKeyValue("case", id).log("Session lost, acquiring a new one: {}", e.getMessage());
                    checkCancelled();
                    acquire();
                }
            }
        }

        private void listTab(SourceTab tab) throws InterruptedException {
            var listing = withSession(engine -> {
                if (!engine.isCardOpen()) engine.openCard(caseRecord.caseGuid());
                var tabListing = engine.listTab(tab);
                var references = new ArrayList<DocumentReference>();
                for (DocumentReference reference : tabListing) {
                    dedup.admit(reference);
                    references.add(reference);
                }
                for (InstanceRecord instance : tabListing.instances()) {
                    instances.putIfAbsent(instance.instanceId(), instance);
                }
                return references;
            });
            listings.put(tab, listing);
            log.atInfo().addKeyValue("tab", tab.key()).addKeyValue("documents", listing.size())
                    .addKeyValue("distinct", dedup.size()).log("Tab listed");
        }

        private void writeListings() throws IOException {
            for (SourceTab tab : TAB_ORDER) {
                output.writeTab(tab, listings.getOrDefault(tab, List.of()));
            }
            Map<String, InstanceRecord> previous = output.loadInstances();
            var byInstance = documentsByInstance();
            for (InstanceRecord instance : instances.values()) {
                // an instance recorded by an earlier run keeps its original record
                InstanceRecord kept = previous.getOrDefault(instance.instanceId(), instance);
                output.writeInstance(kept, byInstance.getOrDefault(instance.instanceId(), List.of()));
            }
            for (var entry : previous.entrySet()) {
                if (!instances.containsKey(entry.getKey())) {
                    log.atInfo().addKeyValue("instance", entry.getKey()).log("Keeping instance from an earlier run");
                }
            }
            var merged = new LinkedHashMap<String, InstanceRecord>();
            for (InstanceRecord instance : instances.values()) {
                merged.put(instance.instanceId(), previous.getOrDefault(instance.instanceId(), instance));
            }
            previous.forEach(merged::putIfAbsent);
            instances.clear();
            instances.putAll(merged);
        }

        private Map<String, List<DocumentReference>> documentsByInstance() {
            var byInstance = new LinkedHashMap<String, List<DocumentReference>>();
            for (DocumentReference reference : listings.getOrDefault(SourceTab.CARDS, List.of())) {
                if (reference.instanceId() == null) continue;
                byInstance.computeIfAbsent(reference.instanceId(), k -> new ArrayList<>()).add(reference);
            }
            return byInstance;
        }

        private void fetchAll() throws InterruptedException, IOException {
            FetchConfig fetch = config.fetch();
            List<DocumentIdentity> pending = dedup.pending();
            log.atInfo().addKeyValue("case", id).addKeyValue("pending", pending.size())
                    .addKeyValue("completed", store.current(id).completed().size()).log("Fetching attachments");
            if (pending.isEmpty()) return;

            int threads = Math.max(1, fetch.maxConcurrent());
            var threadNumber = new AtomicInteger();
            pool = Executors.newFixedThreadPool(threads, runnable -> {
                var thread = new Thread(runnable, "fetch-" + threadNumber.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            completions = new ExecutorCompletionService<>(pool);

            var iterator = pending.iterator();
            RateLimitedException pause = null;
            boolean breakDue = false;
            int consecutiveFailures = 0;
            int submitted = 0;
            while (true) {
                if (pause == null && (breakDue || consecutiveFailures >= fetch.consecutiveFailuresBeforeRewarm())
                    && inFlight.get() == 0) {
                    if (breakDue) pacer.takeBreak();
                    else log.atWarn().addKeyValue("failures", consecutiveFailures).log("Too many failures in a row");
                    rewarm();
                    breakDue = false;
                    consecutiveFailures = 0;
                }
                boolean mayStart = pause == null && !breakDue
                                   && consecutiveFailures < fetch.consecutiveFailuresBeforeRewarm();
                while (mayStart && inFlight.get() < threads && iterator.hasNext()) {
                    if (submitted > 0) pacer.betweenDocuments();
                    if (context.status() != WarmedContext.Status.WARM && inFlight.get() == 0) rewarm();
                    submit(iterator.next());
                    submitted++;
                }
                if (inFlight.get() == 0) break;

                try {
                    FetchOutcome outcome = take();
                    if (handle(outcome)) {
                        consecutiveFailures = 0;
                    } else {
                        consecutiveFailures++;
                    }
                    if (pacer.documentDone()) breakDue = true;
                } catch (RateLimitedException e) {
                    if (pause == null) pause = e;
                }
            }
            if (pause != null) throw pause;
        }

        private void submit(DocumentIdentity identity) {
            DocumentReference reference = dedup.firstReference(identity);
            inFlight.incrementAndGet();
            completions.submit(() -> fetchWithRetries(identity, reference));
        }

        /**
         * Waits for the next fetch to end.
         *
         * @throws RateLimitedException if the fetch ran into a throttling page
         */
        private FetchOutcome take() throws InterruptedException {
            Future<FetchOutcome> future = completions.take();
            inFlight.decrementAndGet();
            try {
                return future.get();
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
                throw new CrawlException("Fetch failed: " + e.getCause(), CrawlException.FATAL, e.getCause());
            }
        }

        private FetchOutcome fetchWithRetries(DocumentIdentity identity, DocumentReference reference)
                throws InterruptedException {
            FetchConfig fetch = config.fetch();
            String failure = null;
            for (int attempt = 1; attempt <= fetch.maxRetries(); attempt++) {
                try {
                    byte[] body = capture.fetch(context, reference.url(), fetch.timeout());
                    return new FetchOutcome(identity, reference, body, textExtractor.extract(body), null);
                } catch (CaptureException e) {
                    failure = e.getMessage();
                } catch (RateLimitedException | CrawlInterruptedException e) {
                    throw e;
                } catch (RuntimeException e) {
                    failure = e.toString();
                }
                log.atWarn().addKeyValue("identity", identity).addKeyValue("attempt", attempt)
                        .addKeyValue("maxAttempts", fetch.maxRetries()).log("Fetch failed: {}", failure);
                if (attempt < fetch.maxRetries()) {
                    sleeper.sleep(backoff(fetch, attempt - 1, random));
                }
            }
            return new FetchOutcome(identity, reference, null, null, failure);
        }

        /**
         * Records a finished fetch.
         *
         * @return true if the document was fetched, false if it was given up on
         */
        private boolean handle(FetchOutcome outcome) {
            if (outcome.failure() != null) {
                skipped++;
                store.markPermanentlySkipped(id, outcome.identity(), outcome.failure());
                log.atError().addKeyValue("identity", outcome.identity()).addKeyValue("url", outcome.reference().url())
                        .log("Giving up on document: {}", outcome.failure());
                return false;
            }
            var document = FetchedDocument.from(outcome.reference(), outcome.identity(),
                    dedup.sourceTabs(outcome.identity()), outcome.text(), outcome.body().length, clock.instant(),
                    config.storage().minTextLengthForOcr());
            // record first, checkpoint second: a crash in between leaves a record that the next run fetches again
            try {
                output.writeDocument(document, outcome.identity(),
                        config.storage().keepAttachments() ? outcome.body() : null);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to write document " + outcome.identity(), e);
            }
            store.markDone(id, outcome.identity());
            fetched++;
            log.atInfo().addKeyValue("identity", outcome.identity()).addKeyValue("bytes", outcome.body().length)
                    .addKeyValue("chars", document.charCount())
                    .addKeyValue("manualReview", document.requiresManualReview())
                    .log("Fetched {}", outcome.reference().filename());
            return true;
        }

        private void rewarm() throws InterruptedException {
            checkCancelled();
            try {
                challengeSession.rewarm(context, caseRecord.url());
            } catch (SessionLostException e) {
                log.atWarn().addKeyValue("case", id).log("Re-warm lost the session: {}", e.getMessage());
                sessionRecoveries++;
                if (sessionRecoveries > config.challenge().maxAcquireAttempts()) {
                    throw new ChallengeFailedException("Session lost too many times", e);
                }
                acquire();
            }
        }

        /**
         * Lets fetches still in flight finish and records their results.
         */
        private void drain() {
            while (inFlight.get() > 0) {
                try {
                    handle(take());
                } catch (RateLimitedException | CrawlInterruptedException e) {
                    log.atDebug().log("In-flight fetch stopped: {}", e.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for {} in-flight fetches", inFlight.get());
                    return;
                } catch (RuntimeException e) {
                    log.warn("In-flight fetch failed", e);
                }
            }
        }

        private void finish() throws IOException {
            var fingerprints = new LinkedHashMap<String, String>();
            for (DocumentReference reference : listings.getOrDefault(SourceTab.CARDS, List.of())) {
                if (reference.instanceId() != null) {
                    fingerprints.putIfAbsent(reference.instanceId(), reference.identity().key());
                }
            }
            for (SourceTab tab : List.of(SourceTab.ELECTRONIC_CASE, SourceTab.COURT_ACTS)) {
                var references = listings.getOrDefault(tab, List.of());
                if (!references.isEmpty()) fingerprints.put(tab.key(), references.get(0).identity().key());
            }
            caseRecord = caseRecord.withSummary(new ArrayList<>(instances.keySet()), dedup.size(), fingerprints);
            output.writeCase(caseRecord);
            var state = store.current(id);
            output.writeReadme(caseRecord, instances.values(), documentsByInstance(), dedup.size(),
                    state.completed().size() - state.skipped().size(), state.skipped().size());
            engine.finish();
            log.atInfo().addKeyValue("case", id).addKeyValue("documents", dedup.size())
                    .addKeyValue("fetched", fetched).addKeyValue("skipped", skipped).log("Crawl complete");
        }

        @Override
        public void close() {
            if (pool != null) {
                pool.shutdownNow();
            }
            if (context != null) {
                try {
                    context.window().close();
                } catch (RuntimeException e) {
                    log.debug("Error closing primary window", e);
                }
            }
        }
    }

    /**
     * Delay before a retry: base * 2^retry plus up to the configured jitter, where retry is 0 for the first one.
     */
    static Duration backoff(FetchConfig fetch, int retry, Random random) {
        long jitter = (long) (random.nextDouble() * fetch.retryJitter().toMillis());
        return fetch.retryBaseDelay().multipliedBy(1L << Math.min(retry, 20)).plusMillis(jitter);
    }

    @FunctionalInterface
    private interface SessionStep<T> {
        T run(NavigationEngine engine) throws InterruptedException;
    }
}
