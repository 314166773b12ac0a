package org.netpreserve.docketcrawl;

import org.netpreserve.docketcrawl.cdp.NavigationException;
import org.netpreserve.docketcrawl.cdp.WaitUntil;
import org.netpreserve.docketcrawl.cdp.Window;
import org.netpreserve.docketcrawl.cdp.WindowFactory;
import org.netpreserve.docketcrawl.config.ChallengeConfig;
import org.netpreserve.docketcrawl.config.CrawlerConfig;
import org.netpreserve.docketcrawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Gets the primary window through the archive's browser challenge and keeps it warm.
 * <p>
 * The challenge itself is opaque: it is considered passed once the post-challenge content (the search form) shows
 * up in the window.
 */
public class ChallengeSession {
    private static final Logger log = LoggerFactory.getLogger(ChallengeSession.class);
    private final WindowFactory windows;
    private final CrawlerConfig config;
    private final ChallengeConfig challenge;
    private final ResponseCapture capture;
    private final RateLimitMonitor rateLimitMonitor;
    private final Clock clock;
    private final Sleeper sleeper;

    public ChallengeSession(WindowFactory windows, CrawlerConfig config, ResponseCapture capture,
                            RateLimitMonitor rateLimitMonitor, Clock clock, Sleeper sleeper) {
        this.windows = windows;
        this.config = config;
        this.challenge = config.challenge();
        this.capture = capture;
        this.rateLimitMonitor = rateLimitMonitor;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Opens the primary window on the entry page and waits for the challenge to pass.
     *
     * @throws ChallengeFailedException if no attempt got past the challenge
     * @throws RateLimitedException     if the entry page says the session is throttled
     */
    public WarmedContext acquire() throws InterruptedException {
        String lastFailure = null;
        for (int attempt = 1; attempt <= challenge.maxAcquireAttempts(); attempt++) {
            if (attempt > 1) sleeper.sleep(challenge.acquireRetryDelay());
            log.atInfo().addKeyValue("attempt", attempt).addKeyValue("url", config.archive().entryUrl())
                    .log("Acquiring session");
            Window window = null;
            boolean acquired = false;
            try {
                window = windows.newWindow();
                long start = System.nanoTime();
                window.navigate(config.archive().entryUrl(), WaitUntil.DOM_CONTENT_LOADED, challenge.handshakeTimeout());
                Duration remaining = challenge.handshakeTimeout().minusNanos(System.nanoTime() - start);
                boolean ready = window.waitForSelector(challenge.readySelector(),
                        remaining.isNegative() ? Duration.ZERO : remaining);
                rateLimitMonitor.checkOrThrow(window.bodyText());
                if (ready) {
                    var context = new WarmedContext(window, clock, challenge.rewarmIdleThreshold());
                    acquired = true;
                    log.info("Challenge passed");
                    return context;
                }
                lastFailure = "post-challenge content " + challenge.readySelector() + " did not appear within "
                              + challenge.handshakeTimeout().toSeconds() + "s";
            } catch (NavigationException e) {
                lastFailure = e.getMessage();
            } catch (CrawlException e) {
                throw e;
            } catch (RuntimeException e) {
                // protocol errors, a crashed browser and the like
                lastFailure = e.toString();
            } finally {
                if (!acquired && window != null) window.close();
            }
            log.atWarn().addKeyValue("attempt", attempt).log("Session acquisition failed: {}", lastFailure);
        }
        throw new ChallengeFailedException("Unable to pass the challenge after " + challenge.maxAcquireAttempts()
                                           + " attempts: " + lastFailure);
    }

    /**
     * Brings an idle session back: reloads a content page in the primary window, then performs one throwaway
     * attachment fetch so the challenge state re-initializes before real fetches resume.
     *
     * @throws SessionLostException if the anchor page can't be reached; the context is then COLD
     */
    public void rewarm(WarmedContext context, String anchorUrl) throws InterruptedException {
        log.atInfo().addKeyValue("status", context.status()).addKeyValue("url", anchorUrl).log("Re-warming session");
        try {
            context.window().navigate(anchorUrl, WaitUntil.DOM_CONTENT_LOADED, config.navigation().pageLoadTimeout());
            rateLimitMonitor.checkOrThrow(context.window().bodyText());
        } catch (NavigationException e) {
            context.markCold();
            throw new SessionLostException("Re-warm could not reach " + anchorUrl, e);
        } catch (CrawlException e) {
            throw e;
        } catch (RuntimeException e) {
            context.markCold();
            throw new SessionLostException("Re-warm failed on " + anchorUrl, e);
        }

        String warmupUrl = context.lastAttachmentUrl() != null ? context.lastAttachmentUrl() : challenge.warmupUrl();
        if (warmupUrl != null && !warmupUrl.isBlank()) {
            try {
                capture.fetch(context, warmupUrl, config.fetch().timeout());
            } catch (CaptureException e) {
                log.atInfo().addKeyValue("url", warmupUrl).log("Warm-up fetch failed: {}", e.getMessage());
            } catch (RateLimitedException e) {
                throw e;
            } catch (RuntimeException e) {
                log.atWarn().addKeyValue("url", warmupUrl).setCause(e).log("Warm-up fetch failed");
            }
        }
        sleeper.sleep(challenge.rewarmSettle());
        context.markWarm();
    }
}
