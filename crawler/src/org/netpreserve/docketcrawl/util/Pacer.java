package org.netpreserve.docketcrawl.util;

import org.netpreserve.docketcrawl.config.PacingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;

/**
 * Human-like delays between actions, with a longer break every so many documents.
 */
public class Pacer {
    private static final Logger log = LoggerFactory.getLogger(Pacer.class);
    private final PacingConfig config;
    private final Sleeper sleeper;
    private final Random random;
    private int documentsSinceBreak;
    private int nextBreakAt;

    public Pacer(PacingConfig config, Sleeper sleeper, Random random) {
        this.config = config;
        this.sleeper = sleeper;
        this.random = random;
        this.nextBreakAt = drawBreakThreshold();
    }

    public void betweenPages() throws InterruptedException {
        sleeper.sleep(jittered(config.betweenPages(), config.betweenPagesJitter()));
    }

    public void betweenDocuments() throws InterruptedException {
        sleeper.sleep(jittered(config.betweenDocuments(), config.betweenDocumentsJitter()));
    }

    /**
     * Counts a document and reports whether it is time for a break.
     */
    public boolean documentDone() {
        documentsSinceBreak++;
        return documentsSinceBreak >= nextBreakAt;
    }

    /**
     * Takes the break and resets the document counter.
     */
    public void takeBreak() throws InterruptedException {
        Duration duration = jittered(config.breakDuration(), config.breakJitter());
        log.atInfo().addKeyValue("documents", documentsSinceBreak).addKeyValue("seconds", duration.toSeconds())
                .log("Taking a break");
        documentsSinceBreak = 0;
        nextBreakAt = drawBreakThreshold();
        sleeper.sleep(duration);
    }

    private int drawBreakThreshold() {
        int jitter = config.breakEveryJitter();
        int offset = jitter > 0 ? random.nextInt(2 * jitter + 1) - jitter : 0;
        return Math.max(1, config.documentsBeforeBreak() + offset);
    }

    Duration jittered(Duration base, Duration jitter) {
        long extra = jitter.toMillis() > 0 ? (long) (random.nextDouble() * jitter.toMillis()) : 0;
        return base.plusMillis(extra);
    }
}
