package org.netpreserve.docketcrawl.util;

import org.junit.jupiter.api.Test;
import org.netpreserve.docketcrawl.config.PacingConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PacerTest {
    private final List<Duration> sleeps = new ArrayList<>();

    private Pacer pacer(int documentsBeforeBreak, int breakEveryJitter) {
        var config = new PacingConfig(Duration.ofSeconds(3), Duration.ofSeconds(2), Duration.ofSeconds(2),
                Duration.ZERO, documentsBeforeBreak, breakEveryJitter, Duration.ofSeconds(45),
                Duration.ofSeconds(30));
        return new Pacer(config, sleeps::add, new Random(42));
    }

    @Test
    void delaysStayWithinJitter() throws InterruptedException {
        var pacer = pacer(15, 5);
        for (int i = 0; i < 50; i++) {
            pacer.betweenDocuments();
            pacer.betweenPages();
        }
        for (int i = 0; i < sleeps.size(); i += 2) {
            Duration document = sleeps.get(i);
            assertTrue(document.compareTo(Duration.ofSeconds(3)) >= 0 && document.compareTo(Duration.ofSeconds(5)) < 0,
                    document.toString());
            assertEquals(Duration.ofSeconds(2), sleeps.get(i + 1));
        }
    }

    @Test
    void breakIsDueAfterConfiguredDocuments() throws InterruptedException {
        var pacer = pacer(3, 0);
        assertFalse(pacer.documentDone());
        assertFalse(pacer.documentDone());
        assertTrue(pacer.documentDone());

        pacer.takeBreak();
        Duration pause = sleeps.get(sleeps.size() - 1);
        assertTrue(pause.compareTo(Duration.ofSeconds(45)) >= 0 && pause.compareTo(Duration.ofSeconds(75)) < 0);
        assertFalse(pacer.documentDone());
    }

    @Test
    void breakThresholdVaries() {
        var pacer = pacer(15, 5);
        int documents = 1;
        while (!pacer.documentDone()) documents++;
        assertTrue(documents >= 10 && documents <= 20, String.valueOf(documents));
    }
}
