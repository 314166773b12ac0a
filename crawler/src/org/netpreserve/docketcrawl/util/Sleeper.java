package org.netpreserve.docketcrawl.util;

import java.time.Duration;

/**
 * Blocking delay, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) Thread.sleep(duration.toMillis());
    };

    void sleep(Duration duration) throws InterruptedException;
}
