package org.netpreserve.docketcrawl;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitMonitorTest {
    private final RateLimitMonitor monitor = new RateLimitMonitor(
            List.of("Доступ к сервису ограничен", "Too many requests", ""));

    @Test
    void matchesPhraseIgnoringCase() {
        var status = monitor.check("Ошибка. ДОСТУП К СЕРВИСУ ОГРАНИЧЕН. Попробуйте позже");
        assertTrue(status.rateLimited());
        assertEquals("Доступ к сервису ограничен", status.phrase());
        assertTrue(monitor.check("HTTP 429 too many requests").rateLimited());
    }

    @Test
    void ordinaryPagesAreClear() {
        assertEquals(RateLimitMonitor.RateLimitStatus.CLEAR, monitor.check("Карточка дела А60-1/2023"));
        assertEquals(RateLimitMonitor.RateLimitStatus.CLEAR, monitor.check(""));
        assertEquals(RateLimitMonitor.RateLimitStatus.CLEAR, monitor.check(null));
    }

    @Test
    void checkOrThrowCarriesPhrase() {
        var e = assertThrows(RateLimitedException.class, () -> monitor.checkOrThrow("too MANY requests"));
        assertEquals("Too many requests", e.phrase());
        assertEquals(CrawlException.RATE_LIMITED, e.exitCode());
        assertDoesNotThrow(() -> monitor.checkOrThrow("all good"));
    }
}
