package org.netpreserve.docketcrawl;

import org.junit.jupiter.api.Test;
import org.netpreserve.docketcrawl.cdp.InterceptedResponse;
import org.netpreserve.docketcrawl.cdp.WaitUntil;
import org.netpreserve.docketcrawl.cdp.Window;
import org.netpreserve.docketcrawl.cdp.WindowFactory;
import org.netpreserve.docketcrawl.config.CrawlerConfig;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCaptureTest {
    private static final Duration TIMEOUT = Duration.ofMillis(300);
    private static final String URL = FakeArchive.documentUrl("d1");
    private static final byte[] PDF = "%PDF-1.7\n...".getBytes(StandardCharsets.ISO_8859_1);
    private final CrawlerConfig config = FakeArchive.config();
    private final RateLimitMonitor monitor = new RateLimitMonitor(config.rateLimit().phrases());

    private WarmedContext context(WindowFactory windows) {
        return new WarmedContext(windows.newWindow(), Clock.systemUTC(), Duration.ofSeconds(40));
    }

    @Test
    void capturesAttachmentBehindRedirect() throws InterruptedException {
        var archive = new FakeArchive();
        var capture = new ResponseCapture(archive, config.archive(), monitor);
        var context = context(archive);

        byte[] body = capture.fetch(context, URL, TIMEOUT);

        assertArrayEquals(archive.pdf("d1"), body);
        assertEquals(URL, context.lastAttachmentUrl());
        assertEquals(1, archive.windowsOpen.get(), "disposable window must be closed");
    }

    @Test
    void missingResponseTimesOut() {
        var archive = new FakeArchive();
        archive.failuresLeft.put("d1", 1);
        var capture = new ResponseCapture(archive, config.archive(), monitor);
        var context = context(archive);

        var e = assertThrows(CaptureTimeoutException.class, () -> capture.fetch(context, URL, TIMEOUT));
        assertEquals(URL, e.url());
        assertNull(context.lastAttachmentUrl());
        assertEquals(1, archive.windowsOpen.get());
    }

    @Test
    void throttlingPageIsReportedAsRateLimit() {
        var archive = new FakeArchive();
        archive.throttled.add("d1");
        var capture = new ResponseCapture(archive, config.archive(), monitor);

        assertThrows(RateLimitedException.class, () -> capture.fetch(context(archive), URL, TIMEOUT));
    }

    @Test
    void firstValidAttachmentWins() throws InterruptedException {
        byte[] second = "%PDF-second".getBytes(StandardCharsets.ISO_8859_1);
        var windows = new ScriptedWindows(List.of(
                new InterceptedResponse(URL, 302, null, new byte[0]),
                new InterceptedResponse(URL, 200, "text/html", "<html>".getBytes(StandardCharsets.UTF_8)),
                new InterceptedResponse(URL, 200, "application/pdf; charset=binary", PDF),
                new InterceptedResponse(URL, 200, "application/pdf", second)));
        var capture = new ResponseCapture(windows, config.archive(), monitor);

        assertArrayEquals(PDF, capture.fetch(context(windows), URL, TIMEOUT));
    }

    @Test
    void wrongContentTypeIsEmptyCapture() {
        var windows = new ScriptedWindows(List.of(
                new InterceptedResponse(URL, 200, "text/html", "<html>".getBytes(StandardCharsets.UTF_8))));
        var capture = new ResponseCapture(windows, config.archive(), monitor);

        assertThrows(CaptureEmptyException.class, () -> capture.fetch(context(windows), URL, TIMEOUT));
    }

    @Test
    void emptyOrInvalidBodyIsEmptyCapture() {
        for (byte[] body : List.of(new byte[0], "<html>not a pdf".getBytes(StandardCharsets.UTF_8))) {
            var windows = new ScriptedWindows(List.of(new InterceptedResponse(URL, 200, "application/pdf", body)));
            var capture = new ResponseCapture(windows, config.archive(), monitor);
            assertThrows(CaptureEmptyException.class, () -> capture.fetch(context(windows), URL, TIMEOUT));
        }
    }

    /**
     * Windows that replay a fixed series of responses on every navigation.
     */
    private static class ScriptedWindows implements WindowFactory {
        private final List<InterceptedResponse> responses;

        ScriptedWindows(List<InterceptedResponse> responses) {
            this.responses = responses;
        }

        @Override
        public Window newWindow() {
            return new Window() {
                private final List<Predicate<String>> filters = new ArrayList<>();
                private final List<Consumer<InterceptedResponse>> listeners = new ArrayList<>();

                @Override
                public void navigate(String url, WaitUntil waitUntil, Duration timeout) {
                    for (InterceptedResponse response : responses) {
                        for (int i = 0; i < filters.size(); i++) {
                            if (filters.get(i).test(response.url())) listeners.get(i).accept(response);
                        }
                    }
                }

                @Override
                public String currentUrl() {
                    return URL;
                }

                @Override
                public String bodyText() {
                    return "";
                }

                @Override
                public String outerHtml(String selector, int index) {
                    return null;
                }

                @Override
                public int count(String selector) {
                    return 0;
                }

                @Override
                public boolean click(String selector, int index) {
                    return false;
                }

                @Override
                public boolean clickWithin(String scopeSelector, int index, String selector) {
                    return false;
                }

                @Override
                public boolean waitForSelector(String selector, Duration timeout) {
                    return false;
                }

                @Override
                public void typeText(String selector, String text, Duration keystrokeDelay) {
                }

                @Override
                public void interceptResponses(Predicate<String> urlFilter, Consumer<InterceptedResponse> listener) {
                    filters.add(urlFilter);
                    listeners.add(listener);
                }

                @Override
                public void close() {
                }
            };
        }

        @Override
        public void close() {
        }
    }
}
