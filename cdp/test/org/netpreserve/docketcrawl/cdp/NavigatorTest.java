package org.netpreserve.docketcrawl.cdp;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class NavigatorTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(20);
    private static final byte[] PDF = "%PDF-1.4\nfake\n%%EOF\n".getBytes(StandardCharsets.US_ASCII);
    private static BrowserProcess browserProcess;
    private static HttpServer httpServer;
    private static String baseUrl;

    @BeforeAll
    static void setUp(@TempDir Path tempDir) throws IOException {
        var executable = BrowserProcess.findExecutable();
        assumeTrue(executable.isPresent(), "no browser installed");
        browserProcess = BrowserProcess.start(executable.get(), true, List.of(), tempDir.resolve("profile"),
                WindowSettings.DEFAULTS);

        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", exchange -> {
            String path = exchange.getRequestURI().getPath();
            switch (path) {
                case "/page": {
                    byte[] body = ("<html><body><div id=list><a class=item href='#1'>one</a>" +
                                   "<a class=item href='#2'>two</a></div>" +
                                   "<input id=q><span id=out></span>" +
                                   "<script>document.querySelectorAll('.item').forEach(a => a.addEventListener('click'," +
                                   " e => { e.preventDefault(); document.getElementById('out').textContent = a.textContent; }));" +
                                   "</script></body></html>").getBytes(StandardCharsets.UTF_8);
                    exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
                    exchange.sendResponseHeaders(200, body.length);
                    exchange.getResponseBody().write(body);
                    break;
                }
                case "/PdfDocument/abc/def/file.pdf":
                    exchange.getResponseHeaders().add("Location", "/Document/Pdf/abc/def/file.pdf");
                    exchange.sendResponseHeaders(302, -1);
                    break;
                case "/Document/Pdf/abc/def/file.pdf":
                    exchange.getResponseHeaders().add("Content-Type", "application/pdf");
                    exchange.sendResponseHeaders(200, PDF.length);
                    exchange.getResponseBody().write(PDF);
                    break;
                default:
                    exchange.sendResponseHeaders(404, -1);
            }
            exchange.close();
        });
        httpServer.start();
        baseUrl = "http://127.0.0.1:" + httpServer.getAddress().getPort();
    }

    @AfterAll
    static void tearDown() throws InterruptedException {
        if (httpServer != null) httpServer.stop(0);
        if (browserProcess != null) browserProcess.close();
        // give browser child processes a moment to release the profile directory
        Thread.sleep(100);
    }

    @Test
    void queriesAndClicks() throws Exception {
        try (var window = browserProcess.newWindow()) {
            window.navigate(baseUrl + "/page", WaitUntil.LOAD, TIMEOUT);
            assertEquals(baseUrl + "/page", window.currentUrl());
            assertEquals(2, window.count("#list .item"));
            assertEquals("<a class=\"item\" href=\"#2\">two</a>", window.outerHtml("#list .item", 1));
            assertNull(window.outerHtml(".missing"));

            assertTrue(window.clickWithin("#list", 0, ".item:nth-child(2)"));
            assertTrue(window.bodyText().contains("two"));
            assertFalse(window.click(".missing"));

            window.typeText("#q", "А60-1/2023", Duration.ZERO);
            assertEquals("А60-1/2023", window.eval("document.getElementById('q').value"));
            assertTrue(window.waitForSelector("#out", Duration.ofSeconds(1)));
            assertFalse(window.waitForSelector("#never", Duration.ofMillis(300)));
        }
    }

    @Test
    void interceptsAttachmentAfterRedirect() throws Exception {
        var seen = new CopyOnWriteArrayList<InterceptedResponse>();
        var pdf = new CompletableFuture<InterceptedResponse>();
        try (var window = browserProcess.newWindow()) {
            window.interceptResponses(url -> url.contains("Pdf"), response -> {
                seen.add(response);
                if (!response.isRedirect()) pdf.complete(response);
            });
            try {
                window.navigate(baseUrl + "/PdfDocument/abc/def/file.pdf", WaitUntil.DOM_CONTENT_LOADED, TIMEOUT);
            } catch (NavigationException e) {
                // the browser aborts the navigation since downloads are denied
            }
            var response = pdf.get(TIMEOUT.toSeconds(), TimeUnit.SECONDS);
            assertEquals(200, response.status());
            assertEquals("application/pdf", response.contentType());
            assertArrayEquals(PDF, response.body());
            assertTrue(seen.get(0).isRedirect());
        }
    }

    @Test
    void navigationErrorIsReported() {
        try (var window = browserProcess.newWindow()) {
            assertThrows(NavigationFailedException.class,
                    () -> window.navigate("http://127.0.0.1:1/", WaitUntil.LOAD, TIMEOUT));
        }
    }
}
