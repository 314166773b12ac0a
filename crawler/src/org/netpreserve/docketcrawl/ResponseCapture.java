package org.netpreserve.docketcrawl;

import org.netpreserve.docketcrawl.cdp.InterceptedResponse;
import org.netpreserve.docketcrawl.cdp.NavigationException;
import org.netpreserve.docketcrawl.cdp.WaitUntil;
import org.netpreserve.docketcrawl.cdp.Window;
import org.netpreserve.docketcrawl.cdp.WindowFactory;
import org.netpreserve.docketcrawl.config.ArchiveConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Captures attachment bodies straight off the network. The archive serves the attachment before its client-side
 * protection gets a chance to replace the page, so the body is taken from the intercepted response rather than from
 * anything the page renders.
 */
public class ResponseCapture {
    private static final Logger log = LoggerFactory.getLogger(ResponseCapture.class);
    private final WindowFactory windows;
    private final ArchiveConfig archive;
    private final RateLimitMonitor rateLimitMonitor;
    private final byte[] magic;

    public ResponseCapture(WindowFactory windows, ArchiveConfig archive, RateLimitMonitor rateLimitMonitor) {
        this.windows = windows;
        this.archive = archive;
        this.rateLimitMonitor = rateLimitMonitor;
        this.magic = archive.attachmentMagic() == null ? new byte[0]
                : archive.attachmentMagic().getBytes(StandardCharsets.ISO_8859_1);
    }

    /**
     * Fetches one attachment in a disposable window.
     *
     * @throws CaptureTimeoutException if no attachment response arrived within the timeout
     * @throws CaptureEmptyException   if the attachment response was empty or invalid, or only responses of the
     *                                 wrong type were seen
     * @throws RateLimitedException    if the capture failed and the window shows a throttling page
     */
    public byte[] fetch(WarmedContext context, String url, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        var captured = new CompletableFuture<byte[]>();
        var rejection = new AtomicReference<String>();
        Window window = windows.newWindow();
        try {
            // must be armed before navigating or the response can slip past
            window.interceptResponses(archive::isAttachmentUrl, response -> handleResponse(response, captured, rejection));
            try {
                window.navigate(url, WaitUntil.DOM_CONTENT_LOADED, timeout);
            } catch (NavigationException e) {
                // attachments usually abort the navigation since the browser won't render or download them
                log.atDebug().addKeyValue("url", url).log("Attachment navigation ended: {}", e.getMessage());
            }

            byte[] body = awaitCapture(captured, deadline, url, rejection, window);
            context.recordAttachmentUrl(url);
            log.atDebug().addKeyValue("url", url).addKeyValue("bytes", body.length).log("Captured attachment");
            return body;
        } finally {
            window.close();
        }
    }

    private byte[] awaitCapture(CompletableFuture<byte[]> captured, long deadline, String url,
                                AtomicReference<String> rejection, Window window) throws InterruptedException {
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return captured.get(remaining, TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            checkRateLimited(window, url);
            if (e.getCause() instanceof CaptureException) throw (CaptureException) e.getCause();
            throw new CaptureEmptyException("Capture failed: " + e.getCause(), url);
        } catch (TimeoutException e) {
            checkRateLimited(window, url);
            if (rejection.get() != null) throw new CaptureEmptyException(rejection.get(), url);
            throw new CaptureTimeoutException(url);
        }
    }

    private void handleResponse(InterceptedResponse response, CompletableFuture<byte[]> captured,
                                AtomicReference<String> rejection) {
        if (response.isRedirect() || captured.isDone()) return;
        if (response.status() != 200 || !archive.isAttachmentContentType(response.contentType())) {
            log.atDebug().addKeyValue("response", response).log("Ignoring non-attachment response");
            rejection.compareAndSet(null, "Only non-attachment responses seen (HTTP " + response.status() + " "
                                          + response.contentType() + ")");
            return;
        }
        byte[] body = response.body();
        if (body.length == 0) {
            captured.completeExceptionally(new CaptureEmptyException("Attachment response was empty", response.url()));
        } else if (!hasMagic(body)) {
            captured.completeExceptionally(new CaptureEmptyException("Attachment response is not a valid attachment",
                    response.url()));
        } else {
            captured.complete(body);
        }
    }

    private boolean hasMagic(byte[] body) {
        return body.length >= magic.length && Arrays.equals(body, 0, magic.length, magic, 0, magic.length);
    }

    private void checkRateLimited(Window window, String url) {
        String text;
        try {
            text = window.bodyText();
        } catch (RuntimeException e) {
            log.atDebug().addKeyValue("url", url).log("Unable to read page text after failed capture: {}", e.toString());
            return;
        }
        rateLimitMonitor.checkOrThrow(text);
    }
}
