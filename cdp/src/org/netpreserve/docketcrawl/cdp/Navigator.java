package org.netpreserve.docketcrawl.cdp;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.intellij.lang.annotations.Language;
import org.netpreserve.docketcrawl.cdp.domains.Emulation;
import org.netpreserve.docketcrawl.cdp.domains.Fetch;
import org.netpreserve.docketcrawl.cdp.domains.Input;
import org.netpreserve.docketcrawl.cdp.domains.Network;
import org.netpreserve.docketcrawl.cdp.domains.Page;
import org.netpreserve.docketcrawl.cdp.domains.Runtime;
import org.netpreserve.docketcrawl.cdp.protocol.CDPException;
import org.netpreserve.docketcrawl.cdp.protocol.CDPSession;
import org.netpreserve.docketcrawl.cdp.protocol.RPC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A {@link Window} backed by a DevTools page session.
 */
public class Navigator implements Window {
    private static final Logger log = LoggerFactory.getLogger(Navigator.class);
    private static final String HIDE_WEBDRIVER_SCRIPT =
            "Object.defineProperty(navigator, 'webdriver', {get: () => undefined});";
    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);
    private static final int MAX_SEEN_LOADERS = 32;
    private final CDPSession cdpSession;
    private final Page page;
    private final Runtime runtime;
    private final Fetch fetch;
    private final Input input;
    private final AtomicReference<Navigation> currentNavigation = new AtomicReference<>();
    private final Map<String, Set<String>> seenLifecycleEvents = new ConcurrentHashMap<>();
    private final List<Interceptor> interceptors = new CopyOnWriteArrayList<>();
    private volatile boolean fetchEnabled;
    private volatile boolean closed;
    Duration scriptTimeout = Duration.ofSeconds(10);

    private record Interceptor(Predicate<String> urlFilter, Consumer<InterceptedResponse> listener) {
    }

    private record Navigation(
            String url,
            Page.FrameId frameId,
            Network.LoaderId loaderId,
            CompletableFuture<Void> domContentLoaded,
            CompletableFuture<Void> load) {
        Navigation(String url, Page.FrameId frameId, Network.LoaderId loaderId) {
            this(url, frameId, loaderId, new CompletableFuture<>(), new CompletableFuture<>());
        }

        void handleLifecycleEvent(String name) {
            if (name.equals(WaitUntil.DOM_CONTENT_LOADED.lifecycleEventName())) {
                domContentLoaded.complete(null);
            } else if (name.equals(WaitUntil.LOAD.lifecycleEventName())) {
                domContentLoaded.complete(null);
                load.complete(null);
            }
        }

        CompletableFuture<Void> milestone(WaitUntil waitUntil) {
            return waitUntil == WaitUntil.LOAD ? load : domContentLoaded;
        }

        void completeExceptionally(Throwable t) {
            domContentLoaded.completeExceptionally(t);
            load.completeExceptionally(t);
        }
    }

    public Navigator(CDPSession cdpSession, WindowSettings settings) {
        this.cdpSession = cdpSession;
        this.page = cdpSession.domain(Page.class);
        this.runtime = cdpSession.domain(Runtime.class);
        this.fetch = cdpSession.domain(Fetch.class);
        this.input = cdpSession.domain(Input.class);
        var emulation = cdpSession.domain(Emulation.class);

        page.onLifecycleEvent(this::handleLifecycleEvent);
        fetch.onRequestPaused(this::handleRequestPaused);
        page.enable();
        page.setLifecycleEventsEnabled(true);
        page.addScriptToEvaluateOnNewDocument(HIDE_WEBDRIVER_SCRIPT, null);

        if (settings.userAgent() != null) {
            emulation.setUserAgentOverride(settings.userAgent(), settings.acceptLanguage(), null);
        }
        if (settings.locale() != null) emulation.setLocaleOverride(settings.locale());
        if (settings.timezoneId() != null) emulation.setTimezoneOverride(settings.timezoneId());
    }

    private void handleLifecycleEvent(Page.LifecycleEvent event) {
        if (event.loaderId() == null) return;
        var names = seenLifecycleEvents.computeIfAbsent(event.loaderId().value(), k -> ConcurrentHashMap.newKeySet());
        names.add(event.name());
        if (seenLifecycleEvents.size() > MAX_SEEN_LOADERS) {
            seenLifecycleEvents.keySet().removeIf(loaderId -> {
                var navigation = currentNavigation.get();
                return navigation == null || !navigation.loaderId().value().equals(loaderId);
            });
        }

        var navigation = currentNavigation.get();
        if (navigation == null) return;
        if (!navigation.frameId().equals(event.frameId())) return;
        if (!navigation.loaderId().equals(event.loaderId())) {
            log.trace("Ignoring lifecycle event for another loader {}", event);
            return;
        }
        navigation.handleLifecycleEvent(event.name());
    }

    private void handleRequestPaused(Fetch.RequestPaused event) {
        if (!event.isResponseStage()) {
            fetch.continueRequestAsync(event.requestId());
            return;
        }
        String url = event.request().url();
        var matching = new ArrayList<Interceptor>();
        for (var interceptor : interceptors) {
            if (interceptor.urlFilter().test(url)) matching.add(interceptor);
        }
        if (matching.isEmpty() || event.responseErrorReason() != null) {
            continueResponse(event);
            return;
        }

        int status = event.responseStatusCode();
        String contentType = event.responseHeader("Content-Type");
        if (event.isRedirect()) {
            deliver(matching, new InterceptedResponse(url, status, contentType, new byte[0]));
            continueResponse(event);
            return;
        }

        fetch.getResponseBodyAsync(event.requestId()).whenComplete((responseBody, error) -> {
            byte[] body;
            if (error != null) {
                log.atWarn().addKeyValue("url", url).setCause(error).log("Unable to read intercepted response body");
                body = new byte[0];
            } else {
                body = responseBody.body();
            }
            deliver(matching, new InterceptedResponse(url, status, contentType, body));
            continueResponse(event);
        });
    }

    private void deliver(List<Interceptor> interceptors, InterceptedResponse response) {
        for (var interceptor : interceptors) {
            try {
                interceptor.listener().accept(response);
            } catch (RuntimeException e) {
                log.error("Response listener threw for {}", response.url(), e);
            }
        }
    }

    private void continueResponse(Fetch.RequestPaused event) {
        fetch.continueResponseAsync(event.requestId()).whenComplete((v, error) -> {
            if (error != null && !closed) {
                log.debug("Continuing response for {} failed", event.request().url(), error);
            }
        });
    }

    @Override
    public void navigate(String url, WaitUntil waitUntil, Duration timeout) throws NavigationException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        Page.Navigate result;
        try {
            result = page.navigateAsync(url).toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new NavigationTimedOutException(url, "Timed out waiting for Page.navigate");
        } catch (ExecutionException e) {
            throw new NavigationException(url, "Page.navigate failed", e.getCause());
        }
        if (result.errorText() != null) {
            throw new NavigationFailedException(url, result.errorText());
        }
        if (result.loaderId() == null) return; // same-document navigation

        var navigation = new Navigation(url, result.frameId(), result.loaderId());
        var previousNavigation = currentNavigation.getAndSet(navigation);
        if (previousNavigation != null) {
            previousNavigation.completeExceptionally(new NavigationException(previousNavigation.url(),
                    "Interrupted by navigation to " + url));
        }
        // lifecycle events can arrive before the navigate response
        var seen = seenLifecycleEvents.get(result.loaderId().value());
        if (seen != null) {
            seen.forEach(navigation::handleLifecycleEvent);
        }

        long remaining = Math.max(0, deadline - System.nanoTime());
        try {
            navigation.milestone(waitUntil).get(remaining, TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof NavigationException) throw (NavigationException) e.getCause();
            throw new NavigationException(url, "Navigation failed", e.getCause());
        } catch (TimeoutException e) {
            throw new NavigationTimedOutException(url, "Timed out waiting for " + waitUntil.lifecycleEventName());
        }
    }

    @SuppressWarnings("unchecked")
    public <T> T eval(@Language("JavaScript") String script) {
        var evaluate = runtime.evaluate(script, (int) scriptTimeout.toMillis(), true, false);
        if (evaluate.exceptionDetails() != null) {
            throw new ScriptException(evaluate.exceptionDetails().toString());
        }
        return (T) evaluate.result().toJavaObject();
    }

    private static String js(String value) {
        try {
            return RPC.JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String currentUrl() {
        return eval("document.location.href");
    }

    @Override
    public String bodyText() {
        String text = eval("document.body ? document.body.innerText : ''");
        return text == null ? "" : text;
    }

    @Override
    public String outerHtml(String selector, int index) {
        return eval("(() => { const el = document.querySelectorAll(" + js(selector) + ")[" + index + "];" +
                    " return el ? el.outerHTML : null; })()");
    }

    @Override
    public int count(String selector) {
        return asInt(eval("document.querySelectorAll(" + js(selector) + ").length"));
    }

    /**
     * A numeric script result, 0 when the script produced null or undefined.
     */
    static int asInt(Object value) {
        return value instanceof Number number ? number.intValue() : 0;
    }

    @Override
    public boolean click(String selector, int index) {
        Boolean clicked = eval("(() => { const el = document.querySelectorAll(" + js(selector) + ")[" + index + "];" +
                               " if (!el) return false; el.scrollIntoView({block: 'center'}); el.click(); return true; })()");
        return Boolean.TRUE.equals(clicked);
    }

    @Override
    public boolean clickWithin(String scopeSelector, int index, String selector) {
        Boolean clicked = eval("(() => { const scope = document.querySelectorAll(" + js(scopeSelector) + ")[" + index + "];" +
                               " const el = scope ? scope.querySelector(" + js(selector) + ") : null;" +
                               " if (!el) return false; el.scrollIntoView({block: 'center'}); el.click(); return true; })()");
        return Boolean.TRUE.equals(clicked);
    }

    @Override
    public boolean waitForSelector(String selector, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            try {
                if (count(selector) > 0) return true;
            } catch (CDPException | ScriptException e) {
                // the execution context is replaced while a navigation commits
                log.trace("Selector probe failed: {}", e.getMessage());
            }
            if (System.nanoTime() >= deadline) return false;
            Thread.sleep(POLL_INTERVAL.toMillis());
        }
    }

    @Override
    public void typeText(String selector, String text, Duration keystrokeDelay) throws InterruptedException {
        Boolean focused = eval("(() => { const el = document.querySelector(" + js(selector) + ");" +
                               " if (!el) return false; el.focus(); el.value = ''; return true; })()");
        if (!Boolean.TRUE.equals(focused)) {
            throw new ScriptException("No element matches " + selector);
        }
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            input.insertText(new String(Character.toChars(codePoint)));
            i += Character.charCount(codePoint);
            if (!keystrokeDelay.isZero()) Thread.sleep(keystrokeDelay.toMillis());
        }
        eval("(() => { const el = document.querySelector(" + js(selector) + ");" +
             " if (el) { el.dispatchEvent(new KeyboardEvent('keyup', {bubbles: true}));" +
             " el.dispatchEvent(new Event('change', {bubbles: true})); } return null; })()");
    }

    @Override
    public void interceptResponses(Predicate<String> urlFilter, Consumer<InterceptedResponse> listener) {
        interceptors.add(new Interceptor(urlFilter, listener));
        if (!fetchEnabled) {
            synchronized (this) {
                if (!fetchEnabled) {
                    fetch.enable(List.of(new Fetch.RequestPattern("*", null, "Response")));
                    fetchEnabled = true;
                }
            }
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        var navigation = currentNavigation.getAndSet(null);
        if (navigation != null) {
            navigation.completeExceptionally(new NavigationException(navigation.url(), "Window closed"));
        }
        cdpSession.close();
    }

    /**
     * A script evaluated in the page threw or could not run.
     */
    public static class ScriptException extends RuntimeException {
        public ScriptException(String message) {
            super(message);
        }
    }
}
