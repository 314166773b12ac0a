package org.netpreserve.docketcrawl;

import org.netpreserve.docketcrawl.cdp.BrowserProcess;
import org.netpreserve.docketcrawl.cdp.Window;
import org.netpreserve.docketcrawl.cdp.WindowFactory;
import org.netpreserve.docketcrawl.cdp.protocol.CDPClosedException;
import org.netpreserve.docketcrawl.cdp.protocol.CDPTimeoutException;
import org.netpreserve.docketcrawl.config.BrowserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.function.Function;

/**
 * Wrapper for the browser that starts it on first use and restarts it upon crash.
 */
public class BrowserManager implements WindowFactory {
    private static final Logger log = LoggerFactory.getLogger(BrowserManager.class);
    private final BrowserLauncher launcher;
    private volatile WindowFactory browser;
    private volatile boolean closed;

    public BrowserManager(BrowserConfig config) {
        this(() -> BrowserProcess.start(config.executable(), config.headless(), config.options(),
                config.profileDir(), config.windowSettings()));
    }

    public BrowserManager(BrowserLauncher launcher) {
        this.launcher = launcher;
    }

    private synchronized WindowFactory browser() {
        if (closed) throw new IllegalStateException("Browser manager is closed");
        if (browser == null) {
            try {
                browser = launcher.launch();
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to start browser", e);
            }
        }
        return browser;
    }

    private synchronized void restart(WindowFactory crashed, Throwable reason) {
        if (browser != crashed) return; // another thread already restarted it
        log.warn("Restarting browser after crash.", reason);
        try {
            crashed.close();
        } catch (RuntimeException e) {
            log.debug("Error closing crashed browser", e);
        }
        browser = null;
    }

    @Override
    public Window newWindow() {
        return restartOnError(WindowFactory::newWindow);
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (browser != null) {
            browser.close();
            browser = null;
        }
    }

    <T> T restartOnError(Function<WindowFactory, T> body) {
        WindowFactory current = browser();
        try {
            return body.apply(current);
        } catch (UncheckedIOException | CDPClosedException | CDPTimeoutException e) {
            restart(current, e);
            return body.apply(browser());
        }
    }

    /**
     * Starts a browser.
     */
    @FunctionalInterface
    public interface BrowserLauncher {
        WindowFactory launch() throws IOException;
    }
}
