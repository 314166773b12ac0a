package org.netpreserve.docketcrawl.cdp;

import org.netpreserve.docketcrawl.cdp.domains.Browser;
import org.netpreserve.docketcrawl.cdp.domains.Target;
import org.netpreserve.docketcrawl.cdp.protocol.CDPClient;
import org.netpreserve.docketcrawl.cdp.protocol.CDPClosedException;
import org.netpreserve.docketcrawl.cdp.protocol.CDPException;
import org.netpreserve.docketcrawl.cdp.protocol.CDPSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static java.lang.ProcessBuilder.Redirect.INHERIT;
import static java.lang.ProcessBuilder.Redirect.PIPE;
import static java.util.stream.Collectors.joining;

/**
 * A Chromium process controlled over the DevTools protocol.
 * <p>
 * The pipe transport is used wherever a POSIX shell is available to wire up the browser's file descriptors 3 and 4,
 * otherwise the browser listens on a random local port.
 *
 * <pre>{@code
 * try (var browser = BrowserProcess.start(null, true, List.of(), null, WindowSettings.DEFAULTS);
 *      var window = browser.newWindow()) {
 *     window.navigate("https://example.com/", WaitUntil.LOAD, Duration.ofSeconds(30));
 * }
 * }</pre>
 */
public class BrowserProcess implements WindowFactory {
    private static final Logger log = LoggerFactory.getLogger(BrowserProcess.class);
    private static final List<String> BROWSER_EXECUTABLES = List.of(
            "chromium",
            "chromium-browser",
            "google-chrome",
            "google-chrome-stable",
            "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome",
            "C:\\Program Files (x86)\\Google\\Chrome\\Application\\chrome.exe");
    private static final Path SHELL = Path.of("/bin/sh");
    // open PDFs as downloads so their responses reach the Fetch domain instead of the built-in viewer
    private static final String PREFERENCES = "{\"plugins\":{\"always_open_pdf_externally\":true}}";
    private static final int WINDOW_WIDTH = 1920;
    private static final int WINDOW_HEIGHT = 1080;

    private final Process process;
    private final CDPClient cdp;
    private final Browser browser;
    private final Target target;
    private final WindowSettings windowSettings;
    private final Path temporaryProfile;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Thread shutdownHook = new Thread(this::destroy, "browser-shutdown");
    private Browser.Version version;

    private BrowserProcess(Process process, CDPClient cdp, WindowSettings windowSettings, Path temporaryProfile) {
        this.process = process;
        this.cdp = cdp;
        this.browser = cdp.domain(Browser.class);
        this.target = cdp.domain(Target.class);
        this.windowSettings = windowSettings;
        this.temporaryProfile = temporaryProfile;
        try {
            browser.setDownloadBehavior("deny", null, null);
        } catch (CDPException e) {
            log.warn("Unable to disable downloads", e);
        }
    }

    /**
     * Starts a browser.
     *
     * @param executable     browser executable or null to probe for one
     * @param headless       whether to run without a visible window
     * @param options        extra command-line options
     * @param profileDir     user data directory or null for a temporary one deleted on close
     * @param windowSettings emulation overrides applied to every window
     */
    public static BrowserProcess start(String executable, boolean headless, List<String> options, Path profileDir,
                                       WindowSettings windowSettings) throws IOException {
        Path temporaryProfile = null;
        if (profileDir == null) {
            profileDir = Files.createTempDirectory("docketcrawl-profile-");
            temporaryProfile = profileDir;
        }
        Path preferencesFile = profileDir.resolve("Default").resolve("Preferences");
        Files.createDirectories(preferencesFile.getParent());
        Files.writeString(preferencesFile, PREFERENCES);

        boolean pipe = Files.isExecutable(SHELL);
        String browserExecutable = executable != null ? executable : probeForExecutable();
        List<String> command = command(browserExecutable, pipe, headless, profileDir, windowSettings, options);
        Process process = pipe ? launchWithPipe(command) : launchWithPort(command);
        log.atInfo().addKeyValue("executable", browserExecutable).addKeyValue("headless", headless)
                .addKeyValue("transport", pipe ? "pipe" : "socket").log("Started browser");

        try {
            var cdp = pipe ? new CDPClient(process.getInputStream(), process.getOutputStream())
                    : new CDPClient(readDevtoolsUrl(process));
            var browserProcess = new BrowserProcess(process, cdp, windowSettings, temporaryProfile);
            Runtime.getRuntime().addShutdownHook(browserProcess.shutdownHook);
            return browserProcess;
        } catch (IOException | RuntimeException e) {
            terminate(process);
            deleteProfile(temporaryProfile);
            throw e;
        }
    }

    /**
     * The browser command line.
     */
    static List<String> command(String executable, boolean pipe, boolean headless, Path profileDir,
                                WindowSettings windowSettings, List<String> options) {
        var command = new ArrayList<String>();
        command.add(executable);
        command.add(pipe ? "--remote-debugging-pipe" : "--remote-debugging-port=0");
        command.addAll(List.of(
                "--no-default-browser-check",
                "--no-first-run",
                "--no-startup-window",
                "--disable-search-engine-choice-screen",
                "--disable-background-networking",
                "--disable-background-timer-throttling",
                "--disable-backgrounding-occluded-windows",
                "--disable-renderer-backgrounding",
                "--disable-sync",
                "--use-mock-keychain",
                "--disable-blink-features=AutomationControlled",
                "--window-size=" + WINDOW_WIDTH + "," + WINDOW_HEIGHT,
                "--user-data-dir=" + profileDir));
        if (windowSettings != null && windowSettings.locale() != null) {
            command.add("--lang=" + windowSettings.locale());
        }
        if (headless) {
            command.add("--headless=new");
        }
        if (options != null) {
            command.addAll(options);
        }
        return command;
    }

    /**
     * The browser reads commands from FD 3 and writes to FD 4. Java can only redirect stdin and stdout so a shell
     * moves them into place.
     */
    private static Process launchWithPipe(List<String> command) throws IOException {
        String script = "exec " + command.stream().map(BrowserProcess::singleQuote).collect(joining(" "))
                        + " 3<&0 4>&1 0<&- 1>&2";
        return new ProcessBuilder(SHELL.toString(), "-c", script)
                .redirectError(INHERIT)
                .redirectOutput(PIPE)
                .redirectInput(PIPE)
                .start();
    }

    private static Process launchWithPort(List<String> command) throws IOException {
        return new ProcessBuilder(command)
                .redirectInput(INHERIT)
                .redirectOutput(INHERIT)
                .redirectError(PIPE)
                .start();
    }

    private static String singleQuote(String string) {
        return "'" + string.replace("'", "'\\''") + "'";
    }

    /**
     * Looks for an installed browser without starting it.
     */
    public static Optional<String> findExecutable() {
        try {
            return Optional.of(probeForExecutable());
        } catch (IOException e) {
            log.debug("No browser found", e);
            return Optional.empty();
        }
    }

    private static String probeForExecutable() throws IOException {
        for (String candidate : BROWSER_EXECUTABLES) {
            Path path = Path.of(candidate);
            if (path.isAbsolute()) {
                if (Files.isExecutable(path)) return candidate;
                continue;
            }
            String pathVariable = System.getenv("PATH");
            if (pathVariable == null) continue;
            for (String dir : pathVariable.split(java.io.File.pathSeparator)) {
                if (!dir.isEmpty() && Files.isExecutable(Path.of(dir, candidate))) {
                    return Path.of(dir, candidate).toString();
                }
            }
        }
        throw new IOException("Couldn't detect browser. Set browser.executable in the config");
    }

    private static URI readDevtoolsUrl(Process process) throws IOException {
        var future = new CompletableFuture<URI>();
        var thread = new Thread(() -> {
            String prefix = "DevTools listening on ";
            try (var reader = new BufferedReader(new InputStreamReader(process.getErrorStream(),
                    StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.startsWith(prefix)) future.complete(URI.create(line.substring(prefix.length())));
                    log.info("Browser: {}", line);
                }
                future.completeExceptionally(new IOException("Browser exited before reporting a DevTools URL"));
            } catch (IOException e) {
                log.error("Error reading browser stderr", e);
                future.completeExceptionally(e);
            }
        }, "browser-stderr");
        thread.setDaemon(true);
        thread.start();
        try {
            return future.get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted waiting for DevTools URL", e);
        } catch (TimeoutException | ExecutionException e) {
            throw new IOException("Browser did not report a DevTools URL", e);
        }
    }

    private static void terminate(Process process) {
        try {
            if (process.waitFor(1, TimeUnit.SECONDS)) return;
            process.destroy();
            if (process.waitFor(10, TimeUnit.SECONDS)) return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        process.destroyForcibly();
    }

    private static void deleteProfile(Path profile) {
        if (profile == null || !Files.exists(profile)) return;
        try (Stream<Path> files = Files.walk(profile)) {
            files.sorted(Comparator.reverseOrder()).forEach(file -> {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            log.atWarn().addKeyValue("profile", profile).log("Unable to delete temporary profile: {}", e.getMessage());
        }
    }

    /**
     * Asks the browser to quit, closes the connection and makes sure the process is gone.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            browser.close();
            cdp.waitClose(Duration.ofSeconds(1));
        } catch (CDPClosedException e) {
            log.debug("Browser already closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.warn("Error quitting browser", e);
        }
        try {
            cdp.close();
        } catch (RuntimeException e) {
            log.warn("Error closing browser CDP connection", e);
        }
        destroy();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down");
        }
    }

    private void destroy() {
        terminate(process);
        deleteProfile(temporaryProfile);
    }

    public boolean isAlive() {
        return process.isAlive() && !cdp.isClosed();
    }

    /**
     * Opens a new tab with its own session.
     */
    @Override
    public Navigator newWindow() {
        String targetId = target.createTarget("about:blank", null, true, WINDOW_WIDTH, WINDOW_HEIGHT).targetId();
        String sessionId = target.attachToTarget(targetId, true).sessionId();
        var session = new CDPSession(cdp, sessionId, targetId);
        try {
            return new Navigator(session, windowSettings);
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
    }

    public Browser.Version version() {
        if (version == null) {
            version = browser.getVersion();
        }
        return version;
    }
}
