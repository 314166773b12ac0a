package org.netpreserve.docketcrawl;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import org.netpreserve.docketcrawl.cdp.protocol.CDPBase;
import org.netpreserve.docketcrawl.config.CrawlerConfig;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public class Docketcrawl {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(Docketcrawl.class);

    public static void main(String[] args) throws Exception {
        Path outputRoot = null;
        Path configFile = null;
        String caseNumber = null;
        boolean resume = true;
        boolean dumpConfig = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> configFile = Path.of(args[++i]);
                case "--dump-config" -> dumpConfig = true;
                case "--no-resume" -> resume = false;
                case "--output", "-o" -> outputRoot = Path.of(args[++i]);
                case "--help", "-h" -> {
                    System.out.println("Usage: docketcrawl [options] CASE_NUMBER");
                    System.out.println("Options:");
                    System.out.println("  -c, --config FILE        YAML file overriding the default settings");
                    System.out.println("      --dump-config        Print the effective settings and exit");
                    System.out.println("  -h, --help");
                    System.out.println("      --no-resume          Ignore earlier progress and fetch everything again");
                    System.out.println("  -o, --output DIR         Output root directory");
                    System.out.println("      --trace-cdp <file>   Write CDP trace to file");
                    System.exit(0);
                }
                case "--trace-cdp" -> startCdpTraceFile(args[++i]);
                default -> {
                    if (args[i].startsWith("-") || caseNumber != null) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(CrawlException.FATAL);
                    }
                    caseNumber = args[i];
                }
            }
        }

        CrawlerConfig config = CrawlerConfig.load(configFile);
        if (dumpConfig) {
            System.out.print(config.toYaml());
            System.exit(0);
        }
        if (caseNumber == null) {
            System.err.println("Usage: docketcrawl [options] CASE_NUMBER");
            System.exit(CrawlException.INVALID_CASE_NUMBER);
        }
        if (outputRoot == null) outputRoot = config.storage().outputRoot();

        System.exit(run(config, caseNumber, outputRoot, resume));
    }

    private static int run(CrawlerConfig config, String caseNumber, Path outputRoot, boolean resume) {
        try (var browser = new BrowserManager(config.browser())) {
            var orchestrator = new CrawlOrchestrator(config, browser);
            var shutdownHook = new Thread(() -> {
                orchestrator.cancel();
                try {
                    if (!orchestrator.awaitTermination(config.fetch().timeout().plusSeconds(10))) {
                        System.err.println("Crawl did not stop in time");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "shutdown-hook");
            Runtime.getRuntime().addShutdownHook(shutdownHook);

            CrawlResult result = orchestrator.crawl(caseNumber, outputRoot, resume);
            log.atInfo().addKeyValue("outcome", result.outcome()).addKeyValue("discovered", result.discovered())
                    .addKeyValue("fetched", result.fetched()).addKeyValue("skipped", result.skipped())
                    .log("Output in {}", result.caseDirectory());
            removeHook(shutdownHook);
            return result.exitCode();
        } catch (CrawlException e) {
            log.error("{}", e.getMessage());
            if (e instanceof AmbiguousResultException ambiguous) {
                ambiguous.suggestions().forEach(suggestion -> System.err.println("  " + suggestion));
            }
            return e.exitCode();
        } catch (RuntimeException e) {
            log.error("Crawl failed", e);
            return CrawlException.FATAL;
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Already shutting down");
        }
    }

    /**
     * Sends protocol traces to a file while keeping the console at its configured level.
     */
    private static void startCdpTraceFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{HH:mm:ss.SSS} [%thread] %-5level %logger{20} %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("cdp-trace-file");
        fileAppender.setFile(file);
        fileAppender.start();

        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        Level consoleLevel = rootLogger.getEffectiveLevel();
        Appender<ILoggingEvent> stdout = rootLogger.getAppender("STDOUT");
        if (stdout != null && consoleLevel.toInt() > Level.TRACE_INT) {
            var filter = new ThresholdFilter();
            filter.setLevel(consoleLevel.toString());
            filter.start();
            stdout.stop();
            stdout.addFilter(filter);
            stdout.start();
        }
        for (Class<?> traced : new Class<?>[]{CDPBase.class, org.netpreserve.docketcrawl.cdp.protocol.RPC.Pipe.class}) {
            var logger = context.getLogger(traced);
            logger.addAppender(fileAppender);
            logger.setLevel(Level.TRACE);
        }
    }
}
