package org.netpreserve.docketcrawl.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CrawlerConfigTest {
    @Test
    public void defaults() throws IOException {
        var config = CrawlerConfig.defaults();
        assertEquals("https://kad.arbitr.ru/", config.archive().entryUrl());
        assertEquals("https://kad.arbitr.ru/Card/abc", config.archive().cardUrl("abc"));
        assertEquals(Duration.ofSeconds(60), config.challenge().handshakeTimeout());
        assertEquals(Duration.ofMillis(100), config.navigation().keystrokeDelay());
        assertEquals(3, config.fetch().maxRetries());
        assertEquals(1, config.fetch().maxConcurrent());
        assertEquals(Duration.ofSeconds(45), config.pacing().breakDuration());
        assertEquals(4, config.rateLimit().phrases().size());
        assertEquals(Path.of("output"), config.storage().outputRoot());
        assertEquals(List.of(), config.browser().options());
    }

    @Test
    public void userFileOverridesOnlyWhatItNames(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.yaml");
        Files.writeString(file, """
                browser:
                  headless: true
                  options: "--proxy-server='socks://127.0.0.1:1080' --lang=ru"
                fetch:
                  maxConcurrent: 2
                  timeout: 45s
                rateLimit:
                  phrases: [Blocked]
                """);
        var config = CrawlerConfig.load(file);
        assertTrue(config.browser().headless());
        assertEquals(List.of("--proxy-server=socks://127.0.0.1:1080", "--lang=ru"), config.browser().options());
        assertEquals("ru-RU", config.browser().locale());
        assertEquals(2, config.fetch().maxConcurrent());
        assertEquals(Duration.ofSeconds(45), config.fetch().timeout());
        assertEquals(3, config.fetch().maxRetries());
        assertEquals(List.of("Blocked"), config.rateLimit().phrases());
    }

    @Test
    public void dumpedConfigLoadsBack(@TempDir Path dir) throws IOException {
        var config = CrawlerConfig.loadWithOverrides("pacing: {betweenDocuments: 1500ms}");
        assertEquals(Duration.ofMillis(1500), config.pacing().betweenDocuments());
        Path file = dir.resolve("dumped.yaml");
        Files.writeString(file, config.toYaml());
        var reloaded = CrawlerConfig.load(file);
        assertEquals(config.pacing(), reloaded.pacing());
        assertEquals(config.navigation(), reloaded.navigation());
        assertEquals(config.rateLimit(), reloaded.rateLimit());
    }
}
