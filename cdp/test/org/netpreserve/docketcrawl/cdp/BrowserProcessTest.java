package org.netpreserve.docketcrawl.cdp;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BrowserProcessTest {
    private final WindowSettings russian = new WindowSettings("TestAgent/1.0", "ru-RU,ru;q=0.9", "ru-RU",
            "Europe/Moscow");

    @Test
    void pipeCommand() {
        var command = BrowserProcess.command("chromium", true, true, Path.of("/tmp/profile"), russian,
                List.of("--proxy-server=socks5://127.0.0.1:1080"));
        assertEquals("chromium", command.get(0));
        assertEquals("--remote-debugging-pipe", command.get(1));
        assertTrue(command.contains("--user-data-dir=" + Path.of("/tmp/profile")));
        assertTrue(command.contains("--lang=ru-RU"));
        assertTrue(command.contains("--headless=new"));
        assertTrue(command.contains("--disable-blink-features=AutomationControlled"));
        assertEquals("--proxy-server=socks5://127.0.0.1:1080", command.get(command.size() - 1));
    }

    @Test
    void portCommandWithDefaults() {
        var command = BrowserProcess.command("chrome.exe", false, false, Path.of("profile"), WindowSettings.DEFAULTS,
                null);
        assertEquals("--remote-debugging-port=0", command.get(1));
        assertFalse(command.contains("--headless=new"));
        assertTrue(command.stream().noneMatch(arg -> arg.startsWith("--lang=")));
    }
}
