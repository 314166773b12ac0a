package org.netpreserve.docketcrawl;

import org.junit.jupiter.api.Test;
import org.netpreserve.docketcrawl.cdp.Window;
import org.netpreserve.docketcrawl.cdp.WindowFactory;
import org.netpreserve.docketcrawl.cdp.protocol.CDPClosedException;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BrowserManagerTest {

    @Test
    void startsBrowserOnFirstWindow() {
        var launches = new AtomicInteger();
        var archive = FakeArchive.sampleCase();
        try (var manager = new BrowserManager(() -> {
            launches.incrementAndGet();
            return archive;
        })) {
            assertEquals(0, launches.get());
            manager.newWindow().close();
            manager.newWindow().close();
            assertEquals(1, launches.get());
            assertEquals(2, archive.windowsCreated.get());
        }
    }

    @Test
    void restartsCrashedBrowser() {
        var launches = new AtomicInteger();
        var firstClosed = new AtomicBoolean();
        var archive = FakeArchive.sampleCase();
        WindowFactory crashed = new WindowFactory() {
            @Override
            public Window newWindow() {
                throw new CDPClosedException();
            }

            @Override
            public void close() {
                firstClosed.set(true);
            }
        };
        try (var manager = new BrowserManager(() -> launches.incrementAndGet() == 1 ? crashed : archive)) {
            Window window = manager.newWindow();
            assertNotNull(window);
            window.close();
        }
        assertEquals(2, launches.get());
        assertTrue(firstClosed.get());
    }

    @Test
    void refusesWindowsAfterClose() {
        var manager = new BrowserManager(FakeArchive::sampleCase);
        manager.newWindow().close();
        manager.close();
        assertThrows(IllegalStateException.class, manager::newWindow);
    }
}
