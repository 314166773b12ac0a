package org.netpreserve.docketcrawl.cdp;

/**
 * Source of browser windows.
 */
public interface WindowFactory extends AutoCloseable {
    Window newWindow();

    @Override
    void close();
}
