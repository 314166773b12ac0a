package org.netpreserve.docketcrawl.page;

import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.netpreserve.docketcrawl.cdp.Window;

/**
 * Parses HTML taken from the live window with jsoup, resolving links against the window's URL.
 */
final class Snapshots {
    private Snapshots() {
    }

    static Document document(Window window) {
        String html = window.outerHtml("html");
        return Jsoup.parse(html == null ? "" : html, window.currentUrl());
    }

    @Nullable
    static Element element(Window window, String selector, int index) {
        String html = window.outerHtml(selector, index);
        if (html == null) return null;
        Element body = Jsoup.parseBodyFragment(html, window.currentUrl()).body();
        return body.childrenSize() == 0 ? body : body.child(0);
    }

    @Nullable
    static Element element(Window window, String selector) {
        return element(window, selector, 0);
    }

    static boolean isHidden(Element element) {
        String style = element.attr("style").replace(" ", "").toLowerCase();
        return style.contains("display:none") || element.hasClass("g-hidden");
    }
}
