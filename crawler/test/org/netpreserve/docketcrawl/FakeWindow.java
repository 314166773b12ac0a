package org.netpreserve.docketcrawl;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.netpreserve.docketcrawl.cdp.InterceptedResponse;
import org.netpreserve.docketcrawl.cdp.NavigationException;
import org.netpreserve.docketcrawl.cdp.NavigationFailedException;
import org.netpreserve.docketcrawl.cdp.WaitUntil;
import org.netpreserve.docketcrawl.cdp.Window;
import org.netpreserve.docketcrawl.page.SearchPage;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

import static org.netpreserve.docketcrawl.FakeArchive.CARD_URL;
import static org.netpreserve.docketcrawl.FakeArchive.CASE_GUID;
import static org.netpreserve.docketcrawl.FakeArchive.CASE_NUMBER;
import static org.netpreserve.docketcrawl.FakeArchive.ENTRY_URL;

/**
 * A window onto {@link FakeArchive}. The page is a jsoup document re-rendered from the window's state after every
 * navigation, click and keystroke.
 */
class FakeWindow implements Window {
    private final FakeArchive archive;
    private final List<Interceptor> interceptors = new CopyOnWriteArrayList<>();
    private String url = "about:blank";
    private Document document = Jsoup.parse("", "about:blank");
    private String page = "blank";
    private String bodyOverride;
    private boolean promoShown;
    private String typed;
    private String tab;
    private int caseFilePage = 1;
    private final Set<String> expanded = new HashSet<>();
    private final Map<String, Integer> instancePages = new HashMap<>();
    private volatile boolean closed;

    private record Interceptor(Predicate<String> filter, Consumer<InterceptedResponse> listener) {
    }

    FakeWindow(FakeArchive archive) {
        this.archive = archive;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public void navigate(String url, WaitUntil waitUntil, Duration timeout) throws NavigationException {
        if (closed) throw new IllegalStateException("window closed");
        archive.navigations.add(url);
        this.url = url;
        this.bodyOverride = null;
        if (url.equals(ENTRY_URL)) {
            page = archive.challengePasses ? "entry" : "challenge";
            promoShown = true;
            typed = null;
        } else if (url.equals(CARD_URL)) {
            page = "card";
            tab = null;
            caseFilePage = 1;
            expanded.clear();
            instancePages.clear();
        } else if (url.contains("/PdfDocument/")) {
            page = "blank";
            serveAttachment(url);
        } else {
            page = "blank";
            render();
            throw new NavigationFailedException(url, "net::ERR_NAME_NOT_RESOLVED");
        }
        render();
    }

    private void serveAttachment(String url) throws NavigationException {
        String docGuid = url.split("/")[6];
        archive.attachmentRequests.add(docGuid);
        if (archive.throttled.contains(docGuid)) {
            bodyOverride = FakeArchive.THROTTLE_TEXT;
            return;
        }
        Integer failures = archive.failuresLeft.get(docGuid);
        if (failures != null && failures > 0) {
            archive.failuresLeft.put(docGuid, failures - 1);
            return;
        }
        deliver(new InterceptedResponse(url, 302, null, new byte[0]));
        deliver(new InterceptedResponse(url.replace("/Kad/PdfDocument/", "/Document/Pdf/"), 200,
                "application/pdf", archive.pdf(docGuid)));
        render();
        throw new NavigationFailedException(url, "net::ERR_ABORTED");
    }

    private void deliver(InterceptedResponse response) {
        for (Interceptor interceptor : interceptors) {
            if (interceptor.filter().test(response.url())) interceptor.listener().accept(response);
        }
    }

    private void render() {
        String body = switch (page) {
            case "entry" -> entryPage();
            case "challenge" -> "<p>Проверка браузера...</p>";
            case "card" -> cardPage();
            default -> "";
        };
        if (bodyOverride != null) body = "<p>" + bodyOverride + "</p>";
        document = Jsoup.parse("<html><body>" + body + "</body></html>", url);
    }

    private String entryPage() {
        var html = new StringBuilder();
        if (promoShown) html.append("<div class='promo'><a class='js-promo_notification-popup-close'>x</a></div>");
        html.append("<form id='sug-cases'><input type='text' placeholder='Номер дела'></form>");
        if (typed != null && !typed.isEmpty()) {
            html.append("<ul class='b-suggest'>");
            for (SearchPage.Suggestion suggestion : archive.suggestions) {
                html.append("<li><a id='").append(suggestion.caseGuid()).append("'>").append(suggestion.text())
                        .append("</a></li>");
            }
            html.append("</ul>");
        }
        return html.toString();
    }

    private String cardPage() {
        var html = new StringBuilder();
        html.append("<p>").append(archive.cardBanner).append("</p>");
        html.append("<input id='caseId' type='hidden' value='").append(CASE_GUID).append("'>");
        if (archive.cardShowsCaseNumber) {
            html.append("<input id='caseName' type='hidden' value='").append(CASE_NUMBER).append("'>");
        }
        html.append("<div class='b-case-header-desc'>Рассмотрение дела завершено</div>");
        html.append("<table id='gr_case_partps'><tr>")
                .append("<td class='plaintiffs'><ul><li><span class='js-rollover'>ООО \"Ромашка\"")
                .append("<span class='js-rolloverHtml'>г. Екатеринбург</span></span></li></ul></td>")
                .append("<td class='defendants'><ul><li><span class='js-rollover'>ИП Иванов</span></li></ul></td>")
                .append("</tr></table>");

        html.append("<div id='case_acts'>Судебные акты</div><div id='gr_case_acts'><ul>");
        for (String act : archive.acts) {
            html.append("<li><a href='").append(FakeArchive.documentUrl(act)).append("'>Акт ").append(act)
                    .append("</a></li>");
        }
        html.append("</ul></div>");

        html.append("<div class='js-case-chrono-button--cards'>Карточки</div>");
        if (archive.caseFileTabPresent) html.append("<div class='js-case-chrono-button--ed'>Электронное дело</div>");

        html.append("<div id='chrono_list_content'").append("cards".equals(tab) ? "" : " class='g-hidden'").append(">");
        for (FakeArchive.Instance instance : archive.instances) {
            html.append("<div class='b-chrono-item-header js-chrono-item-header' data-id='").append(instance.id())
                    .append("'><div class='l-col'><strong>").append(instance.name())
                    .append("</strong><span class='b-reg-date'>01.02.2023</span></div>")
                    .append("<div class='r-col'><span class='b-case-link'>").append(CASE_NUMBER)
                    .append("</span><span class='instantion-name'>АС Свердловской области</span>");
            if (instance.headerDocument() != null) {
                html.append("<a href='").append(FakeArchive.documentUrl(instance.headerDocument()))
                        .append("'>Решение</a>");
            }
            html.append("</div>");
            if (!instance.pages().isEmpty()) html.append("<span class='b-collapse js-collapse'>+</span>");
            html.append("</div>");

            boolean open = expanded.contains(instance.id());
            int current = instancePages.getOrDefault(instance.id(), 1);
            html.append("<div class='b-chrono-items-container js-chrono-items-container")
                    .append(open ? "" : " g-hidden").append("' data-instance='").append(instance.id()).append("'>");
            if (!instance.pages().isEmpty()) {
                appendListing(html, instance.pages(), current, "");
            }
            html.append("</div>");
        }
        html.append("</div>");

        if (archive.caseFileTabPresent) {
            html.append("<div id='chrono_ed_content'").append("ed".equals(tab) ? "" : " class='g-hidden'").append(">");
            if (!archive.caseFilePages.isEmpty()) {
                appendListing(html, archive.caseFilePages, caseFilePage, "b-case-chrono-ed-item-link");
            }
            html.append("</div>");
        }
        return html.toString();
    }

    private static void appendListing(StringBuilder html, List<List<String>> pages, int current, String linkClass) {
        html.append("<ul class='items'>");
        for (String docGuid : pages.get(current - 1)) {
            html.append("<li><a class='").append(linkClass).append("' href='").append(FakeArchive.documentUrl(docGuid))
                    .append("'>Документ ").append(docGuid).append("</a></li>");
        }
        html.append("</ul>");
        if (pages.size() > 1) {
            html.append("<ul class='pager'>");
            for (int i = 1; i <= pages.size(); i++) {
                html.append("<li class='js-chrono-pagination-pager-item").append(i == current ? " active" : "")
                        .append("' data-page_num='").append(i).append("'>").append(i).append("</li>");
            }
            html.append("</ul>");
        }
    }

    private void handleClick(Element element) {
        if (element.hasClass("js-promo_notification-popup-close")) {
            promoShown = false;
        } else if (element.id().equals("case_acts")) {
            tab = "acts";
        } else if (element.hasClass("js-case-chrono-button--cards")) {
            tab = "cards";
        } else if (element.hasClass("js-case-chrono-button--ed")) {
            tab = "ed";
        } else if (element.hasClass("js-collapse")) {
            Element header = element.closest(".js-chrono-item-header");
            if (header != null) expanded.add(header.attr("data-id"));
        } else if (element.hasClass("js-chrono-pagination-pager-item")) {
            int page = Integer.parseInt(element.attr("data-page_num"));
            Element container = element.closest(".js-chrono-items-container");
            if (container != null) {
                instancePages.put(container.attr("data-instance"), page);
            } else if (element.closest("#chrono_ed_content") != null) {
                caseFilePage = page;
            }
        }
        if (tab != null && tab.equals(archive.throttledTab)) bodyOverride = FakeArchive.THROTTLE_TEXT;
        render();
    }

    @Override
    public String currentUrl() {
        return url;
    }

    @Override
    public String bodyText() {
        return document.body() == null ? "" : document.body().text();
    }

    @Override
    public String outerHtml(String selector, int index) {
        Elements elements = document.select(selector);
        return index < elements.size() ? elements.get(index).outerHtml() : null;
    }

    @Override
    public int count(String selector) {
        return document.select(selector).size();
    }

    @Override
    public boolean click(String selector, int index) {
        Elements elements = document.select(selector);
        if (index >= elements.size()) return false;
        handleClick(elements.get(index));
        return true;
    }

    @Override
    public boolean clickWithin(String scopeSelector, int index, String selector) {
        Elements scopes = document.select(scopeSelector);
        if (index >= scopes.size()) return false;
        Element element = scopes.get(index).selectFirst(selector);
        if (element == null) return false;
        handleClick(element);
        return true;
    }

    @Override
    public boolean waitForSelector(String selector, Duration timeout) {
        return !document.select(selector).isEmpty();
    }

    @Override
    public void typeText(String selector, String text, Duration keystrokeDelay) {
        if (document.selectFirst(selector) == null) throw new IllegalStateException("No element " + selector);
        typed = text;
        render();
    }

    @Override
    public void interceptResponses(Predicate<String> urlFilter, Consumer<InterceptedResponse> listener) {
        interceptors.add(new Interceptor(urlFilter, listener));
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            archive.windowsOpen.decrementAndGet();
        }
    }
}
