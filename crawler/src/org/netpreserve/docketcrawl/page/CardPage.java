package org.netpreserve.docketcrawl.page;

import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.netpreserve.docketcrawl.Party;
import org.netpreserve.docketcrawl.cdp.Window;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The case card header: identifiers, status and participants.
 */
public class CardPage {
    public static final String READY = "div.b-chrono-item-header.js-chrono-item-header, #chrono_list_content";
    static final String CASE_ID = "input#caseId";
    static final String CASE_NAME = "input#caseName";
    static final String STATUS = "div.b-case-header-desc";
    static final String PARTIES = "#gr_case_partps";
    private static final Map<String, String> PARTY_COLUMNS = Map.of(
            "td.plaintiffs", "plaintiff",
            "td.defendants", "defendant",
            "td.third", "third_party",
            "td.others", "other");
    private static final List<String> PARTY_COLUMN_ORDER = List.of("td.plaintiffs", "td.defendants", "td.third",
            "td.others");
    private final Window window;

    public CardPage(Window window) {
        this.window = window;
    }

    public Card parse() {
        Document document = Snapshots.document(window);
        return new Card(
                valueOf(document, CASE_ID),
                valueOf(document, CASE_NAME),
                textOf(document, STATUS),
                parties(document));
    }

    private static List<Party> parties(Document document) {
        var parties = new ArrayList<Party>();
        Element table = document.selectFirst(PARTIES);
        if (table == null) return parties;
        for (String column : PARTY_COLUMN_ORDER) {
            for (Element item : table.select(column + " li")) {
                // the visible name is the rollover's own text; the nested rolloverHtml holds address details
                Element rollover = item.selectFirst(".js-rollover");
                String name = rollover != null ? rollover.ownText() : item.ownText();
                if (name.isBlank()) name = item.text();
                if (!name.isBlank()) parties.add(new Party(PARTY_COLUMNS.get(column), name.strip()));
            }
        }
        return parties;
    }

    @Nullable
    private static String valueOf(Document document, String selector) {
        Element element = document.selectFirst(selector);
        if (element == null || element.attr("value").isBlank()) return null;
        return element.attr("value").strip();
    }

    @Nullable
    private static String textOf(Document document, String selector) {
        Element element = document.selectFirst(selector);
        if (element == null) return null;
        return element.text().strip();
    }

    /**
     * @param caseGuid   value of the hidden caseId input
     * @param caseNumber value of the hidden caseName input
     */
    public record Card(@Nullable String caseGuid, @Nullable String caseNumber, @Nullable String status,
                       List<Party> parties) {
    }
}
