package org.netpreserve.docketcrawl.page;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads document links and their row metadata. Shared by all tabs since they render rows the same way: the link
 * sits in a container that also holds the signature marker and the judge and signer rollovers.
 */
public final class DocumentRows {
    static final String SIGNATURE = ".g-valid_sign";
    static final String TITLE = ".js-judges-rollover";
    static final String JUDGE_ROLLOVER = ".js-judges-rolloverHtml";
    static final String SIGNERS_ROLLOVER = ".js-signers-rolloverHtml";
    private static final Pattern JUDGE = Pattern.compile("Судья[^:]*:\\s*</strong>\\s*<br[^>]*>\\s*([^<]+)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private DocumentRows() {
    }

    public static List<DocumentRow> parse(Element scope, String linkSelector) {
        var rows = new ArrayList<DocumentRow>();
        for (Element link : scope.select(linkSelector)) {
            String url = link.absUrl("href");
            if (url.isEmpty()) url = link.attr("href");
            if (url.isEmpty()) continue;
            rows.add(parseRow(link, url));
        }
        return rows;
    }

    private static DocumentRow parseRow(Element link, String url) {
        Element parent = link.parent() != null ? link.parent() : link;

        boolean signed = false;
        boolean signatureValid = false;
        Element signature = parent.selectFirst(SIGNATURE);
        if (signature != null) {
            signed = true;
            signatureValid = signature.text().contains("Подписано");
        }

        String title = null;
        Element titleElement = link.selectFirst(TITLE);
        if (titleElement != null && !titleElement.text().isBlank()) {
            title = titleElement.text().strip();
        } else if (!link.ownText().isBlank()) {
            title = link.ownText().strip();
        }

        String judge = null;
        Element judgeElement = parent.selectFirst(JUDGE_ROLLOVER);
        if (judgeElement != null) {
            Matcher m = JUDGE.matcher(judgeElement.html());
            if (m.find()) judge = collapseWhitespace(m.group(1));
        }

        String court = null;
        Element signers = parent.selectFirst(SIGNERS_ROLLOVER);
        if (signers != null) {
            court = signers.wholeText().lines()
                    .map(String::strip)
                    .filter(line -> !line.isEmpty())
                    .findFirst()
                    .map(DocumentRows::normalizeCourtName)
                    .orElse(null);
        }
        return new DocumentRow(url, title, signed, signatureValid, judge, court);
    }

    /**
     * Collapses whitespace and capitalizes each word, keeping short all-caps abbreviations such as "АС".
     */
    static String normalizeCourtName(String raw) {
        var result = new StringBuilder();
        for (String word : collapseWhitespace(raw).split(" ")) {
            if (word.isEmpty()) continue;
            if (!result.isEmpty()) result.append(' ');
            if (word.length() <= 3 && isUpperCase(word)) {
                result.append(word);
            } else {
                result.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                        .append(word.substring(1).toLowerCase(Locale.ROOT));
            }
        }
        return result.toString();
    }

    private static boolean isUpperCase(String word) {
        boolean hasLetter = false;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isLowerCase(c)) return false;
            if (Character.isUpperCase(c)) hasLetter = true;
        }
        return hasLetter;
    }

    private static String collapseWhitespace(String text) {
        return text.strip().replaceAll("\\s+", " ");
    }
}
