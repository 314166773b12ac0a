package org.netpreserve.docketcrawl.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class LogUtils {
    private static final Pattern STRING_LITERAL = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"");

    public static String ellipses(String string) {
        return ellipses(string, 40);
    }

    /**
     * Shortens every double-quoted string literal longer than maxLength by replacing its middle with "...".
     * Keeps protocol traces readable when messages carry base64 bodies or whole documents.
     */
    public static String ellipses(String string, int maxLength) {
        Matcher matcher = STRING_LITERAL.matcher(string);
        var output = new StringBuilder(Math.min(string.length(), 1024));
        while (matcher.find()) {
            String literal = matcher.group(1);
            if (literal.length() >= maxLength) {
                int keep = maxLength / 2;
                literal = literal.substring(0, keep) + "..." + literal.substring(literal.length() - keep);
            }
            matcher.appendReplacement(output, Matcher.quoteReplacement("\"" + literal + "\""));
        }
        matcher.appendTail(output);
        return output.toString();
    }

    /**
     * Truncates a string for use in a log line.
     */
    public static String abbreviate(String string, int maxLength) {
        if (string == null || string.length() <= maxLength) return string;
        return string.substring(0, Math.max(0, maxLength - 3)) + "...";
    }
}
