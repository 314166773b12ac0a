package org.netpreserve.docketcrawl;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A normalized arbitration case number such as "А60-21280/2023".
 */
public record CaseNumber(String value) {
    private static final Pattern PATTERN = Pattern.compile("^[A-ZА-ЯЁ0-9]{1,6}-\\d{1,7}/\\d{4}$");
    private static final Pattern EMBEDDED = Pattern.compile("(?<![A-ZА-ЯЁ0-9])[A-ZА-ЯЁ0-9]{1,6}-\\d{1,7}/\\d{4}(?!\\d)");
    private static final String LATIN_LOOKALIKES = "ABCEHKMOPTXY";
    private static final String CYRILLIC_LETTERS = "АВСЕНКМОРТХУ";
    private static final String[] TRANSLITERATION = {
            "A", "B", "V", "G", "D", "E", "ZH", "Z", "I", "Y", "K", "L", "M", "N", "O", "P",
            "R", "S", "T", "U", "F", "KH", "TS", "CH", "SH", "SHCH", "", "Y", "", "E", "YU", "YA"};

    /**
     * Removes whitespace, upper-cases and folds Latin letters that look like Cyrillic ones into Cyrillic, then
     * validates.
     *
     * @throws InvalidCaseNumberException if the result isn't a case number
     */
    public static CaseNumber parse(String input) {
        if (input == null) throw new InvalidCaseNumberException("");
        String normalized = fold(StringUtils.deleteWhitespace(input));
        if (!PATTERN.matcher(normalized).matches()) throw new InvalidCaseNumberException(input);
        return new CaseNumber(normalized);
    }

    /**
     * The first case number appearing in free text such as a search suggestion.
     */
    public static Optional<CaseNumber> find(String text) {
        if (text == null) return Optional.empty();
        Matcher m = EMBEDDED.matcher(fold(text));
        return m.find() ? Optional.of(new CaseNumber(m.group())) : Optional.empty();
    }

    private static String fold(String text) {
        return StringUtils.replaceChars(text.toUpperCase(Locale.ROOT), LATIN_LOOKALIKES, CYRILLIC_LETTERS);
    }

    /**
     * Whether some text (e.g. a search suggestion) denotes this case number.
     */
    public boolean matches(String text) {
        try {
            return parse(text).equals(this);
        } catch (InvalidCaseNumberException e) {
            return false;
        }
    }

    /**
     * Court prefix such as "А60".
     */
    public String courtCode() {
        return value.substring(0, value.indexOf('-'));
    }

    /**
     * Form usable in file names: "А60-21280-2023".
     */
    public String safeName() {
        return value.replace('/', '-');
    }

    /**
     * ASCII form usable in file names: "A60-21280-2023".
     */
    public String asciiName() {
        var name = new StringBuilder();
        for (char c : safeName().toCharArray()) {
            if (c < 128) {
                name.append(c);
            } else if (c == 'Ё') {
                name.append('E');
            } else if (c >= 'А' && c <= 'Я') {
                name.append(TRANSLITERATION[c - 'А']);
            } else {
                name.append('_');
            }
        }
        return name.toString();
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
