package org.netpreserve.docketcrawl;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A document link found on one of the case card tabs.
 *
 * @param caseGuid       case GUID from the URL, null when the URL has no recognizable GUIDs
 * @param docGuid        document GUID from the URL, or the URL digest
 * @param url            absolute attachment URL
 * @param filename       last URL path segment, decoded
 * @param sourceTab      tab the link was found on
 * @param instanceId     judicial instance (cards tab only)
 * @param title          link text, e.g. "Определение о принятии заявления"
 * @param date           date encoded in the file name
 * @param docType        document type encoded in the file name, e.g. "Opredelenie"
 * @param signed         the row carries a digital signature marker
 * @param signatureValid the signature marker says the document is signed
 * @param judge          reporting judge from the row's rollover
 * @param court          court name from the row's signers rollover
 * @param page           listing page the link was found on, 0 for instance header links
 * @param position       1-based position within its section (tab or instance)
 */
public record DocumentReference(
        @Nullable String caseGuid,
        String docGuid,
        String url,
        String filename,
        SourceTab sourceTab,
        @Nullable String instanceId,
        @Nullable String title,
        @Nullable LocalDate date,
        @Nullable String docType,
        boolean signed,
        boolean signatureValid,
        @Nullable String judge,
        @Nullable String court,
        int page,
        int position
) {
    private static final Pattern FILENAME_DATE = Pattern.compile("_(\\d{4})(\\d{2})(\\d{2})_");

    /**
     * Builds a reference from a URL alone; date and type come from the file name.
     */
    public static DocumentReference of(String url, String identityMarker, SourceTab sourceTab,
                                       @Nullable String instanceId, int page, int position) {
        var identity = DocumentIdentity.fromUrl(url, identityMarker);
        String filename = filenameOf(url);
        return new DocumentReference(identity.caseGuid(), identity.docGuid(), url, filename, sourceTab, instanceId,
                null, dateFromFilename(filename), typeFromFilename(filename), false, false, null, null,
                page, position);
    }

    public DocumentReference withRowDetails(@Nullable String title, boolean signed, boolean signatureValid,
                                            @Nullable String judge, @Nullable String court) {
        return new DocumentReference(caseGuid, docGuid, url, filename, sourceTab, instanceId, title, date, docType,
                signed, signatureValid, judge, court, page, position);
    }

    @JsonIgnore
    public DocumentIdentity identity() {
        return new DocumentIdentity(caseGuid, docGuid);
    }

    static String filenameOf(String url) {
        String path = StringUtils.substringBefore(StringUtils.substringBefore(url, "?"), "#");
        String last = StringUtils.substringAfterLast(path, "/");
        try {
            return URLDecoder.decode(last, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return last;
        }
    }

    /**
     * "A60-21280-2023_20251204_Opredelenie.pdf" -> 2025-12-04
     */
    static LocalDate dateFromFilename(String filename) {
        Matcher m = FILENAME_DATE.matcher(filename);
        if (!m.find()) return null;
        try {
            return LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)));
        } catch (DateTimeException e) {
            return null;
        }
    }

    /**
     * "A60-21280-2023_20251204_Opredelenie.pdf" -> "Opredelenie"
     */
    static String typeFromFilename(String filename) {
        String stem = filename.contains(".") ? StringUtils.substringBeforeLast(filename, ".") : filename;
        String[] parts = stem.split("_", -1);
        if (parts.length < 3) return null;
        String type = parts[parts.length - 1];
        if (type.isEmpty()) return null;
        return type.substring(0, 1).toUpperCase(Locale.ROOT) + type.substring(1).toLowerCase(Locale.ROOT);
    }
}
