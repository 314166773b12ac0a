package org.netpreserve.docketcrawl;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Deduplication key of a document. Normally the case and document GUIDs taken from the attachment URL
 * {@code .../<marker>/<caseGuid>/<docGuid>/<filename>}. URLs without that shape get a SHA-256 digest of the whole
 * URL as docGuid and no caseGuid.
 */
public record DocumentIdentity(@Nullable String caseGuid, String docGuid) {
    private static final Pattern GUID_SEGMENT = Pattern.compile("[0-9A-Za-z-]+");
    private static final Pattern DIGEST = Pattern.compile("[0-9a-f]{64}");

    public static DocumentIdentity fromUrl(String url, String marker) {
        String[] segments = pathOf(url).split("/");
        for (int i = 0; i + 2 < segments.length; i++) {
            if (segments[i].equals(marker)) {
                String caseGuid = segments[i + 1];
                String docGuid = segments[i + 2];
                if (GUID_SEGMENT.matcher(caseGuid).matches() && GUID_SEGMENT.matcher(docGuid).matches()) {
                    return new DocumentIdentity(caseGuid, docGuid);
                }
                break;
            }
        }
        return new DocumentIdentity(null, digestOf(url));
    }

    /**
     * Inverse of {@link #key()}.
     */
    public static DocumentIdentity fromKey(String key) {
        int slash = key.indexOf('/');
        if (slash < 0) return new DocumentIdentity(null, key);
        return new DocumentIdentity(key.substring(0, slash), key.substring(slash + 1));
    }

    static String digestOf(String url) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(url.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String pathOf(String url) {
        try {
            String path = new URI(url).getPath();
            return path != null ? path : url;
        } catch (URISyntaxException e) {
            return url;
        }
    }

    @JsonIgnore
    public boolean isDigest() {
        return caseGuid == null && DIGEST.matcher(docGuid).matches();
    }

    /**
     * Stable string form used in the progress file.
     */
    @JsonIgnore
    public String key() {
        return caseGuid == null ? docGuid : caseGuid + "/" + docGuid;
    }

    /**
     * File name stem for the document's output files.
     */
    @JsonIgnore
    public String fileStem() {
        return docGuid;
    }

    @Override
    public String toString() {
        return key();
    }
}
