package org.netpreserve.docketcrawl.config;

import java.util.List;
import java.util.Locale;

/**
 * Where the archive lives and what its attachments look like.
 *
 * @param entryUrl              page that runs the challenge and then shows the search form
 * @param cardUrlTemplate       case card URL with {guid} standing for the case GUID
 * @param attachmentUrlMarkers  a response whose URL contains any of these may carry an attachment body; covers both
 *                              the attachment endpoint and the URL it redirects to
 * @param identityMarker        path segment followed by the case and document GUIDs in attachment URLs
 * @param attachmentContentType expected Content-Type of attachment responses
 * @param attachmentMagic       prefix every valid attachment body starts with, empty to accept any body
 */
public record ArchiveConfig(
        String entryUrl,
        String cardUrlTemplate,
        List<String> attachmentUrlMarkers,
        String identityMarker,
        String attachmentContentType,
        String attachmentMagic
) {
    public String cardUrl(String caseGuid) {
        return cardUrlTemplate.replace("{guid}", caseGuid);
    }

    public boolean isAttachmentUrl(String url) {
        for (String marker : attachmentUrlMarkers) {
            if (url.contains(marker)) return true;
        }
        return false;
    }

    public boolean isAttachmentContentType(String contentType) {
        return contentType != null
               && contentType.toLowerCase(Locale.ROOT).contains(attachmentContentType.toLowerCase(Locale.ROOT));
    }
}
