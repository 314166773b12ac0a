package org.netpreserve.docketcrawl;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.time.Instant;
import java.util.Set;

/**
 * A document whose attachment has been captured and its text extracted.
 *
 * @param reference            the first reference seen for the document
 * @param identity             deduplication key
 * @param sourceTabs           every tab the document was seen on
 * @param requiresManualReview the text is too short to be a text layer, probably a scan that needs OCR
 */
public record FetchedDocument(
        @JsonUnwrapped DocumentReference reference,
        String identity,
        Set<SourceTab> sourceTabs,
        String text,
        int charCount,
        int pageCount,
        boolean requiresManualReview,
        long sizeBytes,
        Instant fetchedAt
) {
    public static FetchedDocument from(DocumentReference reference, DocumentIdentity identity,
                                       Set<SourceTab> sourceTabs, ExtractedText text, long sizeBytes,
                                       Instant fetchedAt, int minTextLengthForOcr) {
        String content = text.text().strip();
        return new FetchedDocument(reference, identity.key(), Set.copyOf(sourceTabs), content, content.length(),
                text.pageCount(), content.length() < minTextLengthForOcr, sizeBytes, fetchedAt);
    }
}
