package org.netpreserve.docketcrawl;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTextExtractorTest {
    private final DocumentTextExtractor extractor = new DocumentTextExtractor();

    @Test
    void extractsTextOfEveryPage() {
        var text = extractor.extract(TestPdfs.withText("Resolution of the court", "Second page"));
        assertEquals(2, text.pageCount());
        assertTrue(text.text().contains("Resolution of the court"), text.text());
        assertTrue(text.text().contains("Second page"), text.text());
    }

    @Test
    void brokenAttachmentYieldsNoText() {
        assertEquals(ExtractedText.EMPTY, extractor.extract("%PDF-1.4 truncated".getBytes(StandardCharsets.US_ASCII)));
        assertEquals(ExtractedText.EMPTY, extractor.extract(new byte[0]));
    }

    @Test
    void shortTextIsFlaggedForReview() {
        var reference = DocumentReference.of("https://kad.test/PdfDocument/c/d/f.pdf", "PdfDocument",
                SourceTab.COURT_ACTS, null, 1, 1);
        var scan = FetchedDocument.from(reference, reference.identity(), Set.of(SourceTab.COURT_ACTS),
                new ExtractedText("  \n ", 3), 1000, Instant.EPOCH, 100);
        assertTrue(scan.requiresManualReview());
        assertEquals(0, scan.charCount());
        assertEquals("c/d", scan.identity());

        var text = FetchedDocument.from(reference, reference.identity(), Set.of(SourceTab.COURT_ACTS),
                new ExtractedText("x".repeat(150), 1), 1000, Instant.EPOCH, 100);
        assertFalse(text.requiresManualReview());
    }
}
