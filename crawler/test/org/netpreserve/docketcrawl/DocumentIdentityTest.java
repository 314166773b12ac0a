package org.netpreserve.docketcrawl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DocumentIdentityTest {
    @Test
    void takesGuidsAfterMarker() {
        var identity = DocumentIdentity.fromUrl("https://kad.arbitr.ru/Kad/PdfDocument/abc-123/def-456/file.pdf",
                "PdfDocument");
        assertEquals(new DocumentIdentity("abc-123", "def-456"), identity);
        assertEquals("abc-123/def-456", identity.key());
        assertEquals("def-456", identity.fileStem());
        assertFalse(identity.isDigest());
    }

    @Test
    void sameDocumentOnDifferentTabsHasSameIdentity() {
        var a = DocumentIdentity.fromUrl("https://kad.arbitr.ru/Kad/PdfDocument/abc-123/def-456/A60_20230105_Opredelenie.pdf",
                "PdfDocument");
        var b = DocumentIdentity.fromUrl("https://kad.arbitr.ru/PdfDocument/abc-123/def-456/other-name.pdf?x=1",
                "PdfDocument");
        assertEquals(a, b);
    }

    @Test
    void fallsBackToDigestOfUrl() {
        String url = "https://kad.arbitr.ru/Document/Something?id=42";
        var identity = DocumentIdentity.fromUrl(url, "PdfDocument");
        assertNull(identity.caseGuid());
        assertEquals(64, identity.docGuid().length());
        assertTrue(identity.isDigest());
        assertEquals(identity, DocumentIdentity.fromUrl(url, "PdfDocument"));
        assertNotEquals(identity, DocumentIdentity.fromUrl(url + "3", "PdfDocument"));
    }

    @Test
    void malformedGuidSegmentsFallBackToDigest() {
        var identity = DocumentIdentity.fromUrl("https://kad.arbitr.ru/PdfDocument/abc%20123/def/file.pdf",
                "PdfDocument");
        assertTrue(identity.isDigest());
    }

    @Test
    void keyRoundTrips() {
        var identity = new DocumentIdentity("abc-123", "def-456");
        assertEquals(identity, DocumentIdentity.fromKey(identity.key()));
        var digest = DocumentIdentity.fromUrl("https://example.com/x", "PdfDocument");
        assertEquals(digest, DocumentIdentity.fromKey(digest.key()));
    }
}
