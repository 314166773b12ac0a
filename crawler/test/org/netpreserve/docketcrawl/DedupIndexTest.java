package org.netpreserve.docketcrawl;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DedupIndexTest {
    private static DocumentReference ref(String docGuid, SourceTab tab, String instanceId) {
        return DocumentReference.of("https://kad.test/Kad/PdfDocument/case-1/" + docGuid + "/f.pdf", "PdfDocument",
                tab, instanceId, 1, 1);
    }

    @Test
    void sameDocumentOnSeveralTabsIsAdmittedOnce() {
        var index = new DedupIndex(List.of());
        assertTrue(index.admit(ref("d1", SourceTab.COURT_ACTS, null)).isNew());
        assertFalse(index.admit(ref("d1", SourceTab.CARDS, "i1")).isNew());
        assertFalse(index.admit(ref("d1", SourceTab.ELECTRONIC_CASE, null)).isNew());
        assertTrue(index.admit(ref("d2", SourceTab.CARDS, "i2")).isNew());

        var d1 = new DocumentIdentity("case-1", "d1");
        assertEquals(Set.of(SourceTab.COURT_ACTS, SourceTab.CARDS, SourceTab.ELECTRONIC_CASE), index.sourceTabs(d1));
        assertEquals(List.of("i1"), index.instanceIds(d1));
        assertEquals(SourceTab.COURT_ACTS, index.firstReference(d1).sourceTab());
        assertEquals(2, index.size());
        assertEquals(List.of(d1, new DocumentIdentity("case-1", "d2")), index.pending());
    }

    @Test
    void completedDocumentsAreNotPending() {
        var index = new DedupIndex(List.of("case-1/d1"));
        assertFalse(index.admit(ref("d1", SourceTab.CARDS, "i1")).isNew());
        assertTrue(index.admit(ref("d2", SourceTab.CARDS, "i1")).isNew());
        assertEquals(List.of(new DocumentIdentity("case-1", "d2")), index.pending());
        assertEquals(2, index.size());
    }

    @Test
    void unknownIdentity() {
        var index = new DedupIndex(List.of());
        var identity = new DocumentIdentity("x", "y");
        assertNull(index.firstReference(identity));
        assertEquals(Set.of(), index.sourceTabs(identity));
    }
}
