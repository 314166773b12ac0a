package org.netpreserve.docketcrawl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collapses references to the same document seen on several tabs. Built fresh for each run from the completed
 * identities of the progress state; never persisted.
 */
public class DedupIndex {
    private final Set<String> completed;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public DedupIndex(Collection<String> completedKeys) {
        this.completed = Set.copyOf(completedKeys);
    }

    /**
     * Records a reference. Its tab (and instance) is remembered even when the document was seen before.
     *
     * @return whether this is the first sighting of a document that hasn't been completed in an earlier run
     */
    public synchronized Admission admit(DocumentReference reference) {
        var identity = reference.identity();
        String key = identity.key();
        var entry = entries.get(key);
        boolean isNew = false;
        if (entry == null) {
            entry = new Entry(reference);
            entries.put(key, entry);
            isNew = !completed.contains(key);
        }
        entry.sourceTabs.add(reference.sourceTab());
        if (reference.instanceId() != null) entry.instanceIds.add(reference.instanceId());
        return new Admission(identity, isNew);
    }

    public synchronized Set<SourceTab> sourceTabs(DocumentIdentity identity) {
        var entry = entries.get(identity.key());
        return entry == null ? Set.of() : Set.copyOf(entry.sourceTabs);
    }

    public synchronized List<String> instanceIds(DocumentIdentity identity) {
        var entry = entries.get(identity.key());
        return entry == null ? List.of() : List.copyOf(entry.instanceIds);
    }

    public synchronized DocumentReference firstReference(DocumentIdentity identity) {
        var entry = entries.get(identity.key());
        return entry == null ? null : entry.first;
    }

    /**
     * Identities seen this run that aren't completed, in order of first sighting.
     */
    public synchronized List<DocumentIdentity> pending() {
        var pending = new ArrayList<DocumentIdentity>();
        for (var entry : entries.values()) {
            if (!completed.contains(entry.first.identity().key())) pending.add(entry.first.identity());
        }
        return pending;
    }

    /**
     * Number of distinct documents seen this run.
     */
    public synchronized int size() {
        return entries.size();
    }

    public record Admission(DocumentIdentity identity, boolean isNew) {
    }

    private static class Entry {
        final DocumentReference first;
        final Set<SourceTab> sourceTabs = EnumSet.noneOf(SourceTab.class);
        final Set<String> instanceIds = new LinkedHashSet<>();

        Entry(DocumentReference first) {
            this.first = first;
        }
    }
}
