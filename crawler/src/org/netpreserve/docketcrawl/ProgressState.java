package org.netpreserve.docketcrawl;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Checkpoint of a crawl, the only input to resume decisions.
 *
 * @param completed    identity keys that are done, fetched or permanently skipped
 * @param skipped      permanently skipped identity keys and why (a subset of completed)
 * @param pausedReason why the last run paused, null if it didn't
 * @param lastOutcome  how the last run ended, null while it is running
 */
public record ProgressState(
        String caseIdentifier,
        SortedSet<String> completed,
        SortedMap<String, String> skipped,
        Instant lastUpdated,
        @Nullable String pausedReason,
        @Nullable CrawlOutcome lastOutcome
) {
    public ProgressState {
        var completedCopy = new TreeSet<String>();
        if (completed != null) completedCopy.addAll(completed);
        completed = Collections.unmodifiableSortedSet(completedCopy);
        var skippedCopy = new TreeMap<String, String>();
        if (skipped != null) skippedCopy.putAll(skipped);
        skipped = Collections.unmodifiableSortedMap(skippedCopy);
    }

    public static ProgressState empty(String caseIdentifier, Instant now) {
        return new ProgressState(caseIdentifier, new TreeSet<>(), new TreeMap<>(), now, null, null);
    }

    public boolean isCompleted(String identityKey) {
        return completed.contains(identityKey);
    }

    public ProgressState withDone(String identityKey, Instant now) {
        var completed = new TreeSet<>(this.completed);
        completed.add(identityKey);
        return new ProgressState(caseIdentifier, completed, skipped, now, pausedReason, lastOutcome);
    }

    public ProgressState withSkipped(String identityKey, String reason, Instant now) {
        var completed = new TreeSet<>(this.completed);
        completed.add(identityKey);
        var skipped = new TreeMap<>(this.skipped);
        skipped.putIfAbsent(identityKey, reason);
        return new ProgressState(caseIdentifier, completed, skipped, now, pausedReason, lastOutcome);
    }

    public ProgressState withPaused(String reason, Instant now) {
        return new ProgressState(caseIdentifier, completed, skipped, now, reason, CrawlOutcome.PAUSED);
    }

    /**
     * Marks the start of a run: clears the previous outcome and pause reason, keeps completed work.
     */
    public ProgressState started(Instant now) {
        return new ProgressState(caseIdentifier, completed, skipped, now, null, null);
    }

    public ProgressState withOutcome(CrawlOutcome outcome, Instant now) {
        return new ProgressState(caseIdentifier, completed, skipped, now, pausedReason, outcome);
    }
}
