package com.jiralert.adapter.integration.jira;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Lightweight projection of a Jira issue as returned by search and create calls.
 * Fields not returned by a call (e.g. status after creation) are {@code null}.
 */
public record TrackedIssue(
    String id,
    String key,
    String selfUrl,
    String summary,
    String description,
    String status,
    List<String> labels,
    OffsetDateTime created
) {

    /**
     * Most recently created first; issues without a creation date go last and
     * ties are broken by the higher key number.
     */
    public static final Comparator<TrackedIssue> NEWEST_FIRST = Comparator
        .comparing(TrackedIssue::created, Comparator.nullsFirst(Comparator.<OffsetDateTime>naturalOrder()))
        .thenComparingLong(TrackedIssue::keyNumber)
        .reversed();

    public TrackedIssue {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public static TrackedIssue ofCreated(String id, String key, String selfUrl) {
        return new TrackedIssue(id, key, selfUrl, null, null, null, List.of(), null);
    }

    /**
     * Numeric part of the key ({@code 42} for {@code ABC-42}), or -1 when absent.
     */
    public long keyNumber() {
        if (key == null) {
            return -1;
        }
        int dash = key.lastIndexOf('-');
        try {
            return Long.parseLong(key.substring(dash + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
