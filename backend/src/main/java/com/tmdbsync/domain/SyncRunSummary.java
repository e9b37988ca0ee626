package com.tmdbsync.domain;

import java.util.Map;

/**
 * Outcome of one entity run. {@code added} and {@code updated} count keys; {@code retained} and {@code total} count
 * store lines, so {@code total = retained + added + updated} whenever each key has exactly one line.
 */
public record SyncRunSummary(
        String entity,
        int added,
        int updated,
        int retained,
        int total,
        Map<String, Integer> errors,
        int malformedLocalRecords
) {

    public int errorTotal() {
        return errors.values().stream().mapToInt(Integer::intValue).sum();
    }
}
