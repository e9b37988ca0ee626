package com.tmdbsync.ingestion.store;

import com.tmdbsync.domain.IdentityKey;

import java.util.Set;

/**
 * Keys currently in a store, the subset the refresh policy flagged as due, and line counts from the scan.
 */
public record ExistingState(Set<IdentityKey> keys, Set<IdentityKey> refreshDue, int validLines, int malformedLines) {

    public static ExistingState empty() {
        return new ExistingState(Set.of(), Set.of(), 0, 0);
    }

    public boolean contains(IdentityKey key) {
        return keys.contains(key);
    }
}
