package com.tmdbsync.ingestion.target;

import com.tmdbsync.domain.IdentityKey;

import java.util.List;
import java.util.Set;

/**
 * Deduplicated work list for one run: new keys first (listing order), then stale keys.
 * {@code keySet} backs the retained-copy filter of the merge writer.
 */
public record TargetSet(List<IdentityKey> keys, Set<IdentityKey> keySet, int newCount, int staleCount) {

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }
}
