package com.tmdbsync.ingestion.target;

import com.tmdbsync.domain.Candidate;
import com.tmdbsync.domain.IdentityKey;
import com.tmdbsync.ingestion.refresh.RefreshPolicy;
import com.tmdbsync.ingestion.store.ExistingState;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reconciles candidates against the scanned store: {candidates absent from the store} union {stored keys the
 * policy flags as due}. Stale keys include records flagged during the scan even when no longer listed.
 */
public class TargetSetBuilder {

    public TargetSet build(List<Candidate> candidates, ExistingState existing, RefreshPolicy policy, LocalDate today) {
        Set<IdentityKey> added = new LinkedHashSet<>();
        Set<IdentityKey> stale = new LinkedHashSet<>();

        for (Candidate candidate : candidates) {
            IdentityKey key = candidate.key();
            if (!existing.contains(key)) {
                added.add(key);
            } else if (policy.isDueForCandidate(candidate, today)) {
                stale.add(key);
            }
        }
        stale.addAll(existing.refreshDue());

        Set<IdentityKey> all = new LinkedHashSet<>(added);
        all.addAll(stale);
        List<IdentityKey> ordered = Collections.unmodifiableList(new ArrayList<>(all));
        return new TargetSet(ordered, Collections.unmodifiableSet(all), added.size(), stale.size());
    }
}
