package com.tmdbsync.domain;

import java.time.LocalDate;

/**
 * A key offered for ingestion, either listed by an upstream store or derived from a parent record.
 * {@code parentDate} carries the parent's freshness date for parent-derived refresh policies; null otherwise.
 */
public record Candidate(IdentityKey key, LocalDate parentDate) {

    public static Candidate of(IdentityKey key) {
        return new Candidate(key, null);
    }
}
