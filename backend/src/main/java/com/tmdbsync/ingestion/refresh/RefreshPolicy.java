package com.tmdbsync.ingestion.refresh;

import com.fasterxml.jackson.databind.JsonNode;
import com.tmdbsync.domain.Candidate;

import java.time.LocalDate;

/**
 * Decides whether an already stored record must be fetched again this run.
 * <p>
 * Record-based policies answer from the stored record while the store is scanned. Parent-derived policies have
 * no usable date on the child and answer from the candidate's parent date while targets are built.
 */
public interface RefreshPolicy {

    boolean isDue(JsonNode storedRecord, LocalDate today);

    default boolean isDueForCandidate(Candidate candidate, LocalDate today) {
        return false;
    }

    static RefreshPolicy never() {
        return NeverRefreshPolicy.INSTANCE;
    }
}
