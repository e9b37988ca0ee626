package com.tmdbsync.ingestion.refresh;

import com.fasterxml.jackson.databind.JsonNode;
import com.tmdbsync.domain.Candidate;

import java.time.LocalDate;

/**
 * Uses the parent's date in place of the child's own: an episode is due when its season aired within the
 * window. The stored child record is not consulted.
 */
public class ParentDateRefreshPolicy implements RefreshPolicy {

    private final int windowDays;

    public ParentDateRefreshPolicy(int windowDays) {
        this.windowDays = windowDays;
    }

    @Override
    public boolean isDue(JsonNode storedRecord, LocalDate today) {
        return false;
    }

    @Override
    public boolean isDueForCandidate(Candidate candidate, LocalDate today) {
        return DateWindow.contains(candidate.parentDate(), windowDays, today);
    }
}
