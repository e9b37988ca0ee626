package com.tmdbsync.ingestion.refresh;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;

/**
 * Stored records are kept as is; only new keys are fetched.
 */
final class NeverRefreshPolicy implements RefreshPolicy {

    static final NeverRefreshPolicy INSTANCE = new NeverRefreshPolicy();

    private NeverRefreshPolicy() {
    }

    @Override
    public boolean isDue(JsonNode storedRecord, LocalDate today) {
        return false;
    }
}
