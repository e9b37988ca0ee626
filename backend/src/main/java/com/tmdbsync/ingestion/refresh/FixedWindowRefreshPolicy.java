package com.tmdbsync.ingestion.refresh;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;

/**
 * Due when the record's date field falls within the last {@code windowDays} days.
 */
public class FixedWindowRefreshPolicy implements RefreshPolicy {

    private final String dateField;
    private final int windowDays;

    public FixedWindowRefreshPolicy(String dateField, int windowDays) {
        if (windowDays < 0) {
            throw new IllegalArgumentException("windowDays must not be negative");
        }
        this.dateField = dateField;
        this.windowDays = windowDays;
    }

    @Override
    public boolean isDue(JsonNode storedRecord, LocalDate today) {
        return DateWindow.contains(DateWindow.parseField(storedRecord, dateField), windowDays, today);
    }
}
