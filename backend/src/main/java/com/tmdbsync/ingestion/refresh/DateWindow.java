package com.tmdbsync.ingestion.refresh;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Inclusive date windows ending today.
 */
public final class DateWindow {

    private DateWindow() {
    }

    /**
     * {@code today - windowDays <= date <= today}, both ends inclusive. Future dates are outside.
     */
    public static boolean contains(LocalDate date, int windowDays, LocalDate today) {
        if (date == null) {
            return false;
        }
        LocalDate cutoff = today.minusDays(windowDays);
        return !date.isBefore(cutoff) && !date.isAfter(today);
    }

    /**
     * Parses a {@code yyyy-MM-dd} field; null when absent, not a string, or malformed.
     */
    public static LocalDate parseField(JsonNode record, String field) {
        if (record == null || field == null) {
            return null;
        }
        JsonNode value = record.get(field);
        if (value == null || !value.isTextual()) {
            return null;
        }
        return parse(value.textValue());
    }

    public static LocalDate parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.strip());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
