package com.tmdbsync.ingestion.refresh;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.util.Map;

/**
 * Window chosen by the record's status value. {@link StatusRule#always()} forces a refresh regardless of the
 * date; unmapped statuses use {@code defaultWindowDays}. A missing or malformed date is never due unless the
 * rule is "always".
 */
public class StatusWindowRefreshPolicy implements RefreshPolicy {

    private final String statusField;
    private final String dateField;
    private final Map<String, StatusRule> rules;
    private final int defaultWindowDays;

    public StatusWindowRefreshPolicy(String statusField, String dateField, Map<String, StatusRule> rules,
                                     int defaultWindowDays) {
        this.statusField = statusField;
        this.dateField = dateField;
        this.rules = Map.copyOf(rules);
        this.defaultWindowDays = defaultWindowDays;
    }

    @Override
    public boolean isDue(JsonNode storedRecord, LocalDate today) {
        JsonNode statusNode = storedRecord.get(statusField);
        String status = statusNode != null && statusNode.isTextual() ? statusNode.textValue() : "";
        StatusRule rule = rules.getOrDefault(status, StatusRule.window(defaultWindowDays));
        if (rule.alwaysDue()) {
            return true;
        }
        return DateWindow.contains(DateWindow.parseField(storedRecord, dateField), rule.windowDays(), today);
    }

    /**
     * Either "always refresh" or a window in days.
     */
    public record StatusRule(boolean alwaysDue, int windowDays) {

        public static StatusRule always() {
            return new StatusRule(true, 0);
        }

        public static StatusRule window(int days) {
            return new StatusRule(false, days);
        }
    }
}
