package com.tmdbsync.ingestion.job;

import com.tmdbsync.domain.TargetState;

import java.util.EnumMap;
import java.util.Map;

/**
 * Final state tally of one dispatch. Every submitted item ends in exactly one terminal state; items never admitted
 * stay {@link TargetState#PENDING}.
 */
public record DispatchReport(int submitted, Map<TargetState, Integer> byState) {

    public DispatchReport {
        byState = byState.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(byState));
    }

    public int count(TargetState state) {
        return byState.getOrDefault(state, 0);
    }

    public int completed() {
        return byState.entrySet().stream()
                .filter(e -> e.getKey().isTerminal())
                .mapToInt(Map.Entry::getValue)
                .sum();
    }
}
