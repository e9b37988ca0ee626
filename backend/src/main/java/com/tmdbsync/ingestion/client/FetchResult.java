package com.tmdbsync.ingestion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tmdbsync.domain.TargetState;

/**
 * Terminal outcome of one executed request. {@code payload} is set only for {@link TargetState#SUCCEEDED}.
 */
public record FetchResult(TargetState state, JsonNode payload, String failureCategory) {

    public static FetchResult success(JsonNode payload) {
        return new FetchResult(TargetState.SUCCEEDED, payload, null);
    }

    public static FetchResult terminal(String category) {
        return new FetchResult(TargetState.FAILED_TERMINAL, null, category);
    }

    public static FetchResult exhausted(String category) {
        return new FetchResult(TargetState.FAILED_TRANSIENT_EXHAUSTED, null, category);
    }

    public boolean isSuccess() {
        return state == TargetState.SUCCEEDED;
    }
}
