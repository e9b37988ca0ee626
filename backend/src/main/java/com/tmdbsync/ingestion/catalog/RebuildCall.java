package com.tmdbsync.ingestion.catalog;

import java.util.Map;

/**
 * One request of a full rebuild. {@code label} identifies the call in logs (e.g. the language code).
 */
public record RebuildCall(String label, String path, Map<String, String> queryParams) {

    public RebuildCall {
        queryParams = queryParams == null ? Map.of() : Map.copyOf(queryParams);
    }

    public static RebuildCall of(String path) {
        return new RebuildCall(path, path, Map.of());
    }
}
