package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.domain.IdentityKey;

import java.util.List;

/**
 * Turns the payload fetched for one key into the store lines for that key. Most entities write exactly one line per
 * key; watch providers write one per (country, provider). An empty list means the key currently has no rows.
 */
@FunctionalInterface
public interface KeyedRowProjector {

    List<ObjectNode> project(JsonNode payload, IdentityKey key);

    static KeyedRowProjector single(RecordProjector projector) {
        return (payload, key) -> List.of(projector.project(payload, key));
    }
}
