package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.domain.IdentityKey;

import static com.tmdbsync.ingestion.projection.JsonProjection.copy;
import static com.tmdbsync.ingestion.projection.JsonProjection.object;

/**
 * {@code /network/{id}}.
 */
public class NetworkDetailsProjector implements RecordProjector {

    @Override
    public ObjectNode project(JsonNode d, IdentityKey key) {
        return copy(object(), d, "headquarters", "id", "name", "origin_country");
    }
}
