package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.domain.IdentityKey;

/**
 * Narrows one raw payload to an entity's persisted schema. Total: never throws, whatever the payload shape.
 */
@FunctionalInterface
public interface RecordProjector {

    ObjectNode project(JsonNode payload, IdentityKey key);
}
