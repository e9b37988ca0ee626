package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Turns one reference payload, requested with {@code queryParams}, into zero or more rows. Rows missing a
 * required field are dropped.
 */
@FunctionalInterface
public interface RowProjector {

    List<ObjectNode> project(JsonNode payload, Map<String, String> queryParams);
}
