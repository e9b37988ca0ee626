package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.domain.IdentityKey;

import static com.tmdbsync.ingestion.projection.JsonProjection.copy;
import static com.tmdbsync.ingestion.projection.JsonProjection.object;
import static com.tmdbsync.ingestion.projection.JsonProjection.value;

/**
 * {@code /company/{id}}. {@code parent_company} is always an object; its fields are null for independent companies.
 */
public class CompanyDetailsProjector implements RecordProjector {

    @Override
    public ObjectNode project(JsonNode d, IdentityKey key) {
        ObjectNode out = copy(object(), d, "id", "name", "description", "origin_country", "headquarters");
        JsonNode parent = value(d, "parent_company");
        copy(out.putObject("parent_company"), parent, "id", "name");
        return out;
    }
}
