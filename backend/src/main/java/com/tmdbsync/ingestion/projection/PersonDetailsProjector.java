package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.domain.IdentityKey;

import static com.tmdbsync.ingestion.projection.JsonProjection.arrayOrEmpty;
import static com.tmdbsync.ingestion.projection.JsonProjection.copy;
import static com.tmdbsync.ingestion.projection.JsonProjection.object;

public class PersonDetailsProjector implements RecordProjector {

    @Override
    public ObjectNode project(JsonNode d, IdentityKey key) {
        ObjectNode out = object();
        copy(out, d, "id", "name");
        out.set("also_known_as", arrayOrEmpty(d, "also_known_as"));
        copy(out, d, "biography", "birthday", "deathday", "place_of_birth", "popularity", "gender",
                "known_for_department");
        return out;
    }
}
