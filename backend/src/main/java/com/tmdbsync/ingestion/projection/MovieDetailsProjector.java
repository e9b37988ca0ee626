package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.domain.IdentityKey;

import java.util.List;

import static com.tmdbsync.ingestion.projection.JsonProjection.copy;
import static com.tmdbsync.ingestion.projection.JsonProjection.object;
import static com.tmdbsync.ingestion.projection.JsonProjection.selectList;

/**
 * {@code /movie/{id}}: financials, titles, classification and vote fields. No images or links.
 */
public class MovieDetailsProjector implements RecordProjector {

    @Override
    public ObjectNode project(JsonNode d, IdentityKey key) {
        ObjectNode out = object();
        copy(out, d, "budget");
        out.set("genres", selectList(d, "genres", List.of("id", "name"), List.of("id")));
        copy(out, d, "id", "imdb_id", "original_language", "original_title", "overview", "popularity");
        out.set("production_companies", selectList(d, "production_companies", List.of("id", "name", "origin_country")));
        out.set("production_countries", selectList(d, "production_countries", List.of("iso_3166_1", "name")));
        copy(out, d, "release_date", "revenue", "runtime");
        out.set("spoken_languages", selectList(d, "spoken_languages", List.of("english_name", "iso_639_1", "name")));
        copy(out, d, "status", "tagline", "title", "vote_average", "vote_count");
        return out;
    }
}
