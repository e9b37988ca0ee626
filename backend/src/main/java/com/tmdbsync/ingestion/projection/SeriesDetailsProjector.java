package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.domain.IdentityKey;

import java.util.List;

import static com.tmdbsync.ingestion.projection.JsonProjection.arrayOrEmpty;
import static com.tmdbsync.ingestion.projection.JsonProjection.copy;
import static com.tmdbsync.ingestion.projection.JsonProjection.object;
import static com.tmdbsync.ingestion.projection.JsonProjection.selectList;

/**
 * {@code /tv/{id}}: series-level fields only. Seasons are reduced to {@code seasons_index}
 * ({season_number, id}, both required), which feeds the season listing.
 * <p>
 * Excluded: backdrop_path, poster_path, homepage, logo_path, last/next_episode_to_air, images, videos.
 */
public class SeriesDetailsProjector implements RecordProjector {

    private static final List<String> COMPANY_KEYS = List.of("id", "name", "origin_country");

    @Override
    public ObjectNode project(JsonNode d, IdentityKey key) {
        ObjectNode out = object();
        copy(out, d, "id", "name", "original_name", "original_language");
        out.set("languages", arrayOrEmpty(d, "languages"));
        copy(out, d, "overview", "tagline", "type", "status", "in_production", "first_air_date", "last_air_date",
                "number_of_seasons", "number_of_episodes");
        out.set("episode_run_time", arrayOrEmpty(d, "episode_run_time"));
        out.set("origin_country", arrayOrEmpty(d, "origin_country"));
        copy(out, d, "popularity", "vote_average", "vote_count");
        out.set("genres", selectList(d, "genres", List.of("id", "name"), List.of("id")));
        out.set("spoken_languages", selectList(d, "spoken_languages", List.of("english_name", "iso_639_1", "name")));
        out.set("networks", selectList(d, "networks", COMPANY_KEYS, List.of("id")));
        out.set("production_companies", selectList(d, "production_companies", COMPANY_KEYS, List.of("id")));
        out.set("production_countries", selectList(d, "production_countries", List.of("iso_3166_1", "name")));
        out.set("created_by", selectList(d, "created_by", List.of("id", "name", "original_name", "gender", "credit_id")));
        out.set("seasons_index", selectList(d, "seasons", List.of("season_number", "id"), List.of("season_number", "id")));
        return out;
    }
}
