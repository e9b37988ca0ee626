package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.domain.IdentityKey;

import java.util.List;

import static com.tmdbsync.ingestion.projection.JsonProjection.copy;
import static com.tmdbsync.ingestion.projection.JsonProjection.object;
import static com.tmdbsync.ingestion.projection.JsonProjection.selectList;
import static com.tmdbsync.ingestion.projection.JsonProjection.value;

/**
 * {@code /tv/{series}/season/{n}/episode/{e}}: episode-level fields plus crew and guest stars.
 */
public class EpisodeDetailsProjector implements RecordProjector {

    private static final List<String> CREW_KEYS =
            List.of("job", "department", "credit_id", "id", "name", "original_name", "gender");
    private static final List<String> GUEST_KEYS =
            List.of("character", "credit_id", "order", "id", "name", "original_name", "gender");

    @Override
    public ObjectNode project(JsonNode d, IdentityKey key) {
        ObjectNode out = object();
        out.set("episode_id", value(d, "id"));
        out.put("series_id", (Long) key.part(0));
        copy(out, d, "season_number", "episode_number", "episode_type", "name", "overview", "air_date", "runtime",
                "production_code", "vote_average", "vote_count");
        out.set("crew", selectList(d, "crew", CREW_KEYS));
        out.set("guest_stars", selectList(d, "guest_stars", GUEST_KEYS));
        return out;
    }
}
