package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.domain.IdentityKey;

import static com.tmdbsync.ingestion.projection.JsonProjection.copy;
import static com.tmdbsync.ingestion.projection.JsonProjection.object;
import static com.tmdbsync.ingestion.projection.JsonProjection.value;

/**
 * {@code /tv/{series}/season/{n}}: season-level fields; episodes are reduced to {@code episode_count}, which
 * drives episode derivation. {@code series_id} is not in the payload and comes from the key.
 */
public class SeasonDetailsProjector implements RecordProjector {

    @Override
    public ObjectNode project(JsonNode d, IdentityKey key) {
        ObjectNode out = object();
        out.set("season_id", value(d, "id"));
        out.put("series_id", (Long) key.part(0));
        copy(out, d, "season_number", "name", "overview", "air_date", "vote_average");
        JsonNode episodes = value(d, "episodes");
        if (episodes.isArray()) {
            out.put("episode_count", episodes.size());
        } else {
            out.set("episode_count", value(d, "episode_count"));
        }
        copy(out, d, "_id");
        return out;
    }
}
