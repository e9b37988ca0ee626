package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.domain.IdentityKey;

import static com.tmdbsync.ingestion.projection.JsonProjection.object;
import static com.tmdbsync.ingestion.projection.JsonProjection.value;

/**
 * {@code /movie/{id}/reviews} and {@code /tv/{id}/reviews}: first page of reviews, review id renamed to
 * {@code review_id}.
 */
public class ReviewsProjector implements RecordProjector {

    @Override
    public ObjectNode project(JsonNode d, IdentityKey key) {
        ObjectNode out = object();
        out.set("id", value(d, "id"));
        ArrayNode reviews = out.putArray("reviews");
        JsonNode results = value(d, "results");
        if (results.isArray()) {
            for (JsonNode entry : results) {
                if (!entry.isObject()) {
                    continue;
                }
                ObjectNode review = reviews.addObject();
                review.set("review_id", value(entry, "id"));
                review.set("author", value(entry, "author"));
                review.set("content", value(entry, "content"));
                review.set("created_at", value(entry, "created_at"));
                review.set("url", value(entry, "url"));
            }
        }
        return out;
    }
}
