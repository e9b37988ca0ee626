package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

import static com.tmdbsync.ingestion.projection.JsonProjection.copy;
import static com.tmdbsync.ingestion.projection.JsonProjection.object;
import static com.tmdbsync.ingestion.projection.JsonProjection.selectList;
import static com.tmdbsync.ingestion.projection.JsonProjection.value;

/**
 * Projectors for the per-title sub-resources of movies and series ({@code /movie/{id}/credits},
 * {@code /tv/{id}/content_ratings} and so on). Each keeps the owner id plus one narrowed list or field.
 */
public final class SubresourceProjectors {

    private SubresourceProjectors() {
    }

    /** {@code /movie/{id}/credits}. */
    public static RecordProjector movieCredits() {
        return (d, key) -> {
            ObjectNode out = object();
            copy(out, d, "id");
            out.set("cast", selectList(d, "cast", List.of("credit_id", "id", "character", "order")));
            out.set("crew", selectList(d, "crew", List.of("credit_id", "id", "department", "job")));
            return out;
        };
    }

    /** {@code /movie/{id}/keywords}. */
    public static RecordProjector movieKeywords() {
        return idWithList("keywords", "keywords", List.of("id", "name"));
    }

    /** {@code /movie/{id}/alternative_titles}: the list is called {@code titles} upstream. */
    public static RecordProjector movieAlternativeTitles() {
        return idWithList("titles", "titles", List.of("iso_3166_1", "title"));
    }

    /** {@code /tv/{id}/alternative_titles}: upstream {@code results}, stored as {@code alternative_titles}. */
    public static RecordProjector seriesAlternativeTitles() {
        return idWithList("results", "alternative_titles", List.of("iso_3166_1", "title"));
    }

    /** {@code /tv/{id}/content_ratings}. */
    public static RecordProjector seriesContentRatings() {
        return idWithList("results", "content_ratings", List.of("iso_3166_1", "rating"));
    }

    /** {@code /movie/{id}/external_ids} and {@code /tv/{id}/external_ids}: only the IMDb id is kept. */
    public static RecordProjector externalIds() {
        return (d, key) -> copy(object(), d, "id", "imdb_id");
    }

    /**
     * {@code /movie/{id}/release_dates}: per-country groups flattened to one entry per release.
     */
    public static RecordProjector movieReleaseDates() {
        return (d, key) -> {
            ObjectNode out = object();
            copy(out, d, "id");
            ArrayNode flattened = out.putArray("release_dates");
            JsonNode results = value(d, "results");
            if (!results.isArray()) {
                return out;
            }
            for (JsonNode country : results) {
                if (!country.isObject()) {
                    continue;
                }
                JsonNode releases = value(country, "release_dates");
                if (!releases.isArray()) {
                    continue;
                }
                for (JsonNode release : releases) {
                    if (!release.isObject()) {
                        continue;
                    }
                    ObjectNode entry = flattened.addObject();
                    entry.set("iso_3166_1", value(country, "iso_3166_1"));
                    copy(entry, release, "release_date", "type", "certification");
                }
            }
            return out;
        };
    }

    /** {@code /movie/{id}/translations}: title, overview and tagline lifted out of each entry's {@code data}. */
    public static RecordProjector movieTranslations() {
        return translations("title");
    }

    /** {@code /tv/{id}/translations}: as for movies, with {@code name} instead of {@code title}. */
    public static RecordProjector seriesTranslations() {
        return translations("name");
    }

    private static RecordProjector translations(String titleField) {
        return (d, key) -> {
            ObjectNode out = object();
            copy(out, d, "id");
            ArrayNode translations = out.putArray("translations");
            JsonNode entries = value(d, "translations");
            if (!entries.isArray()) {
                return out;
            }
            for (JsonNode entry : entries) {
                if (!entry.isObject()) {
                    continue;
                }
                JsonNode data = entry.has("data") ? value(entry, "data") : entry;
                ObjectNode t = translations.addObject();
                copy(t, entry, "iso_639_1", "iso_3166_1");
                copy(t, data, titleField, "overview", "tagline");
            }
            return out;
        };
    }

    private static RecordProjector idWithList(String sourceField, String targetField, List<String> keys) {
        return (d, key) -> {
            ObjectNode out = object();
            copy(out, d, "id");
            out.set(targetField, selectList(d, sourceField, keys));
            return out;
        };
    }
}
