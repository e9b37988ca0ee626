package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static com.tmdbsync.ingestion.projection.JsonProjection.allText;
import static com.tmdbsync.ingestion.projection.JsonProjection.object;
import static com.tmdbsync.ingestion.projection.JsonProjection.value;

/**
 * Row projectors for the small reference entities rebuilt on every run.
 */
public final class ReferenceRowProjectors {

    private ReferenceRowProjectors() {
    }

    /** {@code /configuration/languages}: array of {iso_639_1, english_name, name}. */
    public static RowProjector languages() {
        return (payload, queryParams) -> stringRows(payload, "iso_639_1", "english_name", "name");
    }

    /** {@code /configuration/countries}: array of {iso_3166_1, english_name, native_name}. */
    public static RowProjector countries() {
        return (payload, queryParams) -> stringRows(payload, "iso_3166_1", "english_name", "native_name");
    }

    /**
     * {@code /genre/movie/list?language=xx}: {@code genres[]} of {id, name}, tagged with the requested language.
     */
    public static RowProjector movieGenres() {
        return ReferenceRowProjectors::genreRows;
    }

    /** {@code /genre/tv/list?language=xx}: same shape as the movie genres. */
    public static RowProjector seriesGenres() {
        return ReferenceRowProjectors::genreRows;
    }

    /**
     * {@code /certification/movie/list} and {@code /certification/tv/list}: {@code certifications} maps a
     * country code to its ratings; one row per (country, certification).
     */
    public static RowProjector certifications() {
        return (payload, queryParams) -> {
            List<ObjectNode> rows = new ArrayList<>();
            JsonNode byCountry = value(payload, "certifications");
            if (!byCountry.isObject()) {
                return rows;
            }
            Iterator<Map.Entry<String, JsonNode>> countries = byCountry.fields();
            while (countries.hasNext()) {
                Map.Entry<String, JsonNode> country = countries.next();
                if (!country.getValue().isArray()) {
                    continue;
                }
                for (JsonNode item : country.getValue()) {
                    if (!item.isObject() || !allText(item, "certification", "meaning")) {
                        continue;
                    }
                    ObjectNode row = object();
                    row.put("country_code", country.getKey());
                    row.put("certification", item.get("certification").textValue());
                    row.put("meaning", item.get("meaning").textValue());
                    rows.add(row);
                }
            }
            return rows;
        };
    }

    private static List<ObjectNode> genreRows(JsonNode payload, Map<String, String> queryParams) {
        List<ObjectNode> rows = new ArrayList<>();
        String language = queryParams.get("language");
        JsonNode genres = value(payload, "genres");
        if (language == null || !genres.isArray()) {
            return rows;
        }
        for (JsonNode g : genres) {
            JsonNode id = g.get("id");
            JsonNode name = g.get("name");
            if (id == null || !id.isIntegralNumber() || name == null || !name.isTextual()) {
                continue;
            }
            ObjectNode row = object();
            row.put("iso_639_1", language);
            row.put("id", id.longValue());
            row.put("name", name.textValue());
            rows.add(row);
        }
        return rows;
    }

    private static List<ObjectNode> stringRows(JsonNode payload, String... fields) {
        List<ObjectNode> rows = new ArrayList<>();
        if (payload == null || !payload.isArray()) {
            return rows;
        }
        for (JsonNode item : payload) {
            if (!item.isObject() || !allText(item, fields)) {
                continue;
            }
            ObjectNode row = object();
            for (String field : fields) {
                row.put(field, item.get(field).textValue());
            }
            rows.add(row);
        }
        return rows;
    }
}
