package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.tmdbsync.domain.IdentityKey;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.tmdbsync.ingestion.projection.JsonProjection.object;
import static com.tmdbsync.ingestion.projection.JsonProjection.value;

/**
 * {@code /movie/{id}/watch/providers} and {@code /tv/{id}/watch/providers}: one row per country and provider,
 * whatever the offer type. A provider listed under several offer types in one country yields a single row.
 */
public class WatchProvidersProjector implements KeyedRowProjector {

    private static final List<String> OFFER_TYPES = List.of("flatrate", "buy", "rent", "ads", "free");

    private final String ownerField;

    /**
     * @param ownerField name of the column holding the movie or series id, e.g. {@code id_movie}
     */
    public WatchProvidersProjector(String ownerField) {
        this.ownerField = ownerField;
    }

    @Override
    public List<ObjectNode> project(JsonNode payload, IdentityKey key) {
        List<ObjectNode> rows = new ArrayList<>();
        JsonNode results = value(payload, "results");
        if (!results.isObject()) {
            return rows;
        }
        Iterator<Map.Entry<String, JsonNode>> countries = results.fields();
        while (countries.hasNext()) {
            Map.Entry<String, JsonNode> country = countries.next();
            if (!country.getValue().isObject()) {
                continue;
            }
            Set<Long> seen = new HashSet<>();
            for (String offerType : OFFER_TYPES) {
                JsonNode offers = country.getValue().get(offerType);
                if (offers == null || !offers.isArray()) {
                    continue;
                }
                for (JsonNode offer : offers) {
                    JsonNode providerId = offer.get("provider_id");
                    JsonNode providerName = offer.get("provider_name");
                    if (providerId == null || !providerId.isIntegralNumber()
                            || providerName == null || !providerName.isTextual()
                            || !seen.add(providerId.longValue())) {
                        continue;
                    }
                    ObjectNode row = object();
                    row.set(ownerField, keyValue(key));
                    row.put("provider_id", providerId.longValue());
                    row.put("provider_name", providerName.textValue());
                    row.put("country_code", country.getKey());
                    rows.add(row);
                }
            }
        }
        return rows;
    }

    private static JsonNode keyValue(IdentityKey key) {
        Object owner = key.part(0);
        return owner instanceof Long id ? LongNode.valueOf(id) : TextNode.valueOf(String.valueOf(owner));
    }
}
