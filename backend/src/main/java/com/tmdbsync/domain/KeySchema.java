package com.tmdbsync.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Names the record fields that make up an entity's {@link IdentityKey}, in order.
 */
public record KeySchema(List<String> fields) {

    public KeySchema {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("KeySchema needs at least one field");
        }
        fields = List.copyOf(fields);
    }

    public static KeySchema of(String... fields) {
        return new KeySchema(List.of(fields));
    }

    /**
     * Reads the key from a stored or projected record. Empty when any component is missing or is neither an
     * integral number nor a string.
     */
    public Optional<IdentityKey> extract(JsonNode record) {
        if (record == null || !record.isObject()) {
            return Optional.empty();
        }
        List<Object> parts = new ArrayList<>(fields.size());
        for (String field : fields) {
            JsonNode value = record.get(field);
            if (value == null) {
                return Optional.empty();
            }
            if (value.isIntegralNumber() && value.canConvertToLong()) {
                parts.add(value.longValue());
            } else if (value.isTextual() && !value.textValue().isEmpty()) {
                parts.add(value.textValue());
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(new IdentityKey(parts));
    }

    /**
     * Overwrites the key fields of a projected record with the key that was fetched, so the stored key always
     * matches the target. Existing fields keep their position.
     */
    public ObjectNode stamp(ObjectNode record, IdentityKey key) {
        if (key.size() != fields.size()) {
            throw new IllegalArgumentException("Key " + key + " does not match schema " + fields);
        }
        for (int i = 0; i < fields.size(); i++) {
            Object part = key.part(i);
            if (part instanceof Long l) {
                record.put(fields.get(i), l);
            } else {
                record.put(fields.get(i), (String) part);
            }
        }
        return record;
    }
}
