package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Allow-list helpers shared by the projectors. Absent fields become JSON null; non-object payloads yield
 * all-null records rather than errors.
 */
public final class JsonProjection {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonProjection() {
    }

    public static ObjectNode object() {
        return NODES.objectNode();
    }

    /** Value of {@code field} or JSON null. */
    public static JsonNode value(JsonNode source, String field) {
        if (source == null || !source.isObject()) {
            return NullNode.instance;
        }
        JsonNode v = source.get(field);
        return v == null || v.isMissingNode() ? NullNode.instance : v.deepCopy();
    }

    /** Copies each named field, in order, rendering absent ones as null. */
    public static ObjectNode copy(ObjectNode target, JsonNode source, String... fields) {
        for (String field : fields) {
            target.set(field, value(source, field));
        }
        return target;
    }

    /** Array field copied as is, or an empty array when absent or not an array. */
    public static ArrayNode arrayOrEmpty(JsonNode source, String field) {
        JsonNode v = value(source, field);
        return v.isArray() ? (ArrayNode) v : NODES.arrayNode();
    }

    /**
     * Projects each object item of a list field onto {@code keys}; missing sub-keys become null. Non-object
     * items are skipped.
     */
    public static ArrayNode selectList(JsonNode source, String field, List<String> keys) {
        return selectList(source, field, keys, List.of());
    }

    /**
     * As {@link #selectList(JsonNode, String, List)}, additionally dropping items where any of
     * {@code required} is absent or null.
     */
    public static ArrayNode selectList(JsonNode source, String field, List<String> keys, List<String> required) {
        ArrayNode out = NODES.arrayNode();
        JsonNode list = value(source, field);
        if (!list.isArray()) {
            return out;
        }
        for (JsonNode item : list) {
            if (!item.isObject() || !hasAll(item, required)) {
                continue;
            }
            ObjectNode projected = NODES.objectNode();
            for (String key : keys) {
                projected.set(key, value(item, key));
            }
            out.add(projected);
        }
        return out;
    }

    public static boolean hasAll(JsonNode item, List<String> required) {
        for (String key : required) {
            JsonNode v = item.get(key);
            if (v == null || v.isNull()) {
                return false;
            }
        }
        return true;
    }

    /** True when every named field is a string. */
    public static boolean allText(JsonNode item, String... fields) {
        for (String field : fields) {
            JsonNode v = item.get(field);
            if (v == null || !v.isTextual()) {
                return false;
            }
        }
        return true;
    }
}
