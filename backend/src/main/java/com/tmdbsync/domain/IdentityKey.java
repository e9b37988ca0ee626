package com.tmdbsync.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Field values identifying one record within its store: a single id, or a composite such as
 * (series_id, season_number, episode_number). Components are {@link Long} or {@link String}.
 */
public record IdentityKey(List<Object> parts) {

    public IdentityKey {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("IdentityKey needs at least one component");
        }
        List<Object> normalized = new ArrayList<>(parts.size());
        for (Object part : parts) {
            normalized.add(normalize(part));
        }
        parts = Collections.unmodifiableList(normalized);
    }

    public static IdentityKey of(Object... parts) {
        return new IdentityKey(List.of(parts));
    }

    public int size() {
        return parts.size();
    }

    public Object part(int index) {
        return parts.get(index);
    }

    /** Path-friendly rendering, e.g. {@code 1399/2/5}. */
    public String toPath() {
        return parts.stream().map(String::valueOf).collect(Collectors.joining("/"));
    }

    @Override
    public String toString() {
        return parts.size() == 1
                ? String.valueOf(parts.get(0))
                : parts.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }

    private static Object normalize(Object part) {
        if (part instanceof Integer || part instanceof Long || part instanceof Short || part instanceof Byte) {
            return ((Number) part).longValue();
        }
        if (part instanceof String) {
            return part;
        }
        throw new IllegalArgumentException("Key component must be an integer or a string: " + part);
    }
}
