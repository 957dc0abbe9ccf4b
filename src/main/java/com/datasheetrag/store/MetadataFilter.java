package com.datasheetrag.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.datasheetrag.ingest.ChunkMetadata;

/**
 * Conjunction of exact-match conditions on metadata fields. Works for the known
 * fields ({@code category}, {@code mpn}, ...) and for extension keys alike.
 */
public final class MetadataFilter {
    private static final MetadataFilter NONE = new MetadataFilter(Map.of());

    private final Map<String, String> conditions;

    private MetadataFilter(Map<String, String> conditions) {
        this.conditions = conditions;
    }

    public static MetadataFilter none() {
        return NONE;
    }

    public static MetadataFilter equalTo(String field, String value) {
        return NONE.and(field, value);
    }

    public MetadataFilter and(String field, String value) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field must not be blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value must not be null for field " + field);
        }
        Map<String, String> next = new LinkedHashMap<>(conditions);
        next.put(field, value);
        return new MetadataFilter(Collections.unmodifiableMap(next));
    }

    public boolean matches(ChunkMetadata metadata) {
        for (Map.Entry<String, String> condition : conditions.entrySet()) {
            String actual = metadata.get(condition.getKey()).orElse(null);
            if (!condition.getValue().equals(actual)) {
                return false;
            }
        }
        return true;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public Map<String, String> conditions() {
        return conditions;
    }

    @Override
    public String toString() {
        return conditions.isEmpty() ? "none" : conditions.toString();
    }
}
