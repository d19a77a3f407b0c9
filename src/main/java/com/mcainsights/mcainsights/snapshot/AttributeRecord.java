package com.mcainsights.mcainsights.snapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Attribute values of one entity in one snapshot, in schema order. Missing values are explicit nulls.
 */
public record AttributeRecord(String entityKey, Map<String, String> values) {

    public AttributeRecord {
        Objects.requireNonNull(entityKey, "entityKey");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String get(String field) {
        return values.get(field);
    }

    /**
     * Stable single-line rendering of every field, used where a whole record appears in a change log.
     */
    public String canonicalText() {
        return values.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + (entry.getValue() == null ? "" : entry.getValue()))
                .collect(Collectors.joining("; "));
    }
}
