package com.mcainsights.mcainsights.snapshot;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable full capture of the registry on one date, keyed by entity key.
 * Every record carries every schema field; keys iterate in ascending order.
 */
public final class Snapshot {

    private final LocalDate captureDate;
    private final List<String> schema;
    private final SortedMap<String, AttributeRecord> records;

    private Snapshot(LocalDate captureDate, List<String> schema, SortedMap<String, AttributeRecord> records) {
        this.captureDate = captureDate;
        this.schema = schema;
        this.records = Collections.unmodifiableSortedMap(records);
    }

    public static Builder builder(LocalDate captureDate, List<String> schema, ValueNormalizer normalizer) {
        return new Builder(captureDate, schema, normalizer);
    }

    public LocalDate captureDate() {
        return captureDate;
    }

    /**
     * Ordered attribute field names, key column excluded.
     */
    public List<String> schema() {
        return schema;
    }

    public Set<String> keys() {
        return records.keySet();
    }

    public boolean contains(String entityKey) {
        return records.containsKey(entityKey);
    }

    public AttributeRecord record(String entityKey) {
        return records.get(entityKey);
    }

    public Collection<AttributeRecord> records() {
        return records.values();
    }

    public int size() {
        return records.size();
    }

    @Override
    public String toString() {
        return "Snapshot{captureDate=" + captureDate + ", records=" + records.size() + ", schema=" + schema + "}";
    }

    public static final class Builder {

        private final LocalDate captureDate;
        private final List<String> schema;
        private final Set<String> schemaFields;
        private final ValueNormalizer normalizer;
        private final SortedMap<String, AttributeRecord> records = new TreeMap<>();

        private Builder(LocalDate captureDate, List<String> schema, ValueNormalizer normalizer) {
            this.captureDate = Objects.requireNonNull(captureDate, "captureDate");
            this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
            this.schema = List.copyOf(schema);
            this.schemaFields = new HashSet<>(this.schema);
            if (schemaFields.size() != this.schema.size()) {
                throw new IllegalArgumentException("Snapshot schema contains duplicate fields: " + schema);
            }
        }

        /**
         * Adds one entity. Fields absent from {@code rawValues} are stored as explicit nulls.
         */
        public Builder add(String entityKey, Map<String, String> rawValues) {
            String key = entityKey == null ? "" : entityKey.trim();
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Entity key is required in snapshot " + captureDate);
            }
            if (records.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate entity key %s in snapshot %s".formatted(key, captureDate));
            }
            for (String field : rawValues.keySet()) {
                if (!schemaFields.contains(field)) {
                    throw new IllegalArgumentException(
                            "Field %s of entity %s is not part of the snapshot schema".formatted(field, key));
                }
            }

            Map<String, String> values = new LinkedHashMap<>();
            for (String field : schema) {
                values.put(field, normalizer.normalize(field, rawValues.get(field)));
            }
            records.put(key, new AttributeRecord(key, values));
            return this;
        }

        public Snapshot build() {
            return new Snapshot(captureDate, schema, new TreeMap<>(records));
        }
    }
}
