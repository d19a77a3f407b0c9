package com.mcainsights.mcainsights.diff;

import com.mcainsights.mcainsights.snapshot.AttributeRecord;
import com.mcainsights.mcainsights.snapshot.Snapshot;
import com.mcainsights.mcainsights.snapshot.ValueNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Compares two snapshots and produces the ordered change set between them.
 *
 * <p>The engine holds no mutable state and performs no I/O, so one instance can serve any number of
 * comparisons concurrently. Output order is fully determined by the inputs: NEW records, then REMOVED
 * records, each ascending by entity key, then FIELD_UPDATE records ascending by entity key and, within
 * one entity, in schema field order. Every record is stamped with the current snapshot's capture date.
 */
public class DiffEngine {

    private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

    private final DiffSettings settings;

    public DiffEngine(DiffSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public DiffSettings settings() {
        return settings;
    }

    /**
     * Computes every change between {@code previous} and {@code current}.
     *
     * @throws SchemaMismatchException when either schema lacks a tracked field, or the tracked fields
     *                                 appear in a different order
     */
    public ChangeSet diff(Snapshot previous, Snapshot current) {
        List<String> fields = comparableFields(previous, current);
        KeyPartition partition = partition(previous, current);
        LocalDate detectionDate = current.captureDate();

        List<ChangeRecord> records = new ArrayList<>();
        for (String key : partition.appeared()) {
            records.add(appeared(current.record(key), detectionDate));
        }
        for (String key : partition.disappeared()) {
            records.add(removed(previous.record(key), detectionDate));
        }
        records.addAll(compareCommon(previous, current, partition.common(), fields, detectionDate));

        ChangeSet changeSet = new ChangeSet(previous.captureDate(), detectionDate, records);
        log.debug("Compared {} -> {}: new={}, removed={}, common={}, updates={}",
                previous.captureDate(), detectionDate, partition.appeared().size(),
                partition.disappeared().size(), partition.common().size(), changeSet.count(ChangeKind.FIELD_UPDATE));
        return changeSet;
    }

    /**
     * Splits the union of both key sets into appeared, disappeared and common keys.
     */
    public KeyPartition partition(Snapshot previous, Snapshot current) {
        SortedSet<String> appeared = new TreeSet<>();
        SortedSet<String> common = new TreeSet<>();
        for (String key : current.keys()) {
            if (previous.contains(key)) {
                common.add(key);
            } else {
                appeared.add(key);
            }
        }
        SortedSet<String> disappeared = new TreeSet<>();
        for (String key : previous.keys()) {
            if (!current.contains(key)) {
                disappeared.add(key);
            }
        }
        return new KeyPartition(appeared, disappeared, common);
    }

    /**
     * Validates both schemas and returns the tracked fields in schema order. Untracked columns may differ
     * between the snapshots; the tracked projections must be identical.
     */
    private List<String> comparableFields(Snapshot previous, Snapshot current) {
        requireTrackedFields(previous, current, previous.schema());
        requireTrackedFields(previous, current, current.schema());

        List<String> previousTracked = trackedProjection(previous.schema());
        List<String> currentTracked = trackedProjection(current.schema());
        if (!previousTracked.equals(currentTracked)) {
            throw new SchemaMismatchException("Snapshots %s and %s order their tracked fields differently: %s vs %s"
                    .formatted(previous.captureDate(), current.captureDate(), previousTracked, currentTracked),
                    previous.schema(), current.schema());
        }
        return currentTracked;
    }

    private void requireTrackedFields(Snapshot previous, Snapshot current, List<String> schema) {
        List<String> missing = new ArrayList<>();
        for (String field : settings.trackedFields()) {
            if (!schema.contains(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaMismatchException("Tracked fields %s are not part of the schema %s (snapshots %s and %s)"
                    .formatted(missing, schema, previous.captureDate(), current.captureDate()),
                    previous.schema(), current.schema());
        }
    }

    private List<String> trackedProjection(List<String> schema) {
        Set<String> tracked = new HashSet<>(settings.trackedFields());
        List<String> ordered = new ArrayList<>(tracked.size());
        for (String field : schema) {
            if (tracked.contains(field)) {
                ordered.add(field);
            }
        }
        return ordered;
    }

    private List<ChangeRecord> compareCommon(Snapshot previous, Snapshot current, SortedSet<String> common,
                                             List<String> fields, LocalDate detectionDate) {
        List<String> keys = new ArrayList<>(common);
        if (keys.size() < settings.parallelThreshold()) {
            return compareShard(previous, current, keys, fields, detectionDate);
        }

        List<List<String>> shards = new ArrayList<>();
        for (int from = 0; from < keys.size(); from += settings.shardSize()) {
            shards.add(keys.subList(from, Math.min(from + settings.shardSize(), keys.size())));
        }
        log.debug("Comparing {} common keys across {} shards", keys.size(), shards.size());

        // Shards cover ascending key ranges and parallel streams keep encounter order, so the merge stays sorted.
        List<List<ChangeRecord>> results = shards.parallelStream()
                .map(shard -> compareShard(previous, current, shard, fields, detectionDate))
                .toList();

        List<ChangeRecord> merged = new ArrayList<>();
        for (List<ChangeRecord> result : results) {
            merged.addAll(result);
        }
        return merged;
    }

    private List<ChangeRecord> compareShard(Snapshot previous, Snapshot current, List<String> keys,
                                            List<String> fields, LocalDate detectionDate) {
        ValueNormalizer normalizer = settings.normalizer();
        List<ChangeRecord> updates = new ArrayList<>();
        for (String key : keys) {
            AttributeRecord before = previous.record(key);
            AttributeRecord after = current.record(key);
            for (String field : fields) {
                String oldValue = normalizer.normalize(field, before.get(field));
                String newValue = normalizer.normalize(field, after.get(field));
                if (Objects.equals(oldValue, newValue)) {
                    continue;
                }
                updates.add(new ChangeRecord(key, ChangeKind.FIELD_UPDATE, field, oldValue, newValue, detectionDate,
                        context(after, settings.nameField()),
                        context(after, settings.stateField()),
                        context(after, settings.statusField())));
            }
        }
        return updates;
    }

    private ChangeRecord appeared(AttributeRecord record, LocalDate detectionDate) {
        return new ChangeRecord(record.entityKey(), ChangeKind.NEW, null, null, record.canonicalText(), detectionDate,
                context(record, settings.nameField()),
                context(record, settings.stateField()),
                context(record, settings.statusField()));
    }

    private ChangeRecord removed(AttributeRecord record, LocalDate detectionDate) {
        return new ChangeRecord(record.entityKey(), ChangeKind.REMOVED, null, record.canonicalText(), null, detectionDate,
                context(record, settings.nameField()),
                context(record, settings.stateField()),
                context(record, settings.statusField()));
    }

    private String context(AttributeRecord record, String field) {
        return field == null ? null : record.get(field);
    }
}
