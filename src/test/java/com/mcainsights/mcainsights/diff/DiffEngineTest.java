package com.mcainsights.mcainsights.diff;

import com.mcainsights.mcainsights.snapshot.Snapshot;
import com.mcainsights.mcainsights.snapshot.ValueNormalizer;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiffEngineTest {

    private static final LocalDate DAY_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate DAY_2 = LocalDate.of(2024, 1, 2);
    private static final List<String> SCHEMA = List.of("COMPANY_NAME", "COMPANY_STATUS", "PAIDUP_CAPITAL", "STATE");

    private final ValueNormalizer normalizer = new ValueNormalizer(
            List.of("nan", "none"), List.of("COMPANY_NAME", "COMPANY_STATUS"), List.of("PAIDUP_CAPITAL"));

    private final DiffEngine engine = new DiffEngine(settings(20000, 5000));

    @Test
    void shouldReportNewEntityAndCapitalIncrease() {
        Snapshot previous = snapshot(DAY_1, Map.of(
                "K1", entity("ACME", "ACTIVE", "100000", "Maharashtra")));
        Snapshot current = snapshot(DAY_2, Map.of(
                "K1", entity("ACME", "ACTIVE", "150000", "Maharashtra"),
                "K2", entity("BETA", "ACTIVE", "50000", "Gujarat")));

        ChangeSet changes = engine.diff(previous, current);

        assertEquals(2, changes.size());
        assertEquals(DAY_1, changes.previousDate());
        assertEquals(DAY_2, changes.detectionDate());
        assertTrue(changes.records().contains(new ChangeRecord("K1", ChangeKind.FIELD_UPDATE, "PAIDUP_CAPITAL",
                "100000", "150000", DAY_2, "ACME", "Maharashtra", "ACTIVE")));
        ChangeRecord appeared = changes.records().stream()
                .filter(record -> record.kind() == ChangeKind.NEW)
                .findFirst()
                .orElseThrow();
        assertEquals("K2", appeared.entityKey());
        assertNull(appeared.fieldName());
        assertNull(appeared.oldValue());
        assertEquals("COMPANY_NAME=BETA; COMPANY_STATUS=ACTIVE; PAIDUP_CAPITAL=50000; STATE=Gujarat",
                appeared.newValue());
        assertEquals("Gujarat", appeared.state());
    }

    @Test
    void shouldReportRemovedEntityWithPreviousContext() {
        Snapshot previous = snapshot(DAY_1, Map.of(
                "K1", entity("ACME", "ACTIVE", "100000", "Maharashtra"),
                "K3", entity("GAMMA", "ACTIVE", "10000", "Delhi")));
        Snapshot current = snapshot(DAY_2, Map.of(
                "K1", entity("ACME", "ACTIVE", "100000", "Maharashtra")));

        ChangeSet changes = engine.diff(previous, current);

        assertEquals(List.of(new ChangeRecord("K3", ChangeKind.REMOVED, null,
                "COMPANY_NAME=GAMMA; COMPANY_STATUS=ACTIVE; PAIDUP_CAPITAL=10000; STATE=Delhi", null,
                DAY_2, "GAMMA", "Delhi", "ACTIVE")), changes.records());
    }

    @Test
    void shouldFailOnSchemaMismatchWithoutOutput() {
        Snapshot previous = Snapshot.builder(DAY_1, List.of("COMPANY_NAME", "COMPANY_STATUS"), normalizer)
                .add("K1", Map.of("COMPANY_NAME", "ACME"))
                .build();
        Snapshot current = snapshot(DAY_2, Map.of("K1", entity("ACME", "ACTIVE", "100", "Delhi")));

        SchemaMismatchException ex = assertThrows(SchemaMismatchException.class, () -> engine.diff(previous, current));
        assertEquals(previous.schema(), ex.getPreviousSchema());
        assertEquals(current.schema(), ex.getCurrentSchema());
    }

    @Test
    void shouldFailWhenTrackedFieldIsMissingFromSchema() {
        List<String> schema = List.of("COMPANY_NAME", "STATE");
        Snapshot previous = Snapshot.builder(DAY_1, schema, normalizer).add("K1", Map.of()).build();
        Snapshot current = Snapshot.builder(DAY_2, schema, normalizer).add("K1", Map.of()).build();

        assertThrows(SchemaMismatchException.class, () -> engine.diff(previous, current));
    }

    @Test
    void shouldCompareWhenOnlyUntrackedColumnsDiffer() {
        Snapshot previous = snapshot(DAY_1, Map.of("K1", entity("ACME", "ACTIVE", "100", "Delhi")));
        Snapshot current = Snapshot.builder(DAY_2,
                        List.of("STATE", "COMPANY_NAME", "ROC_CODE", "COMPANY_STATUS", "PAIDUP_CAPITAL"), normalizer)
                .add("K1", Map.of("STATE", "Delhi", "COMPANY_NAME", "ACME", "ROC_CODE", "RoC-Delhi",
                        "COMPANY_STATUS", "STRIKE OFF", "PAIDUP_CAPITAL", "100"))
                .build();

        List<ChangeRecord> records = engine.diff(previous, current).records();

        assertEquals(List.of(new ChangeRecord("K1", ChangeKind.FIELD_UPDATE, "COMPANY_STATUS", "ACTIVE", "STRIKE OFF",
                DAY_2, "ACME", "Delhi", "STRIKE OFF")), records);
    }

    @Test
    void shouldFailWhenTrackedFieldsAreReordered() {
        Snapshot previous = snapshot(DAY_1, Map.of("K1", entity("ACME", "ACTIVE", "100", "Delhi")));
        Snapshot current = Snapshot.builder(DAY_2,
                        List.of("COMPANY_STATUS", "COMPANY_NAME", "PAIDUP_CAPITAL", "STATE"), normalizer)
                .add("K1", Map.of("COMPANY_NAME", "ACME"))
                .build();

        assertThrows(SchemaMismatchException.class, () -> engine.diff(previous, current));
    }

    @Test
    void shouldProduceIdenticalOutputForIdenticalInputs() {
        Snapshot previous = randomishSnapshot(DAY_1, 0);
        Snapshot current = randomishSnapshot(DAY_2, 1);

        assertEquals(engine.diff(previous, current), engine.diff(previous, current));
        assertEquals(engine.diff(previous, current), new DiffEngine(settings(20000, 5000)).diff(previous, current));
    }

    @Test
    void shouldBeSymmetricWhenInputsAreSwapped() {
        Snapshot a = randomishSnapshot(DAY_1, 0);
        Snapshot b = randomishSnapshot(DAY_2, 1);

        ChangeSet forward = engine.diff(a, b);
        ChangeSet backward = engine.diff(b, a);

        Set<String> forwardNew = keysOf(forward, ChangeKind.NEW);
        Set<String> forwardRemoved = keysOf(forward, ChangeKind.REMOVED);
        assertEquals(forwardNew, keysOf(backward, ChangeKind.REMOVED));
        assertEquals(forwardRemoved, keysOf(backward, ChangeKind.NEW));

        Set<List<String>> forwardUpdates = new HashSet<>();
        for (ChangeRecord record : forward.records()) {
            if (record.kind() == ChangeKind.FIELD_UPDATE) {
                forwardUpdates.add(List.of(record.entityKey(), record.fieldName(),
                        String.valueOf(record.oldValue()), String.valueOf(record.newValue())));
            }
        }
        Set<List<String>> swappedBackward = new HashSet<>();
        for (ChangeRecord record : backward.records()) {
            if (record.kind() == ChangeKind.FIELD_UPDATE) {
                swappedBackward.add(List.of(record.entityKey(), record.fieldName(),
                        String.valueOf(record.newValue()), String.valueOf(record.oldValue())));
            }
        }
        assertEquals(forwardUpdates, swappedBackward);
        assertFalse(forwardUpdates.isEmpty());
    }

    @Test
    void shouldEmitOneRecordPerDifferingField() {
        Snapshot previous = snapshot(DAY_1, Map.of("K1", entity("ACME", "ACTIVE", "100", "Delhi")));
        Snapshot current = snapshot(DAY_2, Map.of("K1", entity("ACME", "STRIKE OFF", "200", "Delhi")));

        List<ChangeRecord> records = engine.diff(previous, current).records();

        assertEquals(2, records.size());
        assertEquals("COMPANY_STATUS", records.get(0).fieldName());
        assertEquals("PAIDUP_CAPITAL", records.get(1).fieldName());
        assertEquals("STRIKE OFF", records.get(0).status());
    }

    @Test
    void shouldFollowSchemaOrderNotTrackedFieldOrder() {
        DiffEngine reversed = new DiffEngine(new DiffSettings(List.of("PAIDUP_CAPITAL", "COMPANY_NAME"),
                "COMPANY_NAME", "STATE", "COMPANY_STATUS", normalizer, 20000, 5000));
        Snapshot previous = snapshot(DAY_1, Map.of("K1", entity("ACME", "ACTIVE", "100", "Delhi")));
        Snapshot current = snapshot(DAY_2, Map.of("K1", entity("ACME NEW", "ACTIVE", "200", "Delhi")));

        List<ChangeRecord> records = reversed.diff(previous, current).records();

        assertEquals(List.of("COMPANY_NAME", "PAIDUP_CAPITAL"),
                records.stream().map(ChangeRecord::fieldName).toList());
    }

    @Test
    void shouldOrderNewThenRemovedThenUpdatesByKey() {
        Snapshot previous = snapshot(DAY_1, Map.of(
                "K2", entity("B", "ACTIVE", "1", "Delhi"),
                "K4", entity("D", "ACTIVE", "1", "Delhi"),
                "K5", entity("E", "ACTIVE", "1", "Delhi"),
                "K9", entity("I", "ACTIVE", "1", "Delhi")));
        Snapshot current = snapshot(DAY_2, Map.of(
                "K1", entity("A", "ACTIVE", "1", "Delhi"),
                "K3", entity("C", "ACTIVE", "1", "Delhi"),
                "K5", entity("E", "ACTIVE", "2", "Delhi"),
                "K9", entity("I", "ACTIVE", "2", "Delhi")));

        List<ChangeRecord> records = engine.diff(previous, current).records();

        assertEquals(List.of("K1", "K3", "K2", "K4", "K5", "K9"),
                records.stream().map(ChangeRecord::entityKey).toList());
        assertEquals(List.of(ChangeKind.NEW, ChangeKind.NEW, ChangeKind.REMOVED, ChangeKind.REMOVED,
                ChangeKind.FIELD_UPDATE, ChangeKind.FIELD_UPDATE),
                records.stream().map(ChangeRecord::kind).toList());
        assertTrue(records.stream().allMatch(record -> DAY_2.equals(record.detectionDate())));
    }

    @Test
    void shouldReturnEmptyChangeSetForIdenticalSnapshots() {
        Snapshot previous = randomishSnapshot(DAY_1, 0);
        Snapshot sameContent = randomishSnapshot(DAY_2, 0);

        ChangeSet changes = engine.diff(previous, sameContent);

        assertTrue(changes.isEmpty());
        assertTrue(engine.diff(previous, previous).isEmpty());
    }

    @Test
    void shouldIgnoreFormattingNoise() {
        Snapshot previous = snapshot(DAY_1, Map.of("K1", entity("Acme  Ltd", "Active", "1,00,000", "Delhi")));
        Snapshot current = snapshot(DAY_2, Map.of("K1", entity("ACME LTD", "ACTIVE ", "100000.00", "Delhi")));

        assertTrue(engine.diff(previous, current).isEmpty());
    }

    @Test
    void shouldTreatNullTransitionsAsUpdates() {
        Snapshot previous = snapshot(DAY_1, Map.of(
                "K1", entity("ACME", "ACTIVE", "nan", "Delhi"),
                "K2", entity("BETA", "ACTIVE", "500", "Delhi")));
        Snapshot current = snapshot(DAY_2, Map.of(
                "K1", entity("ACME", "ACTIVE", "500", "Delhi"),
                "K2", entity("BETA", "ACTIVE", "", "Delhi")));

        List<ChangeRecord> records = engine.diff(previous, current).records();

        assertEquals(2, records.size());
        assertNull(records.get(0).oldValue());
        assertEquals("500", records.get(0).newValue());
        assertEquals("500", records.get(1).oldValue());
        assertNull(records.get(1).newValue());
    }

    @Test
    void shouldPartitionUnionOfKeysExhaustively() {
        Snapshot a = randomishSnapshot(DAY_1, 0);
        Snapshot b = randomishSnapshot(DAY_2, 1);

        KeyPartition partition = engine.partition(a, b);

        Set<String> union = new TreeSet<>(a.keys());
        union.addAll(b.keys());
        Set<String> covered = new TreeSet<>(partition.appeared());
        covered.addAll(partition.disappeared());
        covered.addAll(partition.common());
        assertEquals(union, covered);
        assertEquals(union.size(),
                partition.appeared().size() + partition.disappeared().size() + partition.common().size());
        assertEquals(partition.appeared(), keysOf(engine.diff(a, b), ChangeKind.NEW));
        assertEquals(partition.disappeared(), keysOf(engine.diff(a, b), ChangeKind.REMOVED));
    }

    @Test
    void shouldProduceSameResultWhenComparisonIsSharded() {
        Snapshot a = randomishSnapshot(DAY_1, 0);
        Snapshot b = randomishSnapshot(DAY_2, 1);

        ChangeSet sequential = engine.diff(a, b);
        ChangeSet sharded = new DiffEngine(settings(1, 7)).diff(a, b);

        assertEquals(sequential, sharded);
        assertEquals(sequential.records(), sharded.records());
    }

    private DiffSettings settings(int parallelThreshold, int shardSize) {
        return new DiffSettings(List.of("COMPANY_NAME", "COMPANY_STATUS", "PAIDUP_CAPITAL"),
                "COMPANY_NAME", "STATE", "COMPANY_STATUS", normalizer, parallelThreshold, shardSize);
    }

    private Snapshot snapshot(LocalDate date, Map<String, Map<String, String>> entities) {
        Snapshot.Builder builder = Snapshot.builder(date, SCHEMA, normalizer);
        entities.forEach(builder::add);
        return builder.build();
    }

    private Map<String, String> entity(String name, String status, String capital, String state) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("COMPANY_NAME", name);
        values.put("COMPANY_STATUS", status);
        values.put("PAIDUP_CAPITAL", capital);
        values.put("STATE", state);
        return values;
    }

    /**
     * Sixty entities; {@code variant} 1 drops every seventh key, adds ten new ones and changes capital or status
     * of every fifth and every eleventh entity.
     */
    private Snapshot randomishSnapshot(LocalDate date, int variant) {
        Map<String, Map<String, String>> entities = new HashMap<>();
        for (int i = 0; i < 60; i++) {
            if (variant == 1 && i % 7 == 0) {
                continue;
            }
            String capital = variant == 1 && i % 5 == 0 ? String.valueOf(i * 2000) : String.valueOf(i * 1000);
            String status = variant == 1 && i % 11 == 0 ? "STRIKE OFF" : "ACTIVE";
            entities.put("U%05d".formatted(i), entity("COMPANY " + i, status, capital, i % 2 == 0 ? "Delhi" : "Gujarat"));
        }
        if (variant == 1) {
            for (int i = 100; i < 110; i++) {
                entities.put("U%05d".formatted(i), entity("COMPANY " + i, "ACTIVE", "1000", "Maharashtra"));
            }
        }
        return snapshot(date, entities);
    }

    private Set<String> keysOf(ChangeSet changes, ChangeKind kind) {
        Set<String> keys = new TreeSet<>();
        for (ChangeRecord record : changes.records()) {
            if (record.kind() == kind) {
                keys.add(record.entityKey());
            }
        }
        return keys;
    }
}
