package com.mcainsights.mcainsights.snapshot;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectorySnapshotStoreTest {

    @TempDir
    Path directory;

    private final ValueNormalizer normalizer = new ValueNormalizer(
            List.of("nan"), List.of("COMPANY_STATUS"), List.of("PAIDUP_CAPITAL"));

    @Test
    void shouldLoadSnapshotFilesWithKeyColumnAndNormalizedValues() throws IOException {
        Files.writeString(directory.resolve("snapshot_20240101.csv"), String.join("\n",
                "CIN,COMPANY_NAME,COMPANY_STATUS,PAIDUP_CAPITAL,STATE",
                "U12345MH2020PTC123456,ACME PRIVATE LIMITED,Active,\"1,00,000\",Maharashtra",
                "L67890GJ2019PLC654321,BETA LIMITED,nan,,Gujarat"
        ) + "\n", StandardCharsets.UTF_8);

        Snapshot snapshot = newStore().asOf(LocalDate.of(2024, 1, 1));

        assertEquals(List.of("COMPANY_NAME", "COMPANY_STATUS", "PAIDUP_CAPITAL", "STATE"), snapshot.schema());
        assertEquals(2, snapshot.size());
        AttributeRecord acme = snapshot.record("U12345MH2020PTC123456");
        assertEquals("ACTIVE", acme.get("COMPANY_STATUS"));
        assertEquals("100000", acme.get("PAIDUP_CAPITAL"));
        AttributeRecord beta = snapshot.record("L67890GJ2019PLC654321");
        assertNull(beta.get("COMPANY_STATUS"));
        assertNull(beta.get("PAIDUP_CAPITAL"));
    }

    @Test
    void shouldPersistAppendedSnapshotAndReadItBack() throws IOException {
        Snapshot snapshot = Snapshot.builder(LocalDate.of(2024, 1, 2), List.of("COMPANY_NAME", "STATE"), normalizer)
                .add("K2", Map.of("COMPANY_NAME", "BETA, \"QUOTED\" LTD"))
                .add("K1", Map.of("COMPANY_NAME", "ACME", "STATE", "Delhi"))
                .build();

        newStore().append(snapshot);

        try (Stream<Path> files = Files.list(directory)) {
            assertEquals(List.of("snapshot_20240102.csv"), files.map(p -> p.getFileName().toString()).toList());
        }
        Snapshot reloaded = newStore().asOf(LocalDate.of(2024, 1, 2));
        assertEquals(snapshot.schema(), reloaded.schema());
        assertEquals(List.copyOf(snapshot.records()), List.copyOf(reloaded.records()));
    }

    @Test
    void shouldOrderCaptureDatesAndIgnoreUnrelatedFiles() throws IOException {
        Files.writeString(directory.resolve("snapshot_20240103.csv"), "CIN,COMPANY_NAME\n");
        Files.writeString(directory.resolve("snapshot_20240101.csv"), "CIN,COMPANY_NAME\n");
        Files.writeString(directory.resolve("current_master.csv"), "CIN,COMPANY_NAME\n");
        Files.writeString(directory.resolve("snapshot_20241399.csv"), "CIN,COMPANY_NAME\n");

        DirectorySnapshotStore store = newStore();

        assertEquals(List.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 3)), store.captureDates());
        SnapshotPair pair = store.latestPair();
        assertEquals(LocalDate.of(2024, 1, 1), pair.previous().captureDate());
        assertEquals(LocalDate.of(2024, 1, 3), pair.current().captureDate());
    }

    @Test
    void shouldKeepOnlyRecentSnapshotsParsed() throws IOException {
        for (int day = 1; day <= 5; day++) {
            Files.writeString(directory.resolve("snapshot_2024010" + day + ".csv"), "CIN,COMPANY_NAME\nK1,ACME\n");
        }
        DirectorySnapshotStore store = newStore();

        for (LocalDate date : store.captureDates()) {
            assertEquals(date, store.asOf(date).captureDate());
        }

        assertEquals(2, store.cachedSnapshots());
        assertEquals("ACME", store.asOf(LocalDate.of(2024, 1, 1)).record("K1").get("COMPANY_NAME"));
    }

    @Test
    void shouldRefuseToOverwriteExistingSnapshotFile() throws IOException {
        Path existing = directory.resolve("snapshot_20240101.csv");
        Files.writeString(existing, "CIN,COMPANY_NAME\nK1,ACME\n");
        Snapshot snapshot = Snapshot.builder(LocalDate.of(2024, 1, 1), List.of("COMPANY_NAME"), normalizer)
                .add("K1", Map.of("COMPANY_NAME", "OTHER"))
                .build();

        assertThrows(DuplicateSnapshotException.class, () -> newStore().append(snapshot));
        assertEquals("CIN,COMPANY_NAME\nK1,ACME\n", Files.readString(existing));
    }

    @Test
    void shouldReportMissingHistoryAndMissingDates() {
        DirectorySnapshotStore store = newStore();

        assertTrue(store.captureDates().isEmpty());
        assertThrows(InsufficientHistoryException.class, store::latestPair);
        assertThrows(SnapshotNotFoundException.class, () -> store.asOf(LocalDate.of(2024, 1, 1)));
    }

    @Test
    void shouldFailWhenKeyColumnIsMissing() throws IOException {
        Files.writeString(directory.resolve("snapshot_20240101.csv"), "COMPANY_NAME\nACME\n");

        assertThrows(IllegalStateException.class, () -> newStore().asOf(LocalDate.of(2024, 1, 1)));
    }

    private DirectorySnapshotStore newStore() {
        return new DirectorySnapshotStore(directory, "CIN", normalizer);
    }
}
