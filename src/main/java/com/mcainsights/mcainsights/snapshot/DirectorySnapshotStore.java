package com.mcainsights.mcainsights.snapshot;

import com.mcainsights.mcainsights.common.ChangeDetectionConstants;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Snapshot series persisted as {@code snapshot_yyyyMMdd.csv} files in one directory.
 * The first header naming the key field is the entity key; every other header is a schema field.
 * Only the most recently used snapshots stay parsed in memory.
 */
public class DirectorySnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(DirectorySnapshotStore.class);
    private static final Pattern SNAPSHOT_FILE_PATTERN = Pattern.compile(ChangeDetectionConstants.SNAPSHOT_FILE_REGEX);

    private final Path directory;
    private final String keyField;
    private final ValueNormalizer normalizer;
    private final Map<LocalDate, Snapshot> cache = new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<LocalDate, Snapshot> eldest) {
            return size() > ChangeDetectionConstants.SNAPSHOT_CACHE_SIZE;
        }
    };

    public DirectorySnapshotStore(Path directory, String keyField, ValueNormalizer normalizer) {
        this.directory = directory;
        this.keyField = keyField;
        this.normalizer = normalizer;
    }

    @Override
    public synchronized void append(Snapshot snapshot) {
        Path target = fileFor(snapshot.captureDate());
        if (Files.exists(target)) {
            throw new DuplicateSnapshotException(snapshot.captureDate());
        }
        ensureDirectory();

        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + target.getFileName(), ChangeDetectionConstants.FILE_EXT_TMP);
            writeCsv(temp, snapshot);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            deleteTemp(temp);
            throw new IllegalStateException(ChangeDetectionConstants.MSG_SNAPSHOT_WRITE_FAILED.formatted(target), ex);
        }
        cache.put(snapshot.captureDate(), snapshot);
        log.info("Snapshot stored. date={}, records={}, file={}", snapshot.captureDate(), snapshot.size(), target);
    }

    @Override
    public SnapshotPair latestPair() {
        List<LocalDate> dates = captureDates();
        if (dates.size() < 2) {
            throw new InsufficientHistoryException(dates.size());
        }
        return new SnapshotPair(asOf(dates.get(dates.size() - 2)), asOf(dates.get(dates.size() - 1)));
    }

    @Override
    public synchronized Snapshot asOf(LocalDate date) {
        Snapshot cached = cache.get(date);
        if (cached != null) {
            return cached;
        }
        Path file = fileFor(date);
        if (!Files.isRegularFile(file)) {
            throw new SnapshotNotFoundException(date);
        }
        Snapshot loaded = readCsv(file, date);
        cache.put(date, loaded);
        return loaded;
    }

    /**
     * Number of parsed snapshots currently held in memory.
     */
    synchronized int cachedSnapshots() {
        return cache.size();
    }

    @Override
    public List<LocalDate> captureDates() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<LocalDate> dates = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.forEach(file -> {
                Matcher matcher = SNAPSHOT_FILE_PATTERN.matcher(file.getFileName().toString());
                if (!matcher.matches()) {
                    return;
                }
                try {
                    dates.add(LocalDate.parse(matcher.group(1), DateTimeFormatter.BASIC_ISO_DATE));
                } catch (DateTimeParseException ex) {
                    log.warn("Ignoring snapshot file with invalid date: {}", file.getFileName());
                }
            });
        } catch (IOException ex) {
            throw new IllegalStateException(ChangeDetectionConstants.MSG_SNAPSHOT_DIR_LIST_FAILED.formatted(directory), ex);
        }
        dates.sort(null);
        return dates;
    }

    private Snapshot readCsv(Path file, LocalDate date) {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .build();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = csvFormat.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            int keyIndex = headers.indexOf(keyField);
            if (keyIndex < 0) {
                throw new IllegalStateException(
                        ChangeDetectionConstants.MSG_SNAPSHOT_KEY_COLUMN_MISSING.formatted(keyField, file));
            }

            List<String> schema = new ArrayList<>(headers);
            schema.remove(keyIndex);
            Snapshot.Builder builder = Snapshot.builder(date, schema, normalizer);

            for (CSVRecord record : parser) {
                Map<String, String> values = new LinkedHashMap<>();
                for (String field : schema) {
                    values.put(field, record.isMapped(field) && record.isSet(field) ? record.get(field) : null);
                }
                builder.add(record.get(keyIndex), values);
            }

            Snapshot snapshot = builder.build();
            log.info("Loaded snapshot: {} ({} records)", date, snapshot.size());
            return snapshot;
        } catch (IOException ex) {
            throw new IllegalStateException(ChangeDetectionConstants.MSG_SNAPSHOT_READ_FAILED.formatted(file), ex);
        }
    }

    private void writeCsv(Path file, Snapshot snapshot) throws IOException {
        List<String> headers = new ArrayList<>(snapshot.schema().size() + 1);
        headers.add(keyField);
        headers.addAll(snapshot.schema());

        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader(headers.toArray(String[]::new))
                .build();

        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = csvFormat.print(writer)) {
            for (AttributeRecord record : snapshot.records()) {
                List<String> row = new ArrayList<>(headers.size());
                row.add(record.entityKey());
                for (String field : snapshot.schema()) {
                    row.add(record.get(field));
                }
                printer.printRecord(row);
            }
        }
    }

    private Path fileFor(LocalDate date) {
        return directory.resolve(ChangeDetectionConstants.SNAPSHOT_FILE_PREFIX
                + date.format(DateTimeFormatter.BASIC_ISO_DATE)
                + ChangeDetectionConstants.FILE_EXT_CSV);
    }

    private void ensureDirectory() {
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new IllegalStateException(ChangeDetectionConstants.MSG_DIRECTORY_CREATE_FAILED.formatted(directory), ex);
        }
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            log.warn("Unable to remove temporary snapshot file {}: {}", temp, ex.getMessage());
        }
    }
}
