package com.mcainsights.mcainsights.changelog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcainsights.mcainsights.common.ChangeDetectionConstants;
import com.mcainsights.mcainsights.config.ChangeDetectionProperties;
import com.mcainsights.mcainsights.diff.ChangeSet;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Persists one run's change set as {@code change_log_yyyyMMdd.csv} and {@code change_log_yyyyMMdd.json},
 * and appends it to the cumulative history.
 *
 * <p>Both files are written to temporary names in the target directory and linked into place only after
 * both are complete; publishing never replaces an existing artifact. A failure at any step removes whatever was created, so a run leaves either both
 * artifacts or none.
 */
@Component
public class ChangeLogWriter {

    private static final Logger log = LoggerFactory.getLogger(ChangeLogWriter.class);

    private final ChangeDetectionProperties properties;
    private final ObjectMapper objectMapper;
    private final ChangeHistoryRepository historyRepository;

    public ChangeLogWriter(ChangeDetectionProperties properties,
                           ObjectMapper objectMapper,
                           ChangeHistoryRepository historyRepository) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.historyRepository = historyRepository;
    }

    /**
     * Writes the per-date artifacts for {@code changeSet}. Empty change sets still produce a header-only CSV
     * and an empty JSON array so the run is visible.
     *
     * @throws DuplicateRunException when either artifact for {@code runDate} already exists
     */
    public ChangeLogArtifacts write(ChangeSet changeSet, LocalDate runDate) {
        if (!runDate.equals(changeSet.detectionDate())) {
            throw new IllegalArgumentException("Run date %s does not match detection date %s"
                    .formatted(runDate, changeSet.detectionDate()));
        }

        Path directory = changeLogDirectory();
        Path csvFile = csvFile(runDate);
        Path jsonFile = jsonFile(runDate);
        if (Files.exists(csvFile) || Files.exists(jsonFile)) {
            throw new DuplicateRunException(runDate);
        }
        ensureDirectory(directory);

        List<ChangeLogEntry> entries = changeSet.records().stream().map(ChangeLogEntry::from).toList();
        Path csvTemp = null;
        Path jsonTemp = null;
        boolean csvPublished = false;
        try {
            csvTemp = Files.createTempFile(directory, "." + csvFile.getFileName(), ChangeDetectionConstants.FILE_EXT_TMP);
            writeCsv(csvTemp, entries);
            jsonTemp = Files.createTempFile(directory, "." + jsonFile.getFileName(), ChangeDetectionConstants.FILE_EXT_TMP);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(jsonTemp.toFile(), entries);

            // A hard link never replaces an existing file, so a concurrent writer for the same date loses here.
            Files.createLink(csvFile, csvTemp);
            csvPublished = true;
            Files.createLink(jsonFile, jsonTemp);
        } catch (FileAlreadyExistsException ex) {
            cleanUp(csvTemp, jsonTemp, csvPublished ? csvFile : null);
            throw new DuplicateRunException(runDate, ex);
        } catch (IOException | RuntimeException ex) {
            cleanUp(csvTemp, jsonTemp, csvPublished ? csvFile : null);
            throw new IllegalStateException(ChangeDetectionConstants.MSG_CHANGE_LOG_WRITE_FAILED.formatted(runDate), ex);
        }
        deleteQuietly(csvTemp);
        deleteQuietly(jsonTemp);

        log.info("Change logs saved: {} and {} ({} records)", csvFile, jsonFile, entries.size());
        return new ChangeLogArtifacts(runDate, csvFile, jsonFile, entries.size());
    }

    /**
     * Adds the change set to the cumulative history after every earlier run.
     *
     * @throws DuplicateRunException when the detection date is already in history
     */
    public void appendToHistory(ChangeSet changeSet) {
        historyRepository.append(changeSet);
    }

    /**
     * Removes the artifacts of a run that could not be completed.
     */
    public void discard(ChangeLogArtifacts artifacts) {
        for (Path file : List.of(artifacts.csvFile(), artifacts.jsonFile())) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException ex) {
                throw new IllegalStateException(ChangeDetectionConstants.MSG_CHANGE_LOG_DELETE_FAILED.formatted(file), ex);
            }
        }
        log.warn("Discarded change log artifacts for {}", artifacts.runDate());
    }

    /**
     * Removes artifacts that a run for {@code runDate} published without reaching history.
     * Callers must only use this for dates absent from history.
     *
     * @return true when at least one file was removed
     */
    public boolean discardUnrecorded(LocalDate runDate) {
        boolean removed = false;
        for (Path file : List.of(csvFile(runDate), jsonFile(runDate))) {
            try {
                removed |= Files.deleteIfExists(file);
            } catch (IOException ex) {
                throw new IllegalStateException(ChangeDetectionConstants.MSG_CHANGE_LOG_DELETE_FAILED.formatted(file), ex);
            }
        }
        if (removed) {
            log.warn("Removed change log artifacts of an unfinished run for {}", runDate);
        }
        return removed;
    }

    Path csvFile(LocalDate runDate) {
        return changeLogDirectory().resolve(ChangeDetectionConstants.CHANGE_LOG_FILE_PREFIX
                + runDate.format(DateTimeFormatter.BASIC_ISO_DATE) + ChangeDetectionConstants.FILE_EXT_CSV);
    }

    Path jsonFile(LocalDate runDate) {
        return changeLogDirectory().resolve(ChangeDetectionConstants.CHANGE_LOG_FILE_PREFIX
                + runDate.format(DateTimeFormatter.BASIC_ISO_DATE) + ChangeDetectionConstants.FILE_EXT_JSON);
    }

    private Path changeLogDirectory() {
        return Path.of(properties.getChangeLogDir());
    }

    private void writeCsv(Path file, List<ChangeLogEntry> entries) throws IOException {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader(ChangeDetectionConstants.CHANGE_LOG_COLUMNS.toArray(String[]::new))
                .build();

        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = csvFormat.print(writer)) {
            for (ChangeLogEntry entry : entries) {
                printer.printRecord(entry.toCsvRow());
            }
        }
    }

    private void ensureDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new IllegalStateException(ChangeDetectionConstants.MSG_DIRECTORY_CREATE_FAILED.formatted(directory), ex);
        }
    }

    private void cleanUp(Path csvTemp, Path jsonTemp, Path publishedCsv) {
        deleteQuietly(csvTemp);
        deleteQuietly(jsonTemp);
        deleteQuietly(publishedCsv);
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Unable to remove partial change log file {}: {}", file, ex.getMessage());
        }
    }
}
