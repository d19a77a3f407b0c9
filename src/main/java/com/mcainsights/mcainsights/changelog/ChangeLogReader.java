package com.mcainsights.mcainsights.changelog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcainsights.mcainsights.common.ChangeDetectionConstants;
import com.mcainsights.mcainsights.config.ChangeDetectionProperties;
import com.mcainsights.mcainsights.diff.ChangeRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads per-date structured change logs back into change records.
 */
@Component
public class ChangeLogReader {

    private static final Pattern CHANGE_LOG_FILE_PATTERN = Pattern.compile(ChangeDetectionConstants.CHANGE_LOG_FILE_REGEX);
    private static final TypeReference<List<ChangeLogEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final ChangeDetectionProperties properties;
    private final ObjectMapper objectMapper;

    public ChangeLogReader(ChangeDetectionProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public List<ChangeRecord> read(LocalDate runDate) {
        Path file = Path.of(properties.getChangeLogDir()).resolve(ChangeDetectionConstants.CHANGE_LOG_FILE_PREFIX
                + runDate.format(DateTimeFormatter.BASIC_ISO_DATE) + ChangeDetectionConstants.FILE_EXT_JSON);
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException(ChangeDetectionConstants.MSG_CHANGE_LOG_NOT_FOUND.formatted(runDate));
        }
        try {
            List<ChangeLogEntry> entries = objectMapper.readValue(file.toFile(), ENTRY_LIST);
            return entries.stream().map(ChangeLogEntry::toChangeRecord).toList();
        } catch (IOException ex) {
            throw new IllegalStateException(ChangeDetectionConstants.MSG_CHANGE_LOG_READ_FAILED.formatted(file), ex);
        }
    }

    /**
     * Dates with a structured change log on disk, oldest first.
     */
    public List<LocalDate> runDates() {
        Path directory = Path.of(properties.getChangeLogDir());
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<LocalDate> dates = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.forEach(file -> {
                Matcher matcher = CHANGE_LOG_FILE_PATTERN.matcher(file.getFileName().toString());
                if (matcher.matches()) {
                    dates.add(LocalDate.parse(matcher.group(1), DateTimeFormatter.BASIC_ISO_DATE));
                }
            });
        } catch (IOException ex) {
            throw new IllegalStateException(ChangeDetectionConstants.MSG_CHANGE_LOG_READ_FAILED.formatted(directory), ex);
        }
        dates.sort(null);
        return dates;
    }
}
