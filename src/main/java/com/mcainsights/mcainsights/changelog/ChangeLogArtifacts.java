package com.mcainsights.mcainsights.changelog;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Files produced for one run's change log.
 */
public record ChangeLogArtifacts(LocalDate runDate, Path csvFile, Path jsonFile, int recordCount) {
}
