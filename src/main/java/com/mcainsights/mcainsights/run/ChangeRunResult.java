package com.mcainsights.mcainsights.run;

import com.mcainsights.mcainsights.changelog.ChangeLogArtifacts;
import com.mcainsights.mcainsights.diff.ChangeKind;
import com.mcainsights.mcainsights.diff.ChangeSet;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Outcome of one completed comparison run.
 */
public record ChangeRunResult(
        LocalDate previousDate,
        LocalDate detectionDate,
        int newIncorporations,
        int deregistrations,
        int fieldUpdates,
        Path csvFile,
        Path jsonFile
) {

    static ChangeRunResult of(ChangeSet changeSet, ChangeLogArtifacts artifacts) {
        return new ChangeRunResult(
                changeSet.previousDate(),
                changeSet.detectionDate(),
                changeSet.count(ChangeKind.NEW),
                changeSet.count(ChangeKind.REMOVED),
                changeSet.count(ChangeKind.FIELD_UPDATE),
                artifacts.csvFile(),
                artifacts.jsonFile()
        );
    }

    public int totalChanges() {
        return newIncorporations + deregistrations + fieldUpdates;
    }
}
