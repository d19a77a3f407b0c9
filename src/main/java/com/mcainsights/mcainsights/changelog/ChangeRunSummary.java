package com.mcainsights.mcainsights.changelog;

import java.time.LocalDate;

/**
 * One recorded run in the cumulative change history.
 */
public record ChangeRunSummary(
        LocalDate detectionDate,
        LocalDate previousDate,
        int totalChanges,
        int newIncorporations,
        int deregistrations,
        int fieldUpdates,
        long recordedAt
) {
}
