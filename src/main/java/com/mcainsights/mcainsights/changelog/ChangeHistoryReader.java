package com.mcainsights.mcainsights.changelog;

import com.mcainsights.mcainsights.diff.ChangeRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the cumulative change history. Results follow history order:
 * run chronological order, then the run's own record order.
 */
public interface ChangeHistoryReader {

    List<ChangeRecord> findByDetectionDate(LocalDate detectionDate);

    List<ChangeRecord> findByEntityKey(String entityKey);

    List<ChangeRecord> findAll();

    List<ChangeRunSummary> findRuns();

    Optional<LocalDate> latestDetectionDate();

    boolean hasRun(LocalDate detectionDate);
}
