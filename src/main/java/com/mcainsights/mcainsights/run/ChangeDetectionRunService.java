package com.mcainsights.mcainsights.run;

import com.mcainsights.mcainsights.changelog.ChangeHistoryReader;
import com.mcainsights.mcainsights.changelog.ChangeLogArtifacts;
import com.mcainsights.mcainsights.changelog.ChangeLogWriter;
import com.mcainsights.mcainsights.diff.DiffEngine;
import com.mcainsights.mcainsights.diff.ChangeSet;
import com.mcainsights.mcainsights.snapshot.InsufficientHistoryException;
import com.mcainsights.mcainsights.snapshot.SnapshotPair;
import com.mcainsights.mcainsights.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Orchestrates comparison runs: resolve the snapshot pair, diff, write the per-date log, append to history.
 * A run that fails after its artifacts were written removes them again, so a failed run has no visible effect.
 * Artifacts found for a date that history does not know are leftovers of an interrupted run and are replaced.
 */
@Service
public class ChangeDetectionRunService {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetectionRunService.class);

    private final SnapshotStore snapshotStore;
    private final DiffEngine diffEngine;
    private final ChangeLogWriter changeLogWriter;
    private final ChangeHistoryReader changeHistory;

    public ChangeDetectionRunService(SnapshotStore snapshotStore,
                                     DiffEngine diffEngine,
                                     ChangeLogWriter changeLogWriter,
                                     ChangeHistoryReader changeHistory) {
        this.snapshotStore = snapshotStore;
        this.diffEngine = diffEngine;
        this.changeLogWriter = changeLogWriter;
        this.changeHistory = changeHistory;
    }

    /**
     * Compares the two most recent snapshots.
     *
     * @throws InsufficientHistoryException when fewer than two snapshots exist
     */
    public ChangeRunResult runLatest() {
        return runPair(snapshotStore.latestPair());
    }

    /**
     * Compares every consecutive snapshot pair whose current date is not yet in history, oldest first.
     * Snapshots are loaded only for pairs that still need a run.
     *
     * @throws InsufficientHistoryException when fewer than two snapshots exist
     */
    public List<ChangeRunResult> runPending() {
        List<LocalDate> dates = snapshotStore.captureDates();
        if (dates.size() < 2) {
            throw new InsufficientHistoryException(dates.size());
        }

        List<ChangeRunResult> results = new ArrayList<>();
        for (int i = 1; i < dates.size(); i++) {
            LocalDate current = dates.get(i);
            if (changeHistory.hasRun(current)) {
                log.debug("Skipping already recorded run {}", current);
                continue;
            }
            results.add(runPair(new SnapshotPair(snapshotStore.asOf(dates.get(i - 1)), snapshotStore.asOf(current))));
        }
        return results;
    }

    private ChangeRunResult runPair(SnapshotPair pair) {
        ChangeSet changeSet = diffEngine.diff(pair.previous(), pair.current());
        LocalDate detectionDate = changeSet.detectionDate();
        if (!changeHistory.hasRun(detectionDate)) {
            changeLogWriter.discardUnrecorded(detectionDate);
        }

        ChangeLogArtifacts artifacts = changeLogWriter.write(changeSet, detectionDate);
        try {
            changeLogWriter.appendToHistory(changeSet);
        } catch (RuntimeException ex) {
            try {
                changeLogWriter.discard(artifacts);
            } catch (RuntimeException discardFailure) {
                ex.addSuppressed(discardFailure);
            }
            throw ex;
        }

        ChangeRunResult result = ChangeRunResult.of(changeSet, artifacts);
        log.info("Change detection complete. previous={}, current={}, new={}, removed={}, updated={}",
                result.previousDate(), result.detectionDate(),
                result.newIncorporations(), result.deregistrations(), result.fieldUpdates());
        return result;
    }
}
