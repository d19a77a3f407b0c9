package com.mcainsights.mcainsights.snapshot;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view over the stored snapshot series.
 */
public interface SnapshotReader {

    /**
     * Returns the two most recent snapshots, previous first.
     *
     * @throws InsufficientHistoryException when fewer than two snapshots are stored
     */
    SnapshotPair latestPair();

    /**
     * Returns the snapshot captured exactly on {@code date}.
     *
     * @throws SnapshotNotFoundException when no snapshot has that capture date
     */
    Snapshot asOf(LocalDate date);

    /**
     * Capture dates of all stored snapshots, oldest first.
     */
    List<LocalDate> captureDates();

    /**
     * Every pair of adjacent snapshots, oldest pair first. Empty when fewer than two exist.
     */
    default List<SnapshotPair> consecutivePairs() {
        List<LocalDate> dates = captureDates();
        List<SnapshotPair> pairs = new ArrayList<>(Math.max(0, dates.size() - 1));
        for (int i = 1; i < dates.size(); i++) {
            pairs.add(new SnapshotPair(asOf(dates.get(i - 1)), asOf(dates.get(i))));
        }
        return pairs;
    }
}
