package com.mcainsights.mcainsights.snapshot;

/**
 * Append-only, chronologically ordered snapshot series.
 */
public interface SnapshotStore extends SnapshotReader {

    /**
     * Stores a snapshot under its capture date. Stored snapshots are never replaced.
     *
     * @throws DuplicateSnapshotException when a snapshot with the same capture date exists
     */
    void append(Snapshot snapshot);
}
