package com.mcainsights.mcainsights.snapshot;

/**
 * Two snapshots in chronological order, ready for comparison.
 */
public record SnapshotPair(Snapshot previous, Snapshot current) {
}
