package com.mcainsights.mcainsights.snapshot;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Heap-backed snapshot series. Snapshots are immutable, so the store hands out the stored instances.
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final NavigableMap<LocalDate, Snapshot> snapshots = new TreeMap<>();

    @Override
    public synchronized void append(Snapshot snapshot) {
        if (snapshots.containsKey(snapshot.captureDate())) {
            throw new DuplicateSnapshotException(snapshot.captureDate());
        }
        snapshots.put(snapshot.captureDate(), snapshot);
    }

    @Override
    public synchronized SnapshotPair latestPair() {
        if (snapshots.size() < 2) {
            throw new InsufficientHistoryException(snapshots.size());
        }
        Map.Entry<LocalDate, Snapshot> current = snapshots.lastEntry();
        Map.Entry<LocalDate, Snapshot> previous = snapshots.lowerEntry(current.getKey());
        return new SnapshotPair(previous.getValue(), current.getValue());
    }

    @Override
    public synchronized Snapshot asOf(LocalDate date) {
        Snapshot snapshot = snapshots.get(date);
        if (snapshot == null) {
            throw new SnapshotNotFoundException(date);
        }
        return snapshot;
    }

    @Override
    public synchronized List<LocalDate> captureDates() {
        return new ArrayList<>(snapshots.keySet());
    }
}
