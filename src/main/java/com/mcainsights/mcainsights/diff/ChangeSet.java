package com.mcainsights.mcainsights.diff;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable output of one comparison run.
 */
public final class ChangeSet {

    private final LocalDate previousDate;
    private final LocalDate detectionDate;
    private final List<ChangeRecord> records;

    public ChangeSet(LocalDate previousDate, LocalDate detectionDate, List<ChangeRecord> records) {
        this.previousDate = previousDate;
        this.detectionDate = Objects.requireNonNull(detectionDate, "detectionDate");
        this.records = List.copyOf(records);
    }

    public LocalDate previousDate() {
        return previousDate;
    }

    public LocalDate detectionDate() {
        return detectionDate;
    }

    public List<ChangeRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int count(ChangeKind kind) {
        int count = 0;
        for (ChangeRecord record : records) {
            if (record.kind() == kind) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChangeSet other)) {
            return false;
        }
        return Objects.equals(previousDate, other.previousDate)
                && detectionDate.equals(other.detectionDate)
                && records.equals(other.records);
    }

    @Override
    public int hashCode() {
        return Objects.hash(previousDate, detectionDate, records);
    }

    @Override
    public String toString() {
        return "ChangeSet{" + previousDate + " -> " + detectionDate
                + ", new=" + count(ChangeKind.NEW)
                + ", removed=" + count(ChangeKind.REMOVED)
                + ", updated=" + count(ChangeKind.FIELD_UPDATE) + "}";
    }
}
