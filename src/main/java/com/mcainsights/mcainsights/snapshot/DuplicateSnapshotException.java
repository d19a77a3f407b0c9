package com.mcainsights.mcainsights.snapshot;

import com.mcainsights.mcainsights.common.ChangeDetectionException;

import java.time.LocalDate;

/**
 * Raised when a snapshot is appended for a capture date that is already stored.
 */
public class DuplicateSnapshotException extends ChangeDetectionException {

    private final LocalDate captureDate;

    public DuplicateSnapshotException(LocalDate captureDate) {
        super("Snapshot already exists for capture date " + captureDate);
        this.captureDate = captureDate;
    }

    public LocalDate getCaptureDate() {
        return captureDate;
    }
}
