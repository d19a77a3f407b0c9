package com.mcainsights.mcainsights.snapshot;

import com.mcainsights.mcainsights.common.ChangeDetectionException;

import java.time.LocalDate;

public class SnapshotNotFoundException extends ChangeDetectionException {

    private final LocalDate captureDate;

    public SnapshotNotFoundException(LocalDate captureDate) {
        super("No snapshot captured on " + captureDate);
        this.captureDate = captureDate;
    }

    public LocalDate getCaptureDate() {
        return captureDate;
    }
}
