package com.mcainsights.mcainsights.snapshot;

import com.mcainsights.mcainsights.common.ChangeDetectionException;

/**
 * Raised when fewer than two snapshots exist. Recoverable: the next capture makes a comparison possible.
 */
public class InsufficientHistoryException extends ChangeDetectionException {

    private final int availableSnapshots;

    public InsufficientHistoryException(int availableSnapshots) {
        super("At least two snapshots are required for change detection, found " + availableSnapshots);
        this.availableSnapshots = availableSnapshots;
    }

    public int getAvailableSnapshots() {
        return availableSnapshots;
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }
}
