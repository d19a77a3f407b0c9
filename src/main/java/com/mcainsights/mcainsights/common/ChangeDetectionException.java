package com.mcainsights.mcainsights.common;

/**
 * Root of the change detection failure taxonomy. Every failure propagates to the run orchestrator,
 * which decides between waiting for the next run and aborting.
 */
public abstract class ChangeDetectionException extends RuntimeException {

    protected ChangeDetectionException(String message) {
        super(message);
    }

    protected ChangeDetectionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns true when retrying a later run can succeed without operator action.
     */
    public boolean isRecoverable() {
        return false;
    }
}
