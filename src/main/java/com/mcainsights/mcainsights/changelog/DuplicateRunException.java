package com.mcainsights.mcainsights.changelog;

import com.mcainsights.mcainsights.common.ChangeDetectionException;

import java.time.LocalDate;

/**
 * Raised instead of overwriting the change log of a run that was already recorded.
 */
public class DuplicateRunException extends ChangeDetectionException {

    private final LocalDate runDate;

    public DuplicateRunException(LocalDate runDate) {
        super("Change log already recorded for run date " + runDate);
        this.runDate = runDate;
    }

    public DuplicateRunException(LocalDate runDate, Throwable cause) {
        super("Change log already recorded for run date " + runDate, cause);
        this.runDate = runDate;
    }

    public LocalDate getRunDate() {
        return runDate;
    }
}
