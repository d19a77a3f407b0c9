package com.mcainsights.mcainsights.diff;

import com.mcainsights.mcainsights.common.ChangeDetectionException;

import java.util.List;

/**
 * Raised when two snapshots cannot be compared field by field. Fatal for the run.
 */
public class SchemaMismatchException extends ChangeDetectionException {

    private final List<String> previousSchema;
    private final List<String> currentSchema;

    public SchemaMismatchException(String message, List<String> previousSchema, List<String> currentSchema) {
        super(message + ". previous=" + previousSchema + ", current=" + currentSchema);
        this.previousSchema = List.copyOf(previousSchema);
        this.currentSchema = List.copyOf(currentSchema);
    }

    public List<String> getPreviousSchema() {
        return previousSchema;
    }

    public List<String> getCurrentSchema() {
        return currentSchema;
    }
}
