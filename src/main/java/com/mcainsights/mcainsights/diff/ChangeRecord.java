package com.mcainsights.mcainsights.diff;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One detected change. NEW and REMOVED records never carry a field name; FIELD_UPDATE records always do.
 */
public record ChangeRecord(
        String entityKey,
        ChangeKind kind,
        String fieldName,
        String oldValue,
        String newValue,
        LocalDate detectionDate,
        String entityName,
        String state,
        String status
) {

    public ChangeRecord {
        Objects.requireNonNull(entityKey, "entityKey");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detectionDate, "detectionDate");
        if (kind == ChangeKind.FIELD_UPDATE) {
            if (fieldName == null || fieldName.isBlank()) {
                throw new IllegalArgumentException("Field update for " + entityKey + " requires a field name");
            }
        } else if (fieldName != null) {
            throw new IllegalArgumentException(kind + " record for " + entityKey + " must not carry a field name");
        }
    }
}
