package com.mcainsights.mcainsights.changelog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mcainsights.mcainsights.diff.ChangeKind;
import com.mcainsights.mcainsights.diff.ChangeRecord;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Structured change log row. The flat CSV row is a projection of this object.
 */
public record ChangeLogEntry(
        @JsonProperty("entity_key") String entityKey,
        @JsonProperty("change_type") String changeType,
        @JsonProperty("field_changed") String fieldChanged,
        @JsonProperty("old_value") String oldValue,
        @JsonProperty("new_value") String newValue,
        @JsonProperty("detection_date") String detectionDate,
        @JsonProperty("context") Context context
) {

    public record Context(
            @JsonProperty("entity_name") String entityName,
            @JsonProperty("state") String state,
            @JsonProperty("status") String status
    ) {
    }

    public static ChangeLogEntry from(ChangeRecord record) {
        return new ChangeLogEntry(
                record.entityKey(),
                record.kind().logName(),
                record.fieldName(),
                record.oldValue(),
                record.newValue(),
                record.detectionDate().toString(),
                new Context(record.entityName(), record.state(), record.status())
        );
    }

    public ChangeRecord toChangeRecord() {
        Context ctx = context == null ? new Context(null, null, null) : context;
        return new ChangeRecord(
                entityKey,
                ChangeKind.fromLogName(changeType),
                fieldChanged,
                oldValue,
                newValue,
                LocalDate.parse(detectionDate),
                ctx.entityName(),
                ctx.state(),
                ctx.status()
        );
    }

    /**
     * Flat row in {@code CHANGE_LOG_COLUMNS} order; missing values become empty cells.
     */
    public List<String> toCsvRow() {
        Context ctx = context == null ? new Context(null, null, null) : context;
        return Arrays.asList(
                cell(entityKey),
                cell(ctx.entityName()),
                cell(changeType),
                cell(fieldChanged),
                cell(oldValue),
                cell(newValue),
                cell(detectionDate),
                cell(ctx.state()),
                cell(ctx.status())
        );
    }

    private static String cell(String value) {
        return value == null ? "" : value;
    }
}
