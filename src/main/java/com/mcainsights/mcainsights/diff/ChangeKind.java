package com.mcainsights.mcainsights.diff;

import java.util.Locale;

/**
 * Kind of a detected change, with the name it carries in change logs.
 */
public enum ChangeKind {

    NEW("NEW_INCORPORATION"),
    REMOVED("DEREGISTRATION"),
    FIELD_UPDATE("FIELD_UPDATE");

    private final String logName;

    ChangeKind(String logName) {
        this.logName = logName;
    }

    public String logName() {
        return logName;
    }

    public static ChangeKind fromLogName(String logName) {
        String normalized = logName == null ? "" : logName.trim().toUpperCase(Locale.ROOT);
        for (ChangeKind kind : values()) {
            if (kind.logName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported change type: " + logName);
    }
}
