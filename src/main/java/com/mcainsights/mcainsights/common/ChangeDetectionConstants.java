package com.mcainsights.mcainsights.common;

import java.util.List;

/**
 * Shared constants for snapshot storage, change detection and change log output.
 */
public final class ChangeDetectionConstants {

    private ChangeDetectionConstants() {
    }

    public static final String DEFAULT_SNAPSHOT_DIR = "data/snapshots";
    public static final String DEFAULT_CHANGE_LOG_DIR = "data/change_logs";
    public static final String DEFAULT_KEY_FIELD = "CIN";
    public static final String DEFAULT_NAME_FIELD = "COMPANY_NAME";
    public static final String DEFAULT_STATE_FIELD = "STATE";
    public static final String DEFAULT_STATUS_FIELD = "COMPANY_STATUS";
    public static final String DEFAULT_CRON = "0 30 2 * * *";
    public static final int DEFAULT_PARALLEL_THRESHOLD = 20_000;
    public static final int DEFAULT_SHARD_SIZE = 5_000;
    public static final int SNAPSHOT_CACHE_SIZE = 2;

    public static final List<String> DEFAULT_TRACKED_FIELDS = List.of(
            "COMPANY_NAME", "COMPANY_CLASS", "COMPANY_STATUS",
            "AUTHORIZED_CAPITAL", "PAIDUP_CAPITAL",
            "PRINCIPAL_BUSINESS_ACTIVITY", "REGISTERED_OFFICE_ADDRESS"
    );
    public static final List<String> DEFAULT_UPPER_CASE_FIELDS = List.of("COMPANY_NAME", "COMPANY_CLASS", "COMPANY_STATUS");
    public static final List<String> DEFAULT_NUMERIC_FIELDS = List.of("AUTHORIZED_CAPITAL", "PAIDUP_CAPITAL");
    public static final List<String> DEFAULT_NULL_TOKENS = List.of("nan", "none", "null", "nat");
    public static final List<String> DEFAULT_KNOWN_STATES = List.of("Maharashtra", "Gujarat", "Delhi", "Tamil Nadu", "Karnataka");

    public static final String SNAPSHOT_FILE_PREFIX = "snapshot_";
    public static final String SNAPSHOT_FILE_REGEX = "^snapshot_(\\d{8})\\.csv$";
    public static final String CHANGE_LOG_FILE_PREFIX = "change_log_";
    public static final String CHANGE_LOG_FILE_REGEX = "^change_log_(\\d{8})\\.json$";
    public static final String FILE_EXT_CSV = ".csv";
    public static final String FILE_EXT_JSON = ".json";
    public static final String FILE_EXT_TMP = ".tmp";

    public static final String TABLE_CHANGE_RUN = "change_run";
    public static final String TABLE_CHANGE_HISTORY = "change_history";
    public static final int HISTORY_BATCH_SIZE = 500;

    public static final String COLUMN_ENTITY_KEY = "entity_key";
    public static final String COLUMN_ENTITY_NAME = "entity_name";
    public static final String COLUMN_CHANGE_TYPE = "change_type";
    public static final String COLUMN_FIELD_CHANGED = "field_changed";
    public static final String COLUMN_OLD_VALUE = "old_value";
    public static final String COLUMN_NEW_VALUE = "new_value";
    public static final String COLUMN_DETECTION_DATE = "detection_date";
    public static final String COLUMN_STATE = "state";
    public static final String COLUMN_STATUS = "status";

    public static final List<String> CHANGE_LOG_COLUMNS = List.of(
            COLUMN_ENTITY_KEY, COLUMN_ENTITY_NAME, COLUMN_CHANGE_TYPE, COLUMN_FIELD_CHANGED,
            COLUMN_OLD_VALUE, COLUMN_NEW_VALUE, COLUMN_DETECTION_DATE, COLUMN_STATE, COLUMN_STATUS
    );

    public static final String MSG_SNAPSHOT_READ_FAILED = "Failed to read snapshot file: %s";
    public static final String MSG_SNAPSHOT_WRITE_FAILED = "Failed to write snapshot file: %s";
    public static final String MSG_SNAPSHOT_KEY_COLUMN_MISSING = "Key column %s not found in snapshot file: %s";
    public static final String MSG_SNAPSHOT_DIR_LIST_FAILED = "Unable to list snapshot directory: %s";
    public static final String MSG_DIRECTORY_CREATE_FAILED = "Cannot create directory: %s";
    public static final String MSG_CHANGE_LOG_WRITE_FAILED = "Failed to write change log for %s";
    public static final String MSG_CHANGE_LOG_READ_FAILED = "Failed to read change log: %s";
    public static final String MSG_CHANGE_LOG_NOT_FOUND = "Change log not found for %s";
    public static final String MSG_CHANGE_LOG_DELETE_FAILED = "Failed to remove change log artifact: %s";
}
