package com.mcainsights.mcainsights.config;

import com.mcainsights.mcainsights.common.ChangeDetectionConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Externalized change detection configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "mca")
public class ChangeDetectionProperties {

    private String snapshotDir = ChangeDetectionConstants.DEFAULT_SNAPSHOT_DIR;
    private String changeLogDir = ChangeDetectionConstants.DEFAULT_CHANGE_LOG_DIR;
    private String keyField = ChangeDetectionConstants.DEFAULT_KEY_FIELD;
    private List<String> trackedFields = new ArrayList<>(ChangeDetectionConstants.DEFAULT_TRACKED_FIELDS);
    private String nameField = ChangeDetectionConstants.DEFAULT_NAME_FIELD;
    private String stateField = ChangeDetectionConstants.DEFAULT_STATE_FIELD;
    private String statusField = ChangeDetectionConstants.DEFAULT_STATUS_FIELD;
    private List<String> upperCaseFields = new ArrayList<>(ChangeDetectionConstants.DEFAULT_UPPER_CASE_FIELDS);
    private List<String> numericFields = new ArrayList<>(ChangeDetectionConstants.DEFAULT_NUMERIC_FIELDS);
    private List<String> nullTokens = new ArrayList<>(ChangeDetectionConstants.DEFAULT_NULL_TOKENS);
    private List<String> knownStates = new ArrayList<>(ChangeDetectionConstants.DEFAULT_KNOWN_STATES);
    private int parallelThreshold = ChangeDetectionConstants.DEFAULT_PARALLEL_THRESHOLD;
    private int shardSize = ChangeDetectionConstants.DEFAULT_SHARD_SIZE;
    private String cron = ChangeDetectionConstants.DEFAULT_CRON;

    public String getSnapshotDir() {
        return snapshotDir;
    }

    public void setSnapshotDir(String snapshotDir) {
        this.snapshotDir = snapshotDir;
    }

    public String getChangeLogDir() {
        return changeLogDir;
    }

    public void setChangeLogDir(String changeLogDir) {
        this.changeLogDir = changeLogDir;
    }

    public String getKeyField() {
        return keyField;
    }

    public void setKeyField(String keyField) {
        this.keyField = keyField;
    }

    public List<String> getTrackedFields() {
        return trackedFields;
    }

    public void setTrackedFields(List<String> trackedFields) {
        this.trackedFields = trackedFields;
    }

    public String getNameField() {
        return nameField;
    }

    public void setNameField(String nameField) {
        this.nameField = nameField;
    }

    public String getStateField() {
        return stateField;
    }

    public void setStateField(String stateField) {
        this.stateField = stateField;
    }

    public String getStatusField() {
        return statusField;
    }

    public void setStatusField(String statusField) {
        this.statusField = statusField;
    }

    public List<String> getUpperCaseFields() {
        return upperCaseFields;
    }

    public void setUpperCaseFields(List<String> upperCaseFields) {
        this.upperCaseFields = upperCaseFields;
    }

    public List<String> getNumericFields() {
        return numericFields;
    }

    public void setNumericFields(List<String> numericFields) {
        this.numericFields = numericFields;
    }

    public List<String> getNullTokens() {
        return nullTokens;
    }

    public void setNullTokens(List<String> nullTokens) {
        this.nullTokens = nullTokens;
    }

    public List<String> getKnownStates() {
        return knownStates;
    }

    public void setKnownStates(List<String> knownStates) {
        this.knownStates = knownStates;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public void setParallelThreshold(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
    }

    public int getShardSize() {
        return shardSize;
    }

    public void setShardSize(int shardSize) {
        this.shardSize = shardSize;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }
}
