package com.mcainsights.mcainsights.changelog;

import com.mcainsights.mcainsights.common.ChangeDetectionConstants;
import com.mcainsights.mcainsights.diff.ChangeKind;
import com.mcainsights.mcainsights.diff.ChangeRecord;
import com.mcainsights.mcainsights.diff.ChangeSet;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cumulative, append-only change history stored in two tables: one row per run and one row per change record.
 * A run is appended in a single transaction so readers never observe a partial run.
 */
@Component
public class ChangeHistoryRepository implements ChangeHistoryReader {

    private static final Logger log = LoggerFactory.getLogger(ChangeHistoryRepository.class);

    private static final String SELECT_RECORDS = """
            SELECT entity_key, change_type, field_changed, old_value, new_value,
                   detection_date, entity_name, state, status
            FROM __HISTORY_TABLE__
            """.replace("__HISTORY_TABLE__", ChangeDetectionConstants.TABLE_CHANGE_HISTORY);

    private static final String HISTORY_ORDER = " ORDER BY detection_date, seq";

    private static final int[] HISTORY_ARG_TYPES = {
            Types.DATE, Types.INTEGER, Types.VARCHAR, Types.VARCHAR, Types.VARCHAR,
            Types.VARCHAR, Types.VARCHAR, Types.VARCHAR, Types.VARCHAR, Types.VARCHAR
    };

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public ChangeHistoryRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Creates the history tables at startup so the schema exists before the first run.
     */
    @PostConstruct
    public void initializeSchema() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS __RUN_TABLE__ (
                    detection_date DATE PRIMARY KEY,
                    previous_date DATE,
                    total_changes INTEGER NOT NULL,
                    new_incorporations INTEGER NOT NULL,
                    deregistrations INTEGER NOT NULL,
                    field_updates INTEGER NOT NULL,
                    recorded_at BIGINT NOT NULL
                )
                """.replace("__RUN_TABLE__", ChangeDetectionConstants.TABLE_CHANGE_RUN));
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS __HISTORY_TABLE__ (
                    detection_date DATE NOT NULL,
                    seq INTEGER NOT NULL,
                    entity_key VARCHAR NOT NULL,
                    change_type VARCHAR(32) NOT NULL,
                    field_changed VARCHAR(128),
                    old_value VARCHAR,
                    new_value VARCHAR,
                    entity_name VARCHAR,
                    state VARCHAR(128),
                    status VARCHAR(128),
                    PRIMARY KEY (detection_date, seq)
                )
                """.replace("__HISTORY_TABLE__", ChangeDetectionConstants.TABLE_CHANGE_HISTORY));
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_change_history_entity_key ON "
                + ChangeDetectionConstants.TABLE_CHANGE_HISTORY + "(entity_key)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_change_history_change_type ON "
                + ChangeDetectionConstants.TABLE_CHANGE_HISTORY + "(change_type)");
    }

    /**
     * Appends one run, keeping the change set's own record order.
     *
     * @throws DuplicateRunException when the detection date is already in history
     */
    public void append(ChangeSet changeSet) {
        LocalDate detectionDate = changeSet.detectionDate();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (hasRun(detectionDate)) {
                    throw new DuplicateRunException(detectionDate);
                }
                insertRun(changeSet);
                insertRecords(changeSet);
            });
        } catch (DuplicateKeyException ex) {
            throw new DuplicateRunException(detectionDate, ex);
        }
        log.info("Change history appended. date={}, records={}", detectionDate, changeSet.size());
    }

    @Override
    public List<ChangeRecord> findByDetectionDate(LocalDate detectionDate) {
        return jdbcTemplate.query(SELECT_RECORDS + " WHERE detection_date = ?" + HISTORY_ORDER,
                this::mapRecord, Date.valueOf(detectionDate));
    }

    @Override
    public List<ChangeRecord> findByEntityKey(String entityKey) {
        return jdbcTemplate.query(SELECT_RECORDS + " WHERE entity_key = ?" + HISTORY_ORDER,
                this::mapRecord, entityKey);
    }

    @Override
    public List<ChangeRecord> findAll() {
        return jdbcTemplate.query(SELECT_RECORDS + HISTORY_ORDER, this::mapRecord);
    }

    @Override
    public List<ChangeRunSummary> findRuns() {
        String sql = "SELECT detection_date, previous_date, total_changes, new_incorporations, deregistrations,"
                + " field_updates, recorded_at FROM " + ChangeDetectionConstants.TABLE_CHANGE_RUN
                + " ORDER BY detection_date";
        RowMapper<ChangeRunSummary> mapper = (rs, rowNum) -> {
            Date previous = rs.getDate("previous_date");
            return new ChangeRunSummary(
                    rs.getDate("detection_date").toLocalDate(),
                    previous == null ? null : previous.toLocalDate(),
                    rs.getInt("total_changes"),
                    rs.getInt("new_incorporations"),
                    rs.getInt("deregistrations"),
                    rs.getInt("field_updates"),
                    rs.getLong("recorded_at")
            );
        };
        return jdbcTemplate.query(sql, mapper);
    }

    @Override
    public Optional<LocalDate> latestDetectionDate() {
        Date latest = jdbcTemplate.queryForObject(
                "SELECT MAX(detection_date) FROM " + ChangeDetectionConstants.TABLE_CHANGE_RUN, Date.class);
        return latest == null ? Optional.empty() : Optional.of(latest.toLocalDate());
    }

    @Override
    public boolean hasRun(LocalDate detectionDate) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + ChangeDetectionConstants.TABLE_CHANGE_RUN + " WHERE detection_date = ?",
                Integer.class,
                Date.valueOf(detectionDate)
        );
        return count != null && count > 0;
    }

    private void insertRun(ChangeSet changeSet) {
        String sql = "INSERT INTO " + ChangeDetectionConstants.TABLE_CHANGE_RUN
                + " (detection_date, previous_date, total_changes, new_incorporations, deregistrations,"
                + " field_updates, recorded_at) VALUES (?, ?, ?, ?, ?, ?, ?)";
        jdbcTemplate.update(sql,
                Date.valueOf(changeSet.detectionDate()),
                changeSet.previousDate() == null ? null : Date.valueOf(changeSet.previousDate()),
                changeSet.size(),
                changeSet.count(ChangeKind.NEW),
                changeSet.count(ChangeKind.REMOVED),
                changeSet.count(ChangeKind.FIELD_UPDATE),
                System.currentTimeMillis());
    }

    private void insertRecords(ChangeSet changeSet) {
        String sql = "INSERT INTO " + ChangeDetectionConstants.TABLE_CHANGE_HISTORY
                + " (detection_date, seq, entity_key, change_type, field_changed, old_value, new_value,"
                + " entity_name, state, status) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        Date detectionDate = Date.valueOf(changeSet.detectionDate());
        List<Object[]> batch = new ArrayList<>(ChangeDetectionConstants.HISTORY_BATCH_SIZE);
        int seq = 0;
        for (ChangeRecord record : changeSet.records()) {
            batch.add(new Object[]{
                    detectionDate, seq++, record.entityKey(), record.kind().logName(), record.fieldName(),
                    record.oldValue(), record.newValue(), record.entityName(), record.state(), record.status()
            });
            if (batch.size() >= ChangeDetectionConstants.HISTORY_BATCH_SIZE) {
                jdbcTemplate.batchUpdate(sql, batch, HISTORY_ARG_TYPES);
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            jdbcTemplate.batchUpdate(sql, batch, HISTORY_ARG_TYPES);
        }
    }

    private ChangeRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        return new ChangeRecord(
                rs.getString("entity_key"),
                ChangeKind.fromLogName(rs.getString("change_type")),
                rs.getString("field_changed"),
                rs.getString("old_value"),
                rs.getString("new_value"),
                rs.getDate("detection_date").toLocalDate(),
                rs.getString("entity_name"),
                rs.getString("state"),
                rs.getString("status")
        );
    }
}
