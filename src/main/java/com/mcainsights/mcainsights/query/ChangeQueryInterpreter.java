package com.mcainsights.mcainsights.query;

import com.mcainsights.mcainsights.changelog.ChangeHistoryReader;
import com.mcainsights.mcainsights.diff.ChangeKind;
import com.mcainsights.mcainsights.diff.ChangeRecord;
import com.mcainsights.mcainsights.snapshot.AttributeRecord;
import com.mcainsights.mcainsights.snapshot.Snapshot;
import com.mcainsights.mcainsights.snapshot.SnapshotReader;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Executes {@link ChangeQuery} commands against the recorded change history and the snapshot series.
 * Read-only: it never writes history and never calls the diff engine.
 */
@Service
public class ChangeQueryInterpreter {

    private final ChangeHistoryReader changeHistory;
    private final SnapshotReader snapshots;
    private final ChangeQueryParser parser;

    public ChangeQueryInterpreter(ChangeHistoryReader changeHistory, SnapshotReader snapshots, ChangeQueryParser parser) {
        this.changeHistory = changeHistory;
        this.snapshots = snapshots;
        this.parser = parser;
    }

    /**
     * Parses free text and answers it.
     */
    public QueryAnswer ask(String text) {
        return execute(parser.parse(text));
    }

    public QueryAnswer execute(ChangeQuery query) {
        if (query instanceof ChangeQuery.NewIncorporations q) {
            return changesOfKind(q, ChangeKind.NEW, q.state(), q.date(), "new incorporations");
        }
        if (query instanceof ChangeQuery.Deregistrations q) {
            return changesOfKind(q, ChangeKind.REMOVED, q.state(), q.date(), "deregistrations");
        }
        if (query instanceof ChangeQuery.FieldUpdates q) {
            return fieldUpdates(q);
        }
        if (query instanceof ChangeQuery.EntityHistory q) {
            return entityHistory(q);
        }
        if (query instanceof ChangeQuery.EntityProfile q) {
            return entityProfile(q);
        }
        if (query instanceof ChangeQuery.ChangeCounts q) {
            return changeCounts(q);
        }
        throw new IllegalArgumentException("Unsupported query: " + query);
    }

    private QueryAnswer changesOfKind(ChangeQuery query, ChangeKind kind, String state, LocalDate date, String label) {
        Optional<LocalDate> runDate = resolveRunDate(date);
        if (runDate.isEmpty()) {
            return QueryAnswer.of(query, "No change data available.");
        }

        List<ChangeRecord> matches = new ArrayList<>();
        for (ChangeRecord record : changeHistory.findByDetectionDate(runDate.get())) {
            if (record.kind() == kind && (state == null || state.equalsIgnoreCase(record.state()))) {
                matches.add(record);
            }
        }
        String where = state == null ? "" : " in " + state;
        String summary = "Found %d %s%s on %s.".formatted(matches.size(), label, where, runDate.get());
        return new QueryAnswer(query, summary, matches, Map.of());
    }

    private QueryAnswer fieldUpdates(ChangeQuery.FieldUpdates query) {
        Optional<LocalDate> runDate = resolveRunDate(query.date());
        if (runDate.isEmpty()) {
            return QueryAnswer.of(query, "No change data available.");
        }

        List<ChangeRecord> matches = new ArrayList<>();
        for (ChangeRecord record : changeHistory.findByDetectionDate(runDate.get())) {
            if (record.kind() == ChangeKind.FIELD_UPDATE
                    && (query.fieldName() == null || query.fieldName().equals(record.fieldName()))) {
                matches.add(record);
            }
        }
        String field = query.fieldName() == null ? "" : " to " + query.fieldName();
        String summary = "Found %d field updates%s on %s.".formatted(matches.size(), field, runDate.get());
        return new QueryAnswer(query, summary, matches, Map.of());
    }

    private QueryAnswer entityHistory(ChangeQuery.EntityHistory query) {
        List<ChangeRecord> matches = changeHistory.findByEntityKey(query.entityKey());
        if (matches.isEmpty()) {
            return QueryAnswer.of(query, "No recorded changes for " + query.entityKey() + ".");
        }
        String summary = "Found %d changes for %s between %s and %s.".formatted(
                matches.size(), query.entityKey(),
                matches.get(0).detectionDate(), matches.get(matches.size() - 1).detectionDate());
        return new QueryAnswer(query, summary, matches, Map.of());
    }

    private QueryAnswer entityProfile(ChangeQuery.EntityProfile query) {
        List<LocalDate> dates = snapshots.captureDates();
        if (dates.isEmpty()) {
            return QueryAnswer.of(query, "No snapshots available.");
        }
        Snapshot latest = snapshots.asOf(dates.get(dates.size() - 1));
        AttributeRecord record = latest.record(query.entityKey());
        if (record == null) {
            return QueryAnswer.of(query, "%s is not present in the snapshot of %s.".formatted(query.entityKey(), latest.captureDate()));
        }
        Map<String, String> details = new LinkedHashMap<>();
        record.values().forEach((field, value) -> details.put(field, value == null ? "" : value));
        String summary = "%s as of %s.".formatted(query.entityKey(), latest.captureDate());
        return new QueryAnswer(query, summary, List.of(), details);
    }

    private QueryAnswer changeCounts(ChangeQuery.ChangeCounts query) {
        Optional<LocalDate> runDate = resolveRunDate(query.date());
        if (runDate.isEmpty()) {
            return QueryAnswer.of(query, "No change data available.");
        }

        List<ChangeRecord> records = changeHistory.findByDetectionDate(runDate.get());
        Map<ChangeKind, Integer> byKind = new LinkedHashMap<>();
        for (ChangeKind kind : ChangeKind.values()) {
            byKind.put(kind, 0);
        }
        Map<String, Integer> byField = new TreeMap<>();
        for (ChangeRecord record : records) {
            byKind.merge(record.kind(), 1, Integer::sum);
            if (record.kind() == ChangeKind.FIELD_UPDATE) {
                byField.merge(record.fieldName(), 1, Integer::sum);
            }
        }

        Map<String, String> details = new LinkedHashMap<>();
        byKind.forEach((kind, count) -> details.put(kind.logName(), String.valueOf(count)));
        byField.forEach((field, count) -> details.put(field, String.valueOf(count)));
        String summary = "%s: %d new incorporations, %d deregistrations, %d field updates (%d total).".formatted(
                runDate.get(), byKind.get(ChangeKind.NEW), byKind.get(ChangeKind.REMOVED),
                byKind.get(ChangeKind.FIELD_UPDATE), records.size());
        return new QueryAnswer(query, summary, List.of(), details);
    }

    private Optional<LocalDate> resolveRunDate(LocalDate requested) {
        return requested != null ? Optional.of(requested) : changeHistory.latestDetectionDate();
    }
}
