package com.mcainsights.mcainsights.query;

import com.mcainsights.mcainsights.diff.ChangeRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answer to one {@link ChangeQuery}: a one-line summary plus the matching changes or entity details.
 */
public record QueryAnswer(ChangeQuery query, String summary, List<ChangeRecord> changes, Map<String, String> details) {

    public QueryAnswer {
        changes = changes == null ? List.of() : List.copyOf(changes);
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    static QueryAnswer of(ChangeQuery query, String summary) {
        return new QueryAnswer(query, summary, List.of(), Map.of());
    }
}
