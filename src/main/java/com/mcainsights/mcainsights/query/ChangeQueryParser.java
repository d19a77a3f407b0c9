package com.mcainsights.mcainsights.query;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps free-text questions onto {@link ChangeQuery} commands using keyword rules.
 * Anything unrecognized falls back to change counts for the mentioned (or latest) date.
 */
public class ChangeQueryParser {

    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");
    private static final Pattern ENTITY_KEY = Pattern.compile("\\b([LU]\\d{5}[A-Z]{2}\\d{4}[A-Z]{3}\\d{6})\\b",
            Pattern.CASE_INSENSITIVE);
    private static final List<String> NEW_KEYWORDS = List.of("new incorporation", "incorporated", "new compan");
    private static final List<String> REMOVED_KEYWORDS = List.of("struck off", "strike off", "deregist", "removed");
    private static final List<String> UPDATE_KEYWORDS = List.of("change", "update", "modif");
    private static final List<String> PROFILE_KEYWORDS = List.of("profile", "detail", "current");

    // Longer phrases first so "paid up capital" wins over a bare "capital".
    private static final Map<String, String> FIELD_KEYWORDS = new LinkedHashMap<>();

    static {
        FIELD_KEYWORDS.put("authorized capital", "AUTHORIZED_CAPITAL");
        FIELD_KEYWORDS.put("authorised capital", "AUTHORIZED_CAPITAL");
        FIELD_KEYWORDS.put("paid up capital", "PAIDUP_CAPITAL");
        FIELD_KEYWORDS.put("paid-up capital", "PAIDUP_CAPITAL");
        FIELD_KEYWORDS.put("paidup capital", "PAIDUP_CAPITAL");
        FIELD_KEYWORDS.put("business activity", "PRINCIPAL_BUSINESS_ACTIVITY");
        FIELD_KEYWORDS.put("activity", "PRINCIPAL_BUSINESS_ACTIVITY");
        FIELD_KEYWORDS.put("address", "REGISTERED_OFFICE_ADDRESS");
        FIELD_KEYWORDS.put("status", "COMPANY_STATUS");
        FIELD_KEYWORDS.put("class", "COMPANY_CLASS");
        FIELD_KEYWORDS.put("name", "COMPANY_NAME");
    }

    private final List<String> knownStates;

    public ChangeQueryParser(List<String> knownStates) {
        this.knownStates = List.copyOf(knownStates);
    }

    public ChangeQuery parse(String text) {
        String raw = text == null ? "" : text.trim();
        if (raw.isEmpty()) {
            throw new IllegalArgumentException("Query text is required");
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        LocalDate date = extractDate(raw);

        Matcher keyMatcher = ENTITY_KEY.matcher(raw);
        if (keyMatcher.find()) {
            String entityKey = keyMatcher.group(1).toUpperCase(Locale.ROOT);
            return containsAny(lower, PROFILE_KEYWORDS)
                    ? new ChangeQuery.EntityProfile(entityKey)
                    : new ChangeQuery.EntityHistory(entityKey);
        }
        if (containsAny(lower, NEW_KEYWORDS)) {
            return new ChangeQuery.NewIncorporations(extractState(lower), date);
        }
        if (containsAny(lower, REMOVED_KEYWORDS)) {
            return new ChangeQuery.Deregistrations(extractState(lower), date);
        }
        if (containsAny(lower, UPDATE_KEYWORDS)) {
            return new ChangeQuery.FieldUpdates(extractField(lower), date);
        }
        return new ChangeQuery.ChangeCounts(date);
    }

    private LocalDate extractDate(String raw) {
        Matcher matcher = ISO_DATE.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return LocalDate.parse(matcher.group(1));
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid date in query: " + matcher.group(1), ex);
        }
    }

    private String extractState(String lower) {
        for (String state : knownStates) {
            if (lower.contains(state.toLowerCase(Locale.ROOT))) {
                return state;
            }
        }
        return null;
    }

    private String extractField(String lower) {
        for (Map.Entry<String, String> entry : FIELD_KEYWORDS.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private boolean containsAny(String lower, List<String> keywords) {
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
