package com.mcainsights.mcainsights.snapshot;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical value normalization applied both when a snapshot is built and when two values are compared.
 * Both call sites must go through the same instance, otherwise formatting noise surfaces as field updates.
 */
public final class ValueNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final int MAX_NUMERIC_DIGITS = 30;

    private final Set<String> nullTokens;
    private final Set<String> upperCaseFields;
    private final Set<String> numericFields;

    public ValueNormalizer(Collection<String> nullTokens,
                           Collection<String> upperCaseFields,
                           Collection<String> numericFields) {
        Set<String> tokens = new HashSet<>();
        for (String token : nullTokens) {
            tokens.add(token.trim().toLowerCase(Locale.ROOT));
        }
        this.nullTokens = Set.copyOf(tokens);
        this.upperCaseFields = Set.copyOf(upperCaseFields);
        this.numericFields = Set.copyOf(numericFields);
    }

    /**
     * Normalizer with no field-specific rules: trims, collapses whitespace and maps blanks to null.
     */
    public static ValueNormalizer plain() {
        return new ValueNormalizer(List.of(), List.of(), List.of());
    }

    /**
     * Returns the canonical form of {@code raw} for the given field, or null when the value is missing.
     */
    public String normalize(String field, String raw) {
        if (raw == null) {
            return null;
        }
        String value = WHITESPACE_RUN.matcher(raw.trim()).replaceAll(" ");
        if (value.isEmpty() || nullTokens.contains(value.toLowerCase(Locale.ROOT))) {
            return null;
        }
        if (numericFields.contains(field)) {
            return normalizeNumber(value);
        }
        if (upperCaseFields.contains(field)) {
            return value.toUpperCase(Locale.ROOT);
        }
        return value;
    }

    // Grouping separators are dropped regardless of style, so "1,00,000" and "100,000" both become "100000".
    // Values with more than MAX_NUMERIC_DIGITS integer or fraction digits are not rendered in plain form.
    private String normalizeNumber(String value) {
        String digits = value.replace(",", "").replace(" ", "");
        BigDecimal number;
        try {
            number = new BigDecimal(digits);
        } catch (NumberFormatException ex) {
            return value;
        }
        if (number.signum() == 0) {
            return "0";
        }
        BigDecimal stripped = number.stripTrailingZeros();
        long integerDigits = (long) stripped.precision() - stripped.scale();
        if (integerDigits > MAX_NUMERIC_DIGITS || stripped.scale() > MAX_NUMERIC_DIGITS) {
            return value;
        }
        return stripped.toPlainString();
    }
}
