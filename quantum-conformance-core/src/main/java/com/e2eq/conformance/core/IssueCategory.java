package com.e2eq.conformance.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed vocabulary for the kind of problem a violation describes.
 */
public enum IssueCategory {
    MISSING_REQUIRED_FIELD("missing-required-field", "Missing Required Field"),
    INVALID_ENUMERATED_VALUE("invalid-enumerated-value", "Invalid Enumerated Value"),
    CARDINALITY_VIOLATION("cardinality-violation", "Cardinality Violation"),
    INCOMPATIBLE_OPERAND_OPERATOR("incompatible-operand-operator", "Operator Compatibility"),
    STRUCTURAL_ERROR("structural-error", "Structural Error");

    private final String key;
    private final String title;

    IssueCategory(String key, String title) {
        this.key = key;
        this.title = title;
    }

    public String key() {
        return key;
    }

    /** Heading used when violations are grouped in feedback text. */
    public String title() {
        return title;
    }

    public static Optional<IssueCategory> fromKey(String key) {
        if (key == null) return Optional.empty();
        String k = key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values()).filter(c -> c.key.equals(k)).findFirst();
    }
}
