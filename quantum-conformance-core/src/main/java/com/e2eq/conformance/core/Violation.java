package com.e2eq.conformance.core;

import java.util.Objects;

/**
 * One failed check against one focus entity. Created fresh on every evaluation pass.
 */
public record Violation(IssueCategory category,
                        String focusNode,
                        String propertyPath,
                        String observedValue,
                        String explanation,
                        Severity severity,
                        String ruleId) {

    public static final String NOT_SPECIFIED = "not specified";

    public Violation {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        focusNode = focusNode == null ? "" : focusNode;
        propertyPath = propertyPath == null ? "" : propertyPath;
        observedValue = observedValue == null || observedValue.isEmpty() ? NOT_SPECIFIED : observedValue;
        explanation = explanation == null ? "" : explanation;
    }
}
