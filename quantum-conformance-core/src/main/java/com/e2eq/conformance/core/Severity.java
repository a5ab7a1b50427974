package com.e2eq.conformance.core;

import java.util.Locale;

public enum Severity {
    VIOLATION("Violation"),
    WARNING("Warning");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Severity parse(String value) {
        if (value == null || value.isBlank()) return VIOLATION;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
