package com.e2eq.conformance.taxonomy;

import java.util.Locale;

/**
 * Ordered from least to most severe.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public RiskLevel max(RiskLevel other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
