package com.e2eq.conformance.taxonomy;

import java.util.Locale;

public enum RemediationAction {
    REJECT,
    CLARIFY,
    WARN;

    public static RemediationAction parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
