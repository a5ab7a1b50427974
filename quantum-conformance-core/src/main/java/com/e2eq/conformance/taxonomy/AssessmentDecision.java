package com.e2eq.conformance.taxonomy;

public enum AssessmentDecision {
    APPROVE,
    REJECT,
    NEEDS_INPUT
}
