package com.e2eq.conformance.taxonomy;

public enum ConflictFamily {
    VAGUENESS,
    TEMPORAL,
    SPATIAL,
    ACTION,
    DEPENDENCY,
    ROLE
}
