package com.e2eq.conformance.taxonomy;

/**
 * Outcome of classifying one signal.
 */
public record ConflictClassification(ConflictType type, DetectionStrategy strategy, String matchedTrigger) {

    public ConflictFamily family() {
        return type.family();
    }

    public RemediationAction action() {
        return strategy.defaultAction();
    }

    public ResolutionPrinciple principle() {
        return strategy.principle();
    }
}
