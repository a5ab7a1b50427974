package com.e2eq.conformance.taxonomy;

import java.util.List;

/**
 * Aggregate verdict over a set of conflict signals. Unclassified signals are kept apart; they
 * are never folded into a category.
 */
public record PolicyAssessment(AssessmentDecision decision,
                               RiskLevel riskLevel,
                               List<ConflictClassification> findings,
                               List<ConflictSignal> unclassified) {

    public PolicyAssessment {
        findings = List.copyOf(findings);
        unclassified = List.copyOf(unclassified);
    }

    public boolean isApproved() {
        return decision == AssessmentDecision.APPROVE;
    }
}
