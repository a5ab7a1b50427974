package com.e2eq.conformance.taxonomy;

import io.quarkus.logging.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a batch of conflict signals into a decision. Any reject finding rejects the policy;
 * otherwise clarify findings or unclassified signals ask for input; warnings alone approve.
 */
public final class ConflictAssessor {
    private final ConflictClassifier classifier;

    public ConflictAssessor(ConflictClassifier classifier) {
        this.classifier = classifier;
    }

    public PolicyAssessment assess(List<ConflictSignal> signals) {
        List<ConflictClassification> findings = new ArrayList<>();
        List<ConflictSignal> unclassified = new ArrayList<>();
        for (ConflictSignal signal : signals) {
            Optional<ConflictClassification> c = classifier.tryClassify(signal);
            if (c.isPresent()) {
                findings.add(c.get());
            } else {
                unclassified.add(signal);
            }
        }

        boolean reject = findings.stream().anyMatch(f -> f.action() == RemediationAction.REJECT);
        boolean clarify = findings.stream().anyMatch(f -> f.action() == RemediationAction.CLARIFY);
        AssessmentDecision decision = reject ? AssessmentDecision.REJECT
                : (clarify || !unclassified.isEmpty()) ? AssessmentDecision.NEEDS_INPUT
                : AssessmentDecision.APPROVE;

        RiskLevel risk = RiskLevel.LOW;
        for (ConflictClassification f : findings) {
            risk = risk.max(f.strategy().riskLevel());
        }
        if (!unclassified.isEmpty()) {
            risk = risk.max(RiskLevel.MEDIUM);
            Log.warnf("%d conflict signal(s) could not be classified", unclassified.size());
        }
        Log.infof("Assessed %d signal(s): decision=%s risk=%s", signals.size(), decision, risk);
        return new PolicyAssessment(decision, risk, findings, unclassified);
    }
}
