package com.e2eq.conformance.taxonomy;

import com.e2eq.conformance.io.ConformanceDefaults;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConflictAssessorTest {

    private static ConflictAssessor assessor;

    @BeforeAll
    static void load() {
        assessor = new ConflictAssessor(new ConflictClassifier(ConformanceDefaults.taxonomy()));
    }

    @Test
    void testNoSignalsApproves() {
        PolicyAssessment a = assessor.assess(List.of());
        assertEquals(AssessmentDecision.APPROVE, a.decision());
        assertEquals(RiskLevel.LOW, a.riskLevel());
        assertTrue(a.isApproved());
    }

    @Test
    void testRejectFindingWins() {
        PolicyAssessment a = assessor.assess(List.of(
                ConflictSignal.builder().fact("overlapping_regions", true).fact("contradictory_actions", true).build(),
                ConflictSignal.ofKeywords("everything")));
        assertEquals(AssessmentDecision.REJECT, a.decision());
        assertEquals(RiskLevel.CRITICAL, a.riskLevel());
        assertEquals(2, a.findings().size());
        assertEquals(ConflictType.SPATIAL_OVERLAP, a.findings().get(0).type());
        assertEquals(ConflictType.OVERLY_BROAD, a.findings().get(1).type());
    }

    @Test
    void testClarifyFindingNeedsInput() {
        PolicyAssessment a = assessor.assess(List.of(
                ConflictSignal.builder().fact("assigner_is_assignee", true).build()));
        assertEquals(AssessmentDecision.NEEDS_INPUT, a.decision());
        assertEquals(RiskLevel.MEDIUM, a.riskLevel());
    }

    @Test
    void testUnclassifiedSignalIsKeptApart() {
        ConflictSignal unknown = ConflictSignal.ofKeywords("quarterly");
        PolicyAssessment a = assessor.assess(List.of(unknown));
        assertEquals(AssessmentDecision.NEEDS_INPUT, a.decision());
        assertEquals(List.of(unknown), a.unclassified());
        assertTrue(a.findings().isEmpty());
        assertEquals(RiskLevel.MEDIUM, a.riskLevel());
    }

    @Test
    void testWarnOnlyApproves() {
        PolicyAssessment a = assessor.assess(List.of(
                ConflictSignal.builder().fact("action_subsumption", true).build()));
        assertEquals(AssessmentDecision.APPROVE, a.decision());
        assertEquals(RemediationAction.WARN, a.findings().get(0).action());
        assertEquals(RiskLevel.MEDIUM, a.riskLevel());
    }
}
