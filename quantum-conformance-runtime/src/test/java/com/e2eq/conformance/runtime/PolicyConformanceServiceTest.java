package com.e2eq.conformance.runtime;

import com.e2eq.conformance.Fixtures;
import com.e2eq.conformance.core.ConformanceEngine;
import com.e2eq.conformance.core.IssueCategory;
import com.e2eq.conformance.core.Severity;
import com.e2eq.conformance.core.Violation;
import com.e2eq.conformance.core.ViolationReport;
import com.e2eq.conformance.exceptions.DocumentParseException;
import com.e2eq.conformance.exceptions.RepairAbortedException;
import com.e2eq.conformance.exceptions.TransducerException;
import com.e2eq.conformance.io.ConformanceDefaults;
import com.e2eq.conformance.repair.CancellationToken;
import com.e2eq.conformance.repair.RepairOrchestrator;
import com.e2eq.conformance.repair.RepairSettings;
import com.e2eq.conformance.repair.RepairState;
import com.e2eq.conformance.spi.PromptPayload;
import com.e2eq.conformance.spi.TextTransducer;
import com.e2eq.conformance.taxonomy.AssessmentDecision;
import com.e2eq.conformance.taxonomy.ConflictAssessor;
import com.e2eq.conformance.taxonomy.ConflictClassifier;
import com.e2eq.conformance.taxonomy.ConflictSignal;
import com.e2eq.conformance.taxonomy.ConflictType;
import com.e2eq.conformance.turtle.TurtleDocumentDecoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyConformanceServiceTest {

    private static final String REQUEST = "Users may use dataset1 at most 10 times.";

    private static ConformanceEngine engine;
    private static ConflictClassifier classifier;

    private final Deque<String> replies = new ArrayDeque<>();
    private final List<PromptPayload> calls = new ArrayList<>();
    private final TextTransducer transducer = payload -> {
        calls.add(payload);
        String next = replies.poll();
        if (next == null) throw new TransducerException("no scripted reply");
        return next;
    };
    private RepairOrchestrator orchestrator;

    @BeforeAll
    static void loadDefaults() {
        engine = ConformanceDefaults.engine();
        classifier = new ConflictClassifier(ConformanceDefaults.taxonomy());
    }

    @AfterEach
    void close() {
        if (orchestrator != null) orchestrator.close();
    }

    private PolicyConformanceService service() {
        TurtleDocumentDecoder decoder = new TurtleDocumentDecoder();
        orchestrator = new RepairOrchestrator(engine, transducer, decoder, RepairSettings.defaults());
        return new PolicyConformanceService(engine, transducer, decoder, orchestrator, classifier,
                new ConflictAssessor(classifier));
    }

    private static String fenced(String fixture) {
        return "Here is the policy:\n```turtle\n" + Fixtures.policy(fixture) + "```\n";
    }

    @Test
    void testGenerateConformantOnFirstPass() {
        replies.add(fenced("valid-policy.ttl"));
        PolicyConformanceService.GenerationResult result = service().generate(REQUEST, "1a2b3c4d", CancellationToken.none());

        assertTrue(result.isConformant());
        assertEquals("1a2b3c4d", result.policyId());
        assertEquals(1, result.outcome().attemptsUsed());
        assertTrue(result.documentText().startsWith("@prefix odrl:"));
        assertEquals(1, calls.size());
        assertEquals(PromptPayload.Kind.GENERATE, calls.get(0).kind());
        assertEquals("1a2b3c4d", calls.get(0).policyId());
        assertEquals(REQUEST, calls.get(0).requestText());
    }

    @Test
    void testGenerateRepairsMissingUid() {
        replies.add(fenced("missing-uid.ttl"));
        replies.add(fenced("valid-policy.ttl"));
        PolicyConformanceService.GenerationResult result = service().generate(REQUEST, "1a2b3c4d", CancellationToken.none());

        assertEquals(RepairState.CONFORMANT, result.outcome().state());
        assertEquals(2, result.outcome().attemptsUsed());
        assertEquals(2, calls.size());
        PromptPayload regeneration = calls.get(1);
        assertEquals(PromptPayload.Kind.REGENERATE, regeneration.kind());
        assertEquals(1, regeneration.attemptIndex());
        assertTrue(regeneration.feedback().contains("odrl:uid"), regeneration.feedback());
        assertTrue(regeneration.documentText().contains("ex:policy_1a2b3c4d a odrl:Policy"));
    }

    @Test
    void testGenerateAssignsRandomHexPolicyId() {
        replies.add(fenced("valid-policy.ttl"));
        PolicyConformanceService.GenerationResult result = service().generate(REQUEST);
        assertTrue(result.policyId().matches("[0-9a-f]{8}"), result.policyId());
        assertEquals(result.policyId(), calls.get(0).policyId());
    }

    @Test
    void testUnparseableFirstOutputPropagates() {
        replies.add("I cannot help with that.");
        assertThrows(DocumentParseException.class, () -> service().generate(REQUEST));
    }

    @Test
    void testRegeneratedOutputWithoutStatementsAbortsSession() {
        replies.add(fenced("missing-uid.ttl"));
        replies.add("Sorry.\n@prefix odrl: <http://www.w3.org/ns/odrl/2/> .");
        PolicyConformanceService service = service();

        RepairAbortedException e = assertThrows(RepairAbortedException.class,
                () -> service.generate(REQUEST, "1a2b3c4d", CancellationToken.none()));
        assertEquals(1, e.getAttemptIndex());
        assertEquals(RepairState.EXHAUSTED_BUDGET, e.getOutcome().state());
        assertFalse(e.getOutcome().isSuccess());
        assertTrue(e.getCause() instanceof DocumentParseException);
        assertEquals(1, e.getLastReport().size());
    }

    @Test
    void testRegeneratedOutputWithoutPolicyAbortsSession() {
        replies.add(fenced("missing-uid.ttl"));
        replies.add("""
                @prefix odrl: <http://www.w3.org/ns/odrl/2/> .
                @prefix ex: <http://example.com/> .
                ex:policy_1a2b3c4d odrl:uid ex:policy_1a2b3c4d .
                """);
        PolicyConformanceService service = service();

        RepairAbortedException e = assertThrows(RepairAbortedException.class,
                () -> service.generate(REQUEST, "1a2b3c4d", CancellationToken.none()));
        assertEquals(RepairState.EXHAUSTED_BUDGET, e.getOutcome().state());
        assertTrue(e.getOutcome().failure().orElseThrow().contains("odrl:Policy"));
    }

    @Test
    void testValidateReportsIncompatibleOperatorAsWarning() {
        ViolationReport report = service().validate(REQUEST, Fixtures.policy("count-is-any-of.ttl"));
        assertFalse(report.isValid());
        assertEquals(1, report.size());
        Violation v = report.getViolations().get(0);
        assertEquals(IssueCategory.INCOMPATIBLE_OPERAND_OPERATOR, v.category());
        assertEquals(Severity.WARNING, v.severity());
        assertEquals("_:b2", v.focusNode());
        assertTrue(calls.isEmpty());
    }

    @Test
    void testValidateMissingUid() {
        ViolationReport report = service().validate(REQUEST, Fixtures.policy("missing-uid.ttl"));
        assertEquals(1, report.size());
        Violation v = report.getViolations().get(0);
        assertEquals(IssueCategory.MISSING_REQUIRED_FIELD, v.category());
        assertEquals("ex:policy_1a2b3c4d", v.focusNode());
        assertEquals("odrl:uid", v.propertyPath());
        assertTrue(report.renderFeedback().contains("**Status**: INVALID - 1 issue(s) detected"));
    }

    @Test
    void testValidPolicyFixtureConforms() {
        ViolationReport report = service().validate(REQUEST, Fixtures.policy("valid-policy.ttl"));
        assertTrue(report.isValid(), report::renderFeedback);
    }

    @Test
    void testClassifyAndAssess() {
        PolicyConformanceService service = service();
        assertEquals(ConflictType.UNMEASURABLE_TERMS, service.classify(ConflictSignal.ofKeywords("urgent")).type());
        assertEquals(AssessmentDecision.APPROVE, service.assess(List.of()).decision());
    }
}
