package com.e2eq.conformance.taxonomy;

import com.e2eq.conformance.exceptions.NoMatchingStrategyException;
import com.e2eq.conformance.io.ConformanceDefaults;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConflictClassifierTest {

    private static ConflictTaxonomy taxonomy;
    private static ConflictClassifier classifier;

    @BeforeAll
    static void load() {
        taxonomy = ConformanceDefaults.taxonomy();
        classifier = new ConflictClassifier(taxonomy);
    }

    @Test
    void testStrategiesAreOrderedByPriority() {
        List<DetectionStrategy> strategies = taxonomy.strategies();
        for (int i = 1; i < strategies.size(); i++) {
            assertTrue(strategies.get(i - 1).priority() < strategies.get(i).priority());
        }
        assertEquals(ConflictType.UNMEASURABLE_TERMS, strategies.get(0).type());
    }

    @Test
    void testUrgentWinsOverLowerPriorityStructuralMatch() {
        ConflictSignal signal = ConflictSignal.builder()
                .keyword("Urgent")
                .fact("dependency_chain", "contains_cycle")
                .build();
        ConflictClassification c = classifier.classify(signal);
        assertEquals(ConflictType.UNMEASURABLE_TERMS, c.type());
        assertEquals(ConflictFamily.VAGUENESS, c.family());
        assertEquals("keyword 'urgent'", c.matchedTrigger());
        assertEquals("vagueness/unmeasurable_terms", c.type().toString());
    }

    @Test
    void testStructuralPatternNeedsEveryKey() {
        ConflictSignal partial = ConflictSignal.builder()
                .fact("narrow_scope", "permitted")
                .fact("broad_scope", "prohibited")
                .build();
        assertTrue(classifier.tryClassify(partial).isEmpty());

        ConflictSignal full = ConflictSignal.builder()
                .fact("narrow_scope", "permitted")
                .fact("broad_scope", "prohibited")
                .fact("containment", true)
                .description("Germany permitted, EU prohibited")
                .build();
        assertEquals(ConflictType.SPATIAL_HIERARCHY, classifier.classify(full).type());
    }

    @Test
    void testBooleanFactsMatchYamlBooleans() {
        ConflictSignal signal = ConflictSignal.builder()
                .fact("overlapping_intervals", true)
                .fact("contradictory_actions", true)
                .build();
        assertEquals(ConflictType.TEMPORAL_OVERLAP, classifier.classify(signal).type());
    }

    @Test
    void testHigherPrecedenceStructuralMatchWins() {
        ConflictSignal signal = ConflictSignal.builder()
                .fact("parent_action", "permitted")
                .fact("child_action", "prohibited")
                .fact("dependency_chain", "contains_cycle")
                .build();
        ConflictClassification c = classifier.classify(signal);
        assertEquals(ConflictType.ACTION_HIERARCHY, c.type());
        assertEquals(RemediationAction.REJECT, c.action());
        assertEquals(ResolutionPrinciple.PROHIBIT_ON_CONFLICT, c.principle());
    }

    @Test
    void testCycleClassifiesAsCircularApproval() {
        ConflictSignal signal = ConflictSignal.builder().fact("dependency_chain", "contains_cycle").build();
        ConflictClassification c = classifier.classify(signal);
        assertEquals(ConflictType.CIRCULAR_APPROVAL, c.type());
        assertEquals(ConflictFamily.DEPENDENCY, c.family());
        assertTrue(c.strategy().requiresGraphAnalysis());
    }

    @Test
    void testNoMatchThrows() {
        ConflictSignal signal = ConflictSignal.builder().keyword("weekly").fact("colour", "blue").build();
        NoMatchingStrategyException ex = assertThrows(NoMatchingStrategyException.class,
                () -> classifier.classify(signal));
        assertSame(signal, ex.getSignal());
        assertTrue(classifier.tryClassify(signal).isEmpty());
    }

    @Test
    void testReorderedPrioritiesChangePrecedence() {
        // Move circular approval ahead of everything else.
        List<DetectionStrategy> reordered = new ArrayList<>();
        for (DetectionStrategy s : taxonomy.strategies()) {
            int priority = s.type() == ConflictType.CIRCULAR_APPROVAL ? 1 : s.priority() + 100;
            reordered.add(new DetectionStrategy(s.type(), priority, s.requiresOntology(), s.requiresGraphAnalysis(),
                    s.keywords(), s.structuralPatterns(), s.principle(), s.defaultAction(), s.riskLevel()));
        }
        ConflictClassifier custom = new ConflictClassifier(new ConflictTaxonomy(2, reordered));
        ConflictSignal signal = ConflictSignal.builder()
                .keyword("urgent")
                .fact("dependency_chain", "contains_cycle")
                .build();
        assertEquals(ConflictType.CIRCULAR_APPROVAL, custom.classify(signal).type());
    }

    @Test
    void testEveryTypeHasAFamily() {
        for (ConflictType t : ConflictType.values()) {
            assertNotNull(t.family(), t.name());
            assertEquals(t, ConflictType.fromKey(t.key()).orElseThrow());
        }
        assertEquals(ConflictFamily.ROLE, ConflictType.PARTY_INCONSISTENCY.family());
    }
}
