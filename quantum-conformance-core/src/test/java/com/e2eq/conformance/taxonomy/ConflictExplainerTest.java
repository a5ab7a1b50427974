package com.e2eq.conformance.taxonomy;

import com.e2eq.conformance.io.ConformanceDefaults;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConflictExplainerTest {

    private final ConflictTaxonomy taxonomy = ConformanceDefaults.taxonomy();
    private final ConflictExplainer explainer = new ConflictExplainer(taxonomy);

    @Test
    void testPriorityBands() {
        assertEquals("CRITICAL", ConflictExplainer.priorityBand(1));
        assertEquals("CRITICAL", ConflictExplainer.priorityBand(2));
        assertEquals("High", ConflictExplainer.priorityBand(5));
        assertEquals("Standard", ConflictExplainer.priorityBand(6));
    }

    @Test
    void testKeywordStrategyExplanation() {
        String text = explainer.explain(ConflictType.UNMEASURABLE_TERMS);
        assertTrue(text.startsWith("## Unmeasurable Terms"), text);
        assertTrue(text.contains("**Detection Order:** 1 (Priority: CRITICAL)"), text);
        assertTrue(text.contains("urgent, soon"), text);
        assertTrue(text.contains("**Resolution Principle:** reject-with-measurable-alternative"), text);
        assertTrue(ConflictExplainer.exampleFor(ConflictType.UNMEASURABLE_TERMS).isPresent());
    }

    @Test
    void testStructuralStrategyExplanation() {
        String text = explainer.explain(ConflictType.TEMPORAL_EXPIRED);
        assertTrue(text.contains("N/A - structural patterns only"), text);
        assertTrue(text.contains("(Priority: High)"), text);
    }

    @Test
    void testClassificationExplanationNamesTrigger() {
        ConflictClassification c = new ConflictClassifier(taxonomy).classify(ConflictSignal.ofKeywords("soon"));
        String text = explainer.explain(c);
        assertTrue(text.contains("**Matched:** keyword 'soon'"), text);
        assertTrue(text.contains("**Default Action:** reject"), text);
    }
}
