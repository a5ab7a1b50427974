package com.e2eq.conformance.taxonomy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * How one conflict type is recognized and what to do about it. Lower priority values are
 * evaluated first.
 */
public record DetectionStrategy(ConflictType type,
                                int priority,
                                boolean requiresOntology,
                                boolean requiresGraphAnalysis,
                                Set<String> keywords,
                                List<Map<String, String>> structuralPatterns,
                                ResolutionPrinciple principle,
                                RemediationAction defaultAction,
                                RiskLevel riskLevel) {

    public DetectionStrategy {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(principle, "principle");
        Objects.requireNonNull(defaultAction, "defaultAction");
        riskLevel = riskLevel != null ? riskLevel : RiskLevel.HIGH;
        Set<String> kw = new LinkedHashSet<>();
        if (keywords != null) {
            for (String k : keywords) {
                String n = ConflictSignal.normalize(k);
                if (!n.isEmpty()) kw.add(n);
            }
        }
        keywords = Collections.unmodifiableSet(kw);
        structuralPatterns = structuralPatterns == null ? List.of() : structuralPatterns.stream()
                .map(DetectionStrategy::normalizePattern)
                .toList();
    }

    private static Map<String, String> normalizePattern(Map<String, String> pattern) {
        Map<String, String> out = new LinkedHashMap<>();
        pattern.forEach((k, v) -> out.put(ConflictSignal.normalize(k), ConflictSignal.normalize(v)));
        return Collections.unmodifiableMap(out);
    }

    public boolean hasTriggers() {
        return !keywords.isEmpty() || !structuralPatterns.isEmpty();
    }

    /** First trigger satisfied by the signal, described for explanations, or null. */
    public String matchedTrigger(ConflictSignal signal) {
        for (String k : signal.keywords()) {
            if (keywords.contains(k)) return "keyword '" + k + "'";
        }
        for (Map<String, String> pattern : structuralPatterns) {
            if (!pattern.isEmpty() && matches(pattern, signal.facts())) {
                return "pattern " + pattern;
            }
        }
        return null;
    }

    public boolean matches(ConflictSignal signal) {
        return matchedTrigger(signal) != null;
    }

    private static boolean matches(Map<String, String> pattern, Map<String, String> facts) {
        for (Map.Entry<String, String> e : pattern.entrySet()) {
            if (!e.getValue().equals(facts.get(e.getKey()))) return false;
        }
        return true;
    }
}
