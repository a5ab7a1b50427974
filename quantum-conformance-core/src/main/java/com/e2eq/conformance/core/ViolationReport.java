package com.e2eq.conformance.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one validation pass. Validity is derived from the violation list and never stored.
 */
public final class ViolationReport {
    private final DocumentContext context;
    private final List<Violation> violations;

    private ViolationReport(DocumentContext context, List<Violation> violations) {
        this.context = Objects.requireNonNull(context, "context");
        this.violations = List.copyOf(violations);
    }

    public static ViolationReport from(DocumentContext context, List<Violation> violations) {
        return new ViolationReport(context, violations == null ? List.of() : violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public int size() {
        return violations.size();
    }

    /** Violations grouped by category, categories in order of first appearance. */
    public Map<IssueCategory, List<Violation>> groupByCategory() {
        Map<IssueCategory, List<Violation>> groups = new LinkedHashMap<>();
        for (Violation v : violations) {
            groups.computeIfAbsent(v.category(), k -> new ArrayList<>()).add(v);
        }
        groups.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return Collections.unmodifiableMap(groups);
    }

    public Map<IssueCategory, Integer> countByCategory() {
        Map<IssueCategory, Integer> counts = new LinkedHashMap<>();
        for (Violation v : violations) {
            counts.merge(v.category(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Structured feedback for the regeneration step: the original request, the candidate
     * document and every violation grouped by category.
     */
    public String renderFeedback() {
        List<String> lines = new ArrayList<>();
        lines.add("# Policy Validation Report");
        lines.add("");
        lines.add("## Original User Request");
        lines.add("\"" + context.requestText() + "\"");
        lines.add("");
        lines.add("## Generated Knowledge Graph");
        lines.add("```turtle");
        lines.add(context.documentText().strip());
        lines.add("```");
        lines.add("");
        lines.add("## Validation Results");
        if (isValid()) {
            lines.add("**Status**: VALID");
            lines.add("");
            lines.add("The generated knowledge graph conforms to all validation rules.");
            return String.join("\n", lines);
        }
        lines.add("**Status**: INVALID - " + violations.size() + " issue(s) detected");
        lines.add("");
        for (Map.Entry<IssueCategory, List<Violation>> group : groupByCategory().entrySet()) {
            lines.add("### " + group.getKey().title());
            int i = 1;
            for (Violation v : group.getValue()) {
                lines.add(i++ + ". **Node**: `" + v.focusNode() + "`");
                lines.add("   **Property**: `" + v.propertyPath() + "`");
                lines.add("   **Current Value**: `" + v.observedValue() + "`");
                lines.add("   **Constraint Violated**: " + v.explanation());
                if (v.severity() != Severity.VIOLATION) {
                    lines.add("   **Severity**: " + v.severity().label());
                }
                lines.add("");
            }
        }
        lines.add("## Learning Notes");
        lines.add("The above issues indicate where the knowledge graph does not conform to the policy vocabulary.");
        lines.add("Review the constraint violations to understand what corrections are needed.");
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return "ViolationReport{valid=" + isValid() + ", violations=" + violations.size() + "}";
    }
}
