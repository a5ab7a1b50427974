package com.e2eq.conformance.core;

import com.e2eq.conformance.graph.PolicyEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Combines sub-constraints.
 * <ul>
 *   <li>AND reports every sub-violation.</li>
 *   <li>OR reports one violation, with its own message, only when no branch holds.</li>
 *   <li>XONE reports one violation when zero or more than one branch holds.</li>
 *   <li>NOT reports one violation when its single branch holds.</li>
 * </ul>
 */
public final class LogicalConstraint implements RuleConstraint {

    public enum Combinator { AND, OR, XONE, NOT }

    private final Combinator combinator;
    private final List<RuleConstraint> branches;
    private final String message;
    private final IssueCategory category;
    private final Severity severity;

    public LogicalConstraint(Combinator combinator, List<RuleConstraint> branches, String message,
                             IssueCategory category, Severity severity) {
        if (branches == null || branches.isEmpty()) {
            throw new IllegalArgumentException(combinator + " requires at least one branch");
        }
        if (combinator == Combinator.NOT && branches.size() != 1) {
            throw new IllegalArgumentException("NOT takes exactly one branch");
        }
        this.combinator = combinator;
        this.branches = List.copyOf(branches);
        this.message = message;
        this.category = category != null ? category : IssueCategory.STRUCTURAL_ERROR;
        this.severity = severity != null ? severity : Severity.VIOLATION;
    }

    public static LogicalConstraint and(List<RuleConstraint> branches) {
        return new LogicalConstraint(Combinator.AND, branches, null, null, null);
    }

    public static LogicalConstraint or(String message, List<RuleConstraint> branches) {
        return new LogicalConstraint(Combinator.OR, branches, message, null, null);
    }

    public static LogicalConstraint xone(String message, List<RuleConstraint> branches) {
        return new LogicalConstraint(Combinator.XONE, branches, message, null, null);
    }

    public static LogicalConstraint not(String message, RuleConstraint branch) {
        return new LogicalConstraint(Combinator.NOT, List.of(branch), message, null, null);
    }

    @Override
    public List<String> paths() {
        List<String> out = new ArrayList<>();
        for (RuleConstraint b : branches) {
            for (String p : b.paths()) {
                if (!out.contains(p)) out.add(p);
            }
        }
        return out;
    }

    @Override
    public List<Violation> evaluate(PolicyEntity focus, EvaluationContext ctx) {
        switch (combinator) {
            case AND: {
                List<Violation> out = new ArrayList<>();
                for (RuleConstraint b : branches) {
                    out.addAll(b.evaluate(focus, ctx));
                }
                return out;
            }
            case OR: {
                for (RuleConstraint b : branches) {
                    if (b.holds(focus, ctx)) return List.of();
                }
                return List.of(violation(focus, ctx, Violation.NOT_SPECIFIED,
                        "None of the alternatives holds: " + String.join(" | ", paths())));
            }
            case XONE: {
                int holding = 0;
                for (RuleConstraint b : branches) {
                    if (b.holds(focus, ctx)) holding++;
                }
                if (holding == 1) return List.of();
                String observed = holding == 0 ? Violation.NOT_SPECIFIED : holding + " alternatives present";
                return List.of(violation(focus, ctx, observed,
                        "Exactly one of " + String.join(" | ", paths()) + " must hold, found " + holding));
            }
            default: {
                if (!branches.get(0).holds(focus, ctx)) return List.of();
                return List.of(violation(focus, ctx, Violation.NOT_SPECIFIED,
                        "Forbidden shape matched: " + String.join(" | ", paths())));
            }
        }
    }

    private Violation violation(PolicyEntity focus, EvaluationContext ctx, String observed, String defaultExplanation) {
        String shownPath = String.join(" | ", paths());
        String explanation = message != null
                ? MessageTemplate.render(message, Map.of("path", shownPath, "value", observed))
                : defaultExplanation;
        return new Violation(category, focus.id().display(), shownPath, observed, explanation, severity, ctx.ruleId());
    }

    @Override
    public String toString() {
        return combinator + branches.toString();
    }
}
