package com.e2eq.conformance.core;

import com.e2eq.conformance.graph.PolicyEntity;

import java.util.List;

/**
 * A check applied to one focus entity. Implementations are immutable and hold no state
 * between calls, so evaluating the same entity twice yields equal results.
 */
public interface RuleConstraint {

    List<Violation> evaluate(PolicyEntity focus, EvaluationContext ctx);

    /** Property paths this constraint inspects, compacted for display. */
    List<String> paths();

    /** True when the constraint produces no violation for the focus entity. */
    default boolean holds(PolicyEntity focus, EvaluationContext ctx) {
        return evaluate(focus, ctx).isEmpty();
    }
}
