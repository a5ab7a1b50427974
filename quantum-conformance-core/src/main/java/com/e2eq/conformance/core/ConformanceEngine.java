package com.e2eq.conformance.core;

import com.e2eq.conformance.graph.PolicyEntity;
import com.e2eq.conformance.graph.PolicyGraph;
import io.quarkus.logging.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Applies a {@link ShapeRuleSet} to a policy graph. Evaluation is a pure function of the rule
 * set, the operand registry and the graph: rules in declaration order, focus entities in graph
 * order, constraints in rule order.
 */
public final class ConformanceEngine {
    private final ShapeRuleSet rules;
    private final OperandRegistry operands;

    public ConformanceEngine(ShapeRuleSet rules, OperandRegistry operands) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.operands = Objects.requireNonNull(operands, "operands");
    }

    public List<Violation> evaluate(PolicyGraph graph) {
        Objects.requireNonNull(graph, "graph");
        List<Violation> out = new ArrayList<>();
        EvaluationContext base = new EvaluationContext(graph, operands, null);
        for (ShapeRule rule : rules.rules()) {
            EvaluationContext ctx = base.forRule(rule.id());
            for (PolicyEntity focus : rule.target().select(graph)) {
                for (RuleConstraint c : rule.constraints()) {
                    out.addAll(c.evaluate(focus, ctx));
                }
            }
        }
        Log.debugf("Evaluated %d shape rules over %d entities: %d violation(s)",
                rules.rules().size(), graph.size(), out.size());
        return Collections.unmodifiableList(out);
    }

    public ViolationReport validate(DocumentContext context, PolicyGraph graph) {
        return ViolationReport.from(context, evaluate(graph));
    }
}
