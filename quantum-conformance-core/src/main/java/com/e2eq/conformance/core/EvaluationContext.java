package com.e2eq.conformance.core;

import com.e2eq.conformance.graph.PolicyGraph;

/**
 * Everything a constraint may consult while evaluating: the graph being checked, the operand
 * table and the id of the rule currently applied.
 */
public record EvaluationContext(PolicyGraph graph, OperandRegistry operands, String ruleId) {

    EvaluationContext forRule(String id) {
        return new EvaluationContext(graph, operands, id);
    }
}
