package com.e2eq.conformance.core;

import com.e2eq.conformance.graph.GraphNode;
import com.e2eq.conformance.graph.OdrlVocabulary;
import com.e2eq.conformance.graph.PolicyEntity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Checks a left-operand / operator pair against the operand registry. Pairs the registry does
 * not cover are reported at the configured severity (warning by default) because operand
 * metadata may be incomplete. Missing operand or operator values are left to cardinality rules.
 */
public final class CompatibilityConstraint implements RuleConstraint {
    private final String leftOperandPath;
    private final String operatorPath;
    private final Severity severity;
    private final String message;

    public CompatibilityConstraint(String leftOperandPath, String operatorPath, Severity severity, String message) {
        this.leftOperandPath = leftOperandPath != null ? leftOperandPath : OdrlVocabulary.LEFT_OPERAND;
        this.operatorPath = operatorPath != null ? operatorPath : OdrlVocabulary.OPERATOR;
        this.severity = severity != null ? severity : Severity.WARNING;
        this.message = message;
    }

    public static CompatibilityConstraint defaults() {
        return new CompatibilityConstraint(null, null, null, null);
    }

    @Override
    public List<String> paths() {
        return List.of(OdrlVocabulary.compact(operatorPath));
    }

    @Override
    public List<Violation> evaluate(PolicyEntity focus, EvaluationContext ctx) {
        List<GraphNode> lefts = focus.values(leftOperandPath);
        List<GraphNode> ops = focus.values(operatorPath);
        if (lefts.isEmpty() || ops.isEmpty()) return List.of();

        List<Violation> out = new ArrayList<>();
        for (GraphNode left : lefts) {
            Optional<Operand> operand = ctx.operands().lookupByIri(left.value());
            String operandName = operand.map(Operand::name).orElse(OdrlVocabulary.localName(left.value()));
            for (GraphNode op : ops) {
                String opName = OdrlVocabulary.localName(op.value());
                Optional<Operator> operator = op.isIri() ? Operator.fromIri(op.value()) : Optional.empty();
                String explanation;
                if (operand.isEmpty()) {
                    explanation = "Operand '" + operandName + "' is not covered by the operand registry; "
                            + "compatibility of operator '" + opName + "' cannot be confirmed";
                } else if (operator.isEmpty() || !operand.get().accepts(operator.get())) {
                    explanation = "Operator '" + opName + "' not compatible with leftOperand '" + operandName
                            + "'. Valid: " + validOperators(operand.get());
                } else {
                    continue;
                }
                if (message != null) {
                    Map<String, String> vars = new HashMap<>();
                    vars.put("operand", operandName);
                    vars.put("operator", opName);
                    vars.put("allowed", operand.map(CompatibilityConstraint::validOperators).orElse(""));
                    explanation = MessageTemplate.render(message, vars);
                }
                out.add(new Violation(IssueCategory.INCOMPATIBLE_OPERAND_OPERATOR, focus.id().display(),
                        OdrlVocabulary.compact(operatorPath), op.display(), explanation, severity, ctx.ruleId()));
            }
        }
        return out;
    }

    private static String validOperators(Operand operand) {
        return operand.compatibleOperators().stream().map(Operator::localName).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return "CompatibilityConstraint[" + OdrlVocabulary.compact(leftOperandPath) + " x "
                + OdrlVocabulary.compact(operatorPath) + "]";
    }
}
