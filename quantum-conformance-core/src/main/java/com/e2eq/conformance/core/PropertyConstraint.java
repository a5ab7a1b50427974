package com.e2eq.conformance.core;

import com.e2eq.conformance.graph.GraphNode;
import com.e2eq.conformance.graph.OdrlVocabulary;
import com.e2eq.conformance.graph.PolicyEntity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cardinality, node kind, datatype and allowed-value checks over the values of one property.
 * Message templates may use {@code {path}}, {@code {value}}, {@code {min}}, {@code {max}},
 * {@code {count}} and {@code {allowed}}.
 */
public final class PropertyConstraint implements RuleConstraint {
    private final String path;
    private final Integer minCount;
    private final Integer maxCount;
    private final NodeKind nodeKind;
    private final String datatype;
    private final Set<String> allowedValues;
    private final String message;
    private final IssueCategory category;
    private final Severity severity;

    private PropertyConstraint(Builder b) {
        this.path = b.path;
        this.minCount = b.minCount;
        this.maxCount = b.maxCount;
        this.nodeKind = b.nodeKind;
        this.datatype = b.datatype;
        this.allowedValues = b.allowedValues == null ? null
                : Collections.unmodifiableSet(new LinkedHashSet<>(b.allowedValues));
        this.message = b.message;
        this.category = b.category;
        this.severity = b.severity != null ? b.severity : Severity.VIOLATION;
    }

    public static Builder path(String path) {
        return new Builder(path);
    }

    @Override
    public List<String> paths() {
        return List.of(OdrlVocabulary.compact(path));
    }

    @Override
    public List<Violation> evaluate(PolicyEntity focus, EvaluationContext ctx) {
        List<GraphNode> values = focus.values(path);
        List<Violation> out = new ArrayList<>();
        String focusId = focus.id().display();
        String shownPath = OdrlVocabulary.compact(path);

        if (minCount != null && values.size() < minCount) {
            IssueCategory c = values.isEmpty() ? IssueCategory.MISSING_REQUIRED_FIELD : IssueCategory.CARDINALITY_VIOLATION;
            String observed = values.isEmpty() ? Violation.NOT_SPECIFIED : join(values);
            out.add(violation(c, focusId, shownPath, observed, ctx,
                    "Expected at least " + minCount + " value(s) for " + shownPath + " but found " + values.size()));
        }
        if (maxCount != null && values.size() > maxCount) {
            out.add(violation(IssueCategory.CARDINALITY_VIOLATION, focusId, shownPath, join(values), ctx,
                    "Expected at most " + maxCount + " value(s) for " + shownPath + " but found " + values.size()));
        }
        for (GraphNode v : values) {
            if (nodeKind != null && !nodeKind.matches(v)) {
                out.add(violation(IssueCategory.STRUCTURAL_ERROR, focusId, shownPath, v.display(), ctx,
                        "Value of " + shownPath + " must be a " + nodeKind.label()));
            }
            if (datatype != null && !hasDatatype(v)) {
                out.add(violation(IssueCategory.STRUCTURAL_ERROR, focusId, shownPath, v.display(), ctx,
                        "Value of " + shownPath + " must be a literal of type " + OdrlVocabulary.compact(datatype)));
            }
            if (allowedValues != null && !allowedValues.contains(v.value())) {
                out.add(violation(IssueCategory.INVALID_ENUMERATED_VALUE, focusId, shownPath, v.display(), ctx,
                        "Value '" + shortName(v) + "' of " + shownPath + " is not allowed. Valid: " + allowedList()));
            }
        }
        return out;
    }

    private boolean hasDatatype(GraphNode v) {
        if (!v.isLiteral()) return false;
        String dt = v.datatype() != null ? v.datatype() : OdrlVocabulary.XSD + "string";
        return dt.equals(datatype);
    }

    private Violation violation(IssueCategory defaultCategory, String focus, String shownPath, String observed,
                                EvaluationContext ctx, String defaultExplanation) {
        String explanation = defaultExplanation;
        if (message != null) {
            Map<String, String> vars = new HashMap<>();
            vars.put("path", shownPath);
            vars.put("value", observed);
            vars.put("min", String.valueOf(minCount));
            vars.put("max", String.valueOf(maxCount));
            vars.put("allowed", allowedList());
            explanation = MessageTemplate.render(message, vars);
        }
        return new Violation(category != null ? category : defaultCategory, focus, shownPath, observed,
                explanation, severity, ctx.ruleId());
    }

    private String allowedList() {
        if (allowedValues == null) return "";
        return allowedValues.stream().map(OdrlVocabulary::localName).collect(Collectors.joining(", "));
    }

    private static String shortName(GraphNode v) {
        return v.isIri() ? OdrlVocabulary.localName(v.value()) : v.value();
    }

    private static String join(List<GraphNode> values) {
        return values.stream().map(GraphNode::display).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return "PropertyConstraint[" + OdrlVocabulary.compact(path) + "]";
    }

    public static final class Builder {
        private final String path;
        private Integer minCount;
        private Integer maxCount;
        private NodeKind nodeKind;
        private String datatype;
        private Set<String> allowedValues;
        private String message;
        private IssueCategory category;
        private Severity severity;

        private Builder(String path) {
            if (path == null || path.isBlank()) {
                throw new IllegalArgumentException("Property constraint requires a path");
            }
            this.path = path;
        }

        public Builder minCount(Integer minCount) {
            this.minCount = minCount;
            return this;
        }

        public Builder maxCount(Integer maxCount) {
            this.maxCount = maxCount;
            return this;
        }

        public Builder nodeKind(NodeKind nodeKind) {
            this.nodeKind = nodeKind;
            return this;
        }

        public Builder datatype(String datatype) {
            this.datatype = datatype;
            return this;
        }

        /** Allowed IRIs or literal lexical forms. */
        public Builder allowedValues(Set<String> allowedValues) {
            this.allowedValues = allowedValues;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder category(IssueCategory category) {
            this.category = category;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public PropertyConstraint build() {
            if (minCount != null && maxCount != null && minCount > maxCount) {
                throw new IllegalArgumentException("minCount " + minCount + " exceeds maxCount " + maxCount + " for " + path);
            }
            return new PropertyConstraint(this);
        }
    }
}
