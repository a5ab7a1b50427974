package com.e2eq.conformance.io;

import com.e2eq.conformance.core.CompatibilityConstraint;
import com.e2eq.conformance.core.IssueCategory;
import com.e2eq.conformance.core.LogicalConstraint;
import com.e2eq.conformance.core.LogicalConstraint.Combinator;
import com.e2eq.conformance.core.NodeKind;
import com.e2eq.conformance.core.Operand;
import com.e2eq.conformance.core.OperandRegistry;
import com.e2eq.conformance.core.Operator;
import com.e2eq.conformance.core.PropertyConstraint;
import com.e2eq.conformance.core.RuleConstraint;
import com.e2eq.conformance.core.Severity;
import com.e2eq.conformance.core.ShapeRule;
import com.e2eq.conformance.core.ShapeRuleSet;
import com.e2eq.conformance.core.ShapeTarget;
import com.e2eq.conformance.exceptions.ConformanceConfigurationException;
import com.e2eq.conformance.graph.OdrlVocabulary;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads shape rules from YAML. Operand and operator names used by {@code inOperands} and
 * {@code inOperators} are resolved against the supplied registry and the {@link Operator}
 * enum at load time; {@code "*"} stands for every entry.
 * <pre>
 * version: 1
 * shapes:
 *   - id: ConstraintStructureShape
 *     targetObjectsOf: odrl:constraint
 *     constraints:
 *       - path: odrl:leftOperand
 *         minCount: 1
 *         maxCount: 1
 *         inOperands: ["*"]
 *       - xone:
 *           - { path: odrl:rightOperand, minCount: 1 }
 *           - { path: odrl:rightOperandReference, minCount: 1 }
 *         message: Missing right operand or reference
 *       - compatibility: { severity: warning }
 * </pre>
 */
public final class YamlShapeLoader {

    private static final String ALL = "*";

    public record YShapes(Integer version, Map<String, String> prefixes, List<YShape> shapes) {}
    public record YShape(String id, String description, String targetClass, String targetObjectsOf,
                         List<YConstraint> constraints) {}
    public record YConstraint(
            String path,
            Integer minCount,
            Integer maxCount,
            String nodeKind,
            String datatype,
            List<String> in,
            List<String> inOperands,
            List<String> inOperators,
            List<YConstraint> and,
            List<YConstraint> or,
            List<YConstraint> xone,
            YConstraint not,
            YCompatibility compatibility,
            String message,
            String category,
            String severity
    ) {}
    public record YCompatibility(String leftOperandPath, String operatorPath, String severity, String message) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final OperandRegistry operands;

    public YamlShapeLoader(OperandRegistry operands) {
        this.operands = Objects.requireNonNull(operands, "operands");
    }

    public ShapeRuleSet loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return toRuleSet(mapper.readValue(in, YShapes.class), resourcePath);
        }
    }

    public ShapeRuleSet loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return toRuleSet(mapper.readValue(in, YShapes.class), path.toString());
        }
    }

    public ShapeRuleSet load(InputStream in) throws IOException {
        return toRuleSet(mapper.readValue(in, YShapes.class), "<stream>");
    }

    private ShapeRuleSet toRuleSet(YShapes y, String source) {
        require(y != null && y.shapes() != null && !y.shapes().isEmpty(), source, "Shape table declares no shapes");
        Map<String, String> prefixes = Optional.ofNullable(y.prefixes()).orElse(Map.of());
        Converter conv = new Converter(prefixes, source);
        List<ShapeRule> rules = new ArrayList<>();
        for (YShape s : y.shapes()) {
            require(s.id() != null && !s.id().isBlank(), source, "Shape without an id");
            boolean hasClass = s.targetClass() != null && !s.targetClass().isBlank();
            boolean hasObjects = s.targetObjectsOf() != null && !s.targetObjectsOf().isBlank();
            require(hasClass ^ hasObjects, source,
                    "Shape '" + s.id() + "' must declare exactly one of targetClass or targetObjectsOf");
            ShapeTarget target = hasClass
                    ? ShapeTarget.ofClass(OdrlVocabulary.expand(s.targetClass(), prefixes))
                    : ShapeTarget.objectsOf(OdrlVocabulary.expand(s.targetObjectsOf(), prefixes));
            List<YConstraint> ycs = Optional.ofNullable(s.constraints()).orElse(List.of());
            require(!ycs.isEmpty(), source, "Shape '" + s.id() + "' declares no constraints");
            List<RuleConstraint> constraints = new ArrayList<>();
            for (YConstraint c : ycs) {
                constraints.add(conv.convert(s.id(), c));
            }
            rules.add(new ShapeRule(s.id(), target, constraints, s.description()));
        }
        int version = Optional.ofNullable(y.version()).orElse(1);
        try {
            return new ShapeRuleSet(version, rules);
        } catch (ConformanceConfigurationException e) {
            throw new ConformanceConfigurationException(e.getMessage(), source, e);
        }
    }

    private final class Converter {
        private final Map<String, String> prefixes;
        private final String source;

        Converter(Map<String, String> prefixes, String source) {
            this.prefixes = prefixes;
            this.source = source;
        }

        RuleConstraint convert(String shapeId, YConstraint c) {
            require(c != null, source, "Shape '" + shapeId + "' contains an empty constraint");
            int kinds = (c.path() != null ? 1 : 0) + (c.and() != null ? 1 : 0) + (c.or() != null ? 1 : 0)
                    + (c.xone() != null ? 1 : 0) + (c.not() != null ? 1 : 0) + (c.compatibility() != null ? 1 : 0);
            require(kinds == 1, source, "Constraint in shape '" + shapeId
                    + "' must be exactly one of path, and, or, xone, not, compatibility");

            IssueCategory category = category(shapeId, c.category());
            Severity severity = severity(shapeId, c.severity());

            if (c.compatibility() != null) {
                YCompatibility y = c.compatibility();
                Severity s = y.severity() != null ? severity(shapeId, y.severity()) : severity;
                return new CompatibilityConstraint(
                        y.leftOperandPath() != null ? OdrlVocabulary.expand(y.leftOperandPath(), prefixes) : null,
                        y.operatorPath() != null ? OdrlVocabulary.expand(y.operatorPath(), prefixes) : null,
                        s,
                        y.message() != null ? y.message() : c.message());
            }
            if (c.and() != null) {
                return new LogicalConstraint(Combinator.AND, branches(shapeId, c.and()), c.message(), category, severity);
            }
            if (c.or() != null) {
                return new LogicalConstraint(Combinator.OR, branches(shapeId, c.or()), c.message(), category, severity);
            }
            if (c.xone() != null) {
                return new LogicalConstraint(Combinator.XONE, branches(shapeId, c.xone()), c.message(), category, severity);
            }
            if (c.not() != null) {
                return new LogicalConstraint(Combinator.NOT, List.of(convert(shapeId, c.not())), c.message(), category, severity);
            }
            return property(shapeId, c, category, severity);
        }

        private List<RuleConstraint> branches(String shapeId, List<YConstraint> ys) {
            require(!ys.isEmpty(), source, "Logical constraint in shape '" + shapeId + "' has no branches");
            List<RuleConstraint> out = new ArrayList<>();
            for (YConstraint b : ys) {
                out.add(convert(shapeId, b));
            }
            return out;
        }

        private RuleConstraint property(String shapeId, YConstraint c, IssueCategory category, Severity severity) {
            String path = OdrlVocabulary.expand(c.path(), prefixes);
            require(c.minCount() == null || c.minCount() >= 0, source, "Negative minCount for " + c.path() + " in '" + shapeId + "'");
            require(c.maxCount() == null || c.maxCount() >= 0, source, "Negative maxCount for " + c.path() + " in '" + shapeId + "'");
            require(c.minCount() == null || c.maxCount() == null || c.minCount() <= c.maxCount(), source,
                    "minCount exceeds maxCount for " + c.path() + " in '" + shapeId + "'");

            Set<String> allowed = null;
            if (c.in() != null) {
                allowed = new LinkedHashSet<>();
                for (String v : c.in()) allowed.add(OdrlVocabulary.expand(v, prefixes));
            }
            if (c.inOperands() != null) {
                allowed = allowed != null ? allowed : new LinkedHashSet<>();
                allowed.addAll(operandIris(shapeId, c.inOperands()));
            }
            if (c.inOperators() != null) {
                allowed = allowed != null ? allowed : new LinkedHashSet<>();
                allowed.addAll(operatorIris(shapeId, c.inOperators()));
            }

            NodeKind nodeKind = null;
            if (c.nodeKind() != null) {
                try {
                    nodeKind = NodeKind.parse(c.nodeKind());
                } catch (IllegalArgumentException e) {
                    throw new ConformanceConfigurationException("Unknown nodeKind '" + c.nodeKind() + "' in shape '" + shapeId + "'", source, e);
                }
            }

            return PropertyConstraint.path(path)
                    .minCount(c.minCount())
                    .maxCount(c.maxCount())
                    .nodeKind(nodeKind)
                    .datatype(c.datatype() != null ? OdrlVocabulary.expand(c.datatype(), prefixes) : null)
                    .allowedValues(allowed)
                    .message(c.message())
                    .category(category)
                    .severity(severity)
                    .build();
        }

        private List<String> operandIris(String shapeId, List<String> names) {
            if (names.contains(ALL)) {
                return operands.operands().stream().map(Operand::iri).toList();
            }
            List<String> out = new ArrayList<>();
            for (String n : names) {
                Operand op = operands.lookup(n).orElseThrow(() -> new ConformanceConfigurationException(
                        "Shape '" + shapeId + "' references unknown operand '" + n + "'", source, null));
                out.add(op.iri());
            }
            return out;
        }

        private List<String> operatorIris(String shapeId, List<String> names) {
            if (names.contains(ALL)) {
                return Arrays.stream(Operator.values()).map(Operator::iri).toList();
            }
            List<String> out = new ArrayList<>();
            for (String n : names) {
                Operator op = Operator.fromName(n).orElseThrow(() -> new ConformanceConfigurationException(
                        "Shape '" + shapeId + "' references unknown operator '" + n + "'", source, null));
                out.add(op.iri());
            }
            return out;
        }

        private IssueCategory category(String shapeId, String key) {
            if (key == null) return null;
            return IssueCategory.fromKey(key).orElseThrow(() -> new ConformanceConfigurationException(
                    "Unknown issue category '" + key + "' in shape '" + shapeId + "'", source, null));
        }

        private Severity severity(String shapeId, String value) {
            if (value == null) return null;
            try {
                return Severity.parse(value);
            } catch (IllegalArgumentException e) {
                throw new ConformanceConfigurationException("Unknown severity '" + value + "' in shape '" + shapeId + "'", source, e);
            }
        }
    }

    private static void require(boolean cond, String source, String msg) {
        if (!cond) throw new ConformanceConfigurationException(msg, source, null);
    }
}
