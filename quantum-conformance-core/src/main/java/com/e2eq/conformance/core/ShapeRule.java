package com.e2eq.conformance.core;

import java.util.List;
import java.util.Objects;

/**
 * A named group of constraints applied to every entity its target selects.
 */
public record ShapeRule(String id, ShapeTarget target, List<RuleConstraint> constraints, String description) {

    public ShapeRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(target, "target");
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public ShapeRule(String id, ShapeTarget target, List<RuleConstraint> constraints) {
        this(id, target, constraints, null);
    }
}
