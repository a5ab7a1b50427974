package com.e2eq.conformance.core;

import com.e2eq.conformance.exceptions.ConformanceConfigurationException;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, read-only set of shape rules. Rule order drives violation order.
 */
public final class ShapeRuleSet {
    private final int version;
    private final List<ShapeRule> rules;

    public ShapeRuleSet(int version, List<ShapeRule> rules) {
        this.version = version;
        this.rules = List.copyOf(rules);
        Set<String> ids = new HashSet<>();
        for (ShapeRule r : this.rules) {
            if (!ids.add(r.id())) {
                throw new ConformanceConfigurationException("Duplicate shape rule id '" + r.id() + "'");
            }
        }
    }

    public static ShapeRuleSet of(ShapeRule... rules) {
        return new ShapeRuleSet(1, List.of(rules));
    }

    public int version() {
        return version;
    }

    public List<ShapeRule> rules() {
        return rules;
    }

    public Optional<ShapeRule> rule(String id) {
        return rules.stream().filter(r -> r.id().equals(id)).findFirst();
    }
}
