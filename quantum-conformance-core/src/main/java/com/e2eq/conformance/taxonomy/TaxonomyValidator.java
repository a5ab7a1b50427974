package com.e2eq.conformance.taxonomy;

import com.e2eq.conformance.exceptions.ConformanceConfigurationException;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Consistency checks for a detection strategy table: every conflict type covered exactly once,
 * pairwise distinct priorities, and at least one trigger per strategy.
 */
public final class TaxonomyValidator {
    private TaxonomyValidator() {}

    public static void validate(List<DetectionStrategy> strategies) {
        require(strategies != null && !strategies.isEmpty(), "Detection strategy table is empty");

        Map<ConflictType, DetectionStrategy> byType = new EnumMap<>(ConflictType.class);
        Map<Integer, ConflictType> byPriority = new HashMap<>();
        for (DetectionStrategy s : strategies) {
            require(byType.put(s.type(), s) == null,
                    "Conflict type '" + s.type().key() + "' has more than one detection strategy");
            ConflictType clash = byPriority.put(s.priority(), s.type());
            require(clash == null, "Duplicate priority " + s.priority() + " for '" + s.type().key()
                    + "' and '" + (clash != null ? clash.key() : "") + "'");
            require(s.priority() > 0, "Priority of '" + s.type().key() + "' must be positive");
            require(s.hasTriggers(), "Strategy for '" + s.type().key() + "' declares no keyword or structural trigger");
        }
        for (ConflictType t : ConflictType.values()) {
            require(byType.containsKey(t), "No detection strategy for conflict type '" + t.key() + "'");
        }
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new ConformanceConfigurationException(msg);
    }
}
