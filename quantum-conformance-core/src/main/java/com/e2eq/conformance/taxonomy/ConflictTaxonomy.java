package com.e2eq.conformance.taxonomy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Validated detection strategy table, ordered by ascending priority. Read-only after
 * construction.
 */
public final class ConflictTaxonomy {
    private final int version;
    private final List<DetectionStrategy> ordered;
    private final Map<ConflictType, DetectionStrategy> byType;

    public ConflictTaxonomy(int version, List<DetectionStrategy> strategies) {
        TaxonomyValidator.validate(strategies);
        List<DetectionStrategy> sorted = new ArrayList<>(strategies);
        sorted.sort(Comparator.comparingInt(DetectionStrategy::priority));
        this.version = version;
        this.ordered = List.copyOf(sorted);
        Map<ConflictType, DetectionStrategy> map = new EnumMap<>(ConflictType.class);
        for (DetectionStrategy s : sorted) map.put(s.type(), s);
        this.byType = map;
    }

    public int version() {
        return version;
    }

    /** Strategies in evaluation order. */
    public List<DetectionStrategy> strategies() {
        return ordered;
    }

    public DetectionStrategy strategyFor(ConflictType type) {
        return byType.get(type);
    }
}
