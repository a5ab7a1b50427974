package com.e2eq.conformance.taxonomy;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of conflict categories. Each constant belongs to exactly one {@link ConflictFamily}.
 */
public enum ConflictType {
    UNMEASURABLE_TERMS("unmeasurable_terms"),
    OVERLY_BROAD("vague_and_overly_broad"),
    TEMPORAL_EXPIRED("temporal_expired_policy"),
    TEMPORAL_OVERLAP("temporal_overlap_conflict"),
    TEMPORAL_IMPOSSIBLE_SEQUENCE("temporal_impossible_sequence"),
    SPATIAL_HIERARCHY("spatial_hierarchy_conflict"),
    SPATIAL_OVERLAP("spatial_overlap_conflict"),
    ACTION_HIERARCHY("action_hierarchy_conflict"),
    ACTION_SUBSUMPTION("action_subsumption_conflict"),
    ACTION_CONFLICT("action_conflict"),
    CIRCULAR_APPROVAL("circular_approval_dependency"),
    WORKFLOW_CYCLE("workflow_cycle_conflict"),
    ROLE_HIERARCHY("role_hierarchy_conflict"),
    PARTY_INCONSISTENCY("party_specification_inconsistency");

    private final String key;

    ConflictType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public ConflictFamily family() {
        switch (this) {
            case UNMEASURABLE_TERMS:
            case OVERLY_BROAD:
                return ConflictFamily.VAGUENESS;
            case TEMPORAL_EXPIRED:
            case TEMPORAL_OVERLAP:
            case TEMPORAL_IMPOSSIBLE_SEQUENCE:
                return ConflictFamily.TEMPORAL;
            case SPATIAL_HIERARCHY:
            case SPATIAL_OVERLAP:
                return ConflictFamily.SPATIAL;
            case ACTION_HIERARCHY:
            case ACTION_SUBSUMPTION:
            case ACTION_CONFLICT:
                return ConflictFamily.ACTION;
            case CIRCULAR_APPROVAL:
            case WORKFLOW_CYCLE:
                return ConflictFamily.DEPENDENCY;
            case ROLE_HIERARCHY:
            case PARTY_INCONSISTENCY:
                return ConflictFamily.ROLE;
            default:
                throw new IllegalStateException("No family for " + this);
        }
    }

    /** Title-cased label, e.g. "Temporal Overlap Conflict". */
    public String title() {
        StringBuilder sb = new StringBuilder();
        for (String part : key.split("_")) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }

    /** Accepts the snake-case key ({@code unmeasurable_terms}) or the constant name. */
    public static Optional<ConflictType> fromKey(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.key.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v.replace('-', '_')))
                .findFirst();
    }

    @Override
    public String toString() {
        return family().name().toLowerCase(Locale.ROOT) + "/" + key;
    }
}
