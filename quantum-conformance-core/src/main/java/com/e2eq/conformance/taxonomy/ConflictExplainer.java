package com.e2eq.conformance.taxonomy;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Renders a human-readable explanation block for a conflict type: detection order, priority
 * band, triggers, resolution principle and a worked example where one exists.
 */
public final class ConflictExplainer {

    public record Example(String userInput, String explanation, String resolution) {}

    private static final Map<ConflictType, Example> EXAMPLES = new EnumMap<>(ConflictType.class);
    static {
        EXAMPLES.put(ConflictType.UNMEASURABLE_TERMS, new Example(
                "Data must be used responsibly for urgent requests",
                "'Responsibly' and 'urgent' are subjective and cannot be measured consistently",
                "Replace with: 'Data must be attributed to source and used only for requests submitted within 48 hours of deadline'"));
        EXAMPLES.put(ConflictType.OVERLY_BROAD, new Example(
                "Everyone can access everything for any purpose",
                "Universal quantifiers create unimplementable, overly permissive policy",
                "Specify: 'Registered researchers can access datasets X, Y, Z for educational or non-commercial research purposes'"));
        EXAMPLES.put(ConflictType.SPATIAL_HIERARCHY, new Example(
                "Access permitted in Germany but prohibited in all EU countries",
                "Germany is contained in the EU, so permission and prohibition contradict",
                "Apply specific-over-general: Allow in Germany (specific) despite EU prohibition (general), OR clarify intent"));
        EXAMPLES.put(ConflictType.TEMPORAL_OVERLAP, new Example(
                "Access allowed 9am-5pm Monday to Friday, but prohibited 2pm-6pm every day",
                "2pm-5pm overlap on weekdays has contradictory rules",
                "Apply prohibit-on-ambiguity: Block access 2pm-5pm on weekdays"));
        EXAMPLES.put(ConflictType.ACTION_HIERARCHY, new Example(
                "Users can share the dataset but cannot distribute it",
                "'share' is a narrower form of 'distribute'",
                "Prohibit sharing since it's semantically a form of distribution"));
        EXAMPLES.put(ConflictType.CIRCULAR_APPROVAL, new Example(
                "Access requires Committee approval, Committee needs Rights verification, Rights needs preliminary access",
                "Cycle detected: Access -> Committee -> Rights -> Access (impossible to start)",
                "Break cycle: Allow preliminary access without Rights verification, OR delegate Rights verification to external party"));
        EXAMPLES.put(ConflictType.ROLE_HIERARCHY, new Example(
                "Managers must access data weekly; administrators cannot access data; all managers are administrators",
                "If managers are administrators, then requirement + prohibition is impossible",
                "Clarify role hierarchy: Either managers are not administrators, OR create exception for managers"));
    }

    private final ConflictTaxonomy taxonomy;

    public ConflictExplainer(ConflictTaxonomy taxonomy) {
        this.taxonomy = taxonomy;
    }

    public static Optional<Example> exampleFor(ConflictType type) {
        return Optional.ofNullable(EXAMPLES.get(type));
    }

    /** CRITICAL for the first two detection slots, High through five, Standard after. */
    public static String priorityBand(int priority) {
        if (priority <= 2) return "CRITICAL";
        if (priority <= 5) return "High";
        return "Standard";
    }

    public String explain(ConflictType type) {
        DetectionStrategy s = taxonomy.strategyFor(type);
        Optional<Example> example = exampleFor(type);
        StringBuilder sb = new StringBuilder();
        sb.append("## ").append(type.title()).append("\n\n");
        sb.append("**Detection Order:** ").append(s.priority())
                .append(" (Priority: ").append(priorityBand(s.priority())).append(")\n\n");
        sb.append("**Keywords to Check:** ")
                .append(s.keywords().isEmpty() ? "N/A - structural patterns only" : String.join(", ", s.keywords()))
                .append("\n\n");
        if (s.requiresOntology() || s.requiresGraphAnalysis()) {
            sb.append("**Requires:** ")
                    .append(s.requiresOntology() ? "ontology lookup" : "")
                    .append(s.requiresOntology() && s.requiresGraphAnalysis() ? ", " : "")
                    .append(s.requiresGraphAnalysis() ? "graph cycle analysis" : "")
                    .append("\n\n");
        }
        sb.append("**Resolution Principle:** ").append(s.principle().key()).append("\n");
        sb.append(s.principle().explanation()).append("\n\n");
        sb.append("**Default Action:** ").append(s.defaultAction().name().toLowerCase(Locale.ROOT)).append("\n\n");
        sb.append("**Example:**\n");
        sb.append("Input: \"").append(example.map(Example::userInput).orElse("N/A")).append("\"\n");
        sb.append("Conflict: ").append(example.map(Example::explanation).orElse("N/A")).append("\n");
        sb.append("Resolution: ").append(example.map(Example::resolution).orElse("N/A")).append("\n");
        return sb.toString();
    }

    public String explain(ConflictClassification classification) {
        return explain(classification.type()) + "\n**Matched:** " + classification.matchedTrigger() + "\n";
    }
}
