package com.e2eq.conformance.taxonomy;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Named resolution policies. The text is used only to explain a classification; nothing here
 * is executed.
 */
public enum ResolutionPrinciple {
    SPECIFIC_OVER_GENERAL("specific-over-general",
            "When two policies conflict, the more specific policy takes precedence:\n"
            + "- Narrower geographic scope > Broader scope\n"
            + "- Shorter time window > Longer window\n"
            + "- Specific actors > General groups\n"
            + "Example: \"Germany only\" overrides \"All EU countries\""),
    PROHIBIT_ON_AMBIGUITY("prohibit-on-ambiguity",
            "When temporal or spatial constraints create ambiguity, default to prohibition:\n"
            + "- Overlapping time windows with contradictory rules -> Prohibit during overlap\n"
            + "- Conflicting geographic scopes -> Prohibit in contested region\n"
            + "Safety principle: Better to block than allow incorrectly"),
    REJECT_WITH_MEASURABLE_ALTERNATIVE("reject-with-measurable-alternative",
            "Unmeasurable terms must be replaced with objective criteria:\n"
            + "- \"urgent\" -> \"priority level >= 5\" or \"within 48 hours of deadline\"\n"
            + "- \"responsibly\" -> \"with proper attribution\" or \"for non-commercial purposes\"\n"
            + "- \"when necessary\" -> \"when storage exceeds 80% capacity\""),
    REQUIRE_SPECIFICATION("require-specification",
            "Overly broad policies must specify:\n"
            + "- Actors: Replace \"everyone\" with \"registered researchers\"\n"
            + "- Assets: Replace \"everything\" with specific dataset identifiers\n"
            + "- Actions: Replace \"anything\" with enumerated action list"),
    FLAG_AS_INACTIVE("flag-as-inactive",
            "Policies whose validity window ended before the current date are inactive:\n"
            + "- Do not enforce them\n"
            + "- Ask for a renewed end date if the policy should still apply"),
    PROHIBIT_ON_CONFLICT("prohibit-on-conflict",
            "When a permitted action and a prohibited action overlap in meaning, the prohibition wins:\n"
            + "- A prohibited parent action also prohibits its narrower actions\n"
            + "- The same action permitted and prohibited for the same party and asset is prohibited"),
    APPLY_ROLE_HIERARCHY("apply-role-hierarchy",
            "Role conflicts resolved via organizational hierarchy:\n"
            + "1. Map role containment (managers within administrators)\n"
            + "2. Apply prohibition to all contained roles\n"
            + "3. Flag inconsistent specifications"),
    REQUIRE_CONSISTENT_PARTIES("require-consistent-parties",
            "Each party must be specified once and consistently:\n"
            + "- The same party cannot be both assigner and assignee of a rule\n"
            + "- A party referenced by a duty must also be named by the policy"),
    REQUIRE_FEASIBLE_SEQUENCE("require-feasible-sequence",
            "Time-ordered requirements must be satisfiable:\n"
            + "- A start must precede its end\n"
            + "- A step cannot be required before the step it depends on"),
    BREAK_CYCLE_AT_WEAKEST_LINK("break-cycle-at-weakest-link",
            "Circular dependencies broken by:\n"
            + "1. Detecting cycle via graph traversal\n"
            + "2. Identifying weakest dependency (least critical approval)\n"
            + "3. Suggesting alternative approval path");

    private final String key;
    private final String explanation;

    ResolutionPrinciple(String key, String explanation) {
        this.key = key;
        this.explanation = explanation;
    }

    public String key() {
        return key;
    }

    public String explanation() {
        return explanation;
    }

    /** Accepts kebab-case or snake-case keys. */
    public static Optional<ResolutionPrinciple> fromKey(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values()).filter(p -> p.key.equals(v)).findFirst();
    }
}
