package com.e2eq.conformance.core;

import com.e2eq.conformance.graph.OdrlVocabulary;

import java.util.Optional;

/**
 * Closed set of constraint comparison operators.
 */
public enum Operator {
    EQ("eq"),
    NEQ("neq"),
    LT("lt"),
    LTEQ("lteq"),
    GT("gt"),
    GTEQ("gteq"),
    IS_A("isA"),
    HAS_PART("hasPart"),
    IS_PART_OF("isPartOf"),
    IS_ALL_OF("isAllOf"),
    IS_ANY_OF("isAnyOf"),
    IS_NONE_OF("isNoneOf");

    private final String localName;

    Operator(String localName) {
        this.localName = localName;
    }

    public String localName() {
        return localName;
    }

    public String iri() {
        return OdrlVocabulary.ODRL + localName;
    }

    /** Accepts the vocabulary local name ({@code isAnyOf}) or the constant name ({@code IS_ANY_OF}). */
    public static Optional<Operator> fromName(String name) {
        if (name == null) return Optional.empty();
        String n = name.trim();
        for (Operator op : values()) {
            if (op.localName.equals(n) || op.name().equalsIgnoreCase(n)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    public static Optional<Operator> fromIri(String iri) {
        if (iri == null) return Optional.empty();
        for (Operator op : values()) {
            if (op.iri().equals(iri)) return Optional.of(op);
        }
        return Optional.empty();
    }
}
