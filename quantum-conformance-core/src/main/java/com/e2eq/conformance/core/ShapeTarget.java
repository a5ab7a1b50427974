package com.e2eq.conformance.core;

import com.e2eq.conformance.graph.OdrlVocabulary;
import com.e2eq.conformance.graph.PolicyEntity;
import com.e2eq.conformance.graph.PolicyGraph;

import java.util.List;
import java.util.Objects;

/**
 * Selects the focus entities of a shape rule.
 */
public record ShapeTarget(Kind kind, String iri) {

    public enum Kind {
        /** Entities typed with the class. */
        CLASS,
        /** Values of the predicate, typed or not. */
        OBJECTS_OF
    }

    public ShapeTarget {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(iri, "iri");
    }

    public static ShapeTarget ofClass(String classIri) {
        return new ShapeTarget(Kind.CLASS, classIri);
    }

    public static ShapeTarget objectsOf(String predicateIri) {
        return new ShapeTarget(Kind.OBJECTS_OF, predicateIri);
    }

    public List<PolicyEntity> select(PolicyGraph graph) {
        return kind == Kind.CLASS ? graph.entitiesOfType(iri) : graph.objectsOf(iri);
    }

    @Override
    public String toString() {
        return (kind == Kind.CLASS ? "targetClass " : "targetObjectsOf ") + OdrlVocabulary.compact(iri);
    }
}
