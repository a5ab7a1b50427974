package com.e2eq.conformance.graph;

import java.util.Objects;

/**
 * A node of a parsed policy graph: an IRI, a blank node, or a literal.
 * Blank node values carry their label including the {@code _:} prefix.
 */
public record GraphNode(Kind kind, String value, String datatype, String language) {

    public enum Kind { IRI, BLANK, LITERAL }

    public GraphNode {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
    }

    public static GraphNode iri(String iri) {
        return new GraphNode(Kind.IRI, iri, null, null);
    }

    public static GraphNode blank(String label) {
        return new GraphNode(Kind.BLANK, label.startsWith("_:") ? label : "_:" + label, null, null);
    }

    public static GraphNode literal(String lexical) {
        return new GraphNode(Kind.LITERAL, lexical, null, null);
    }

    public static GraphNode typedLiteral(String lexical, String datatype) {
        return new GraphNode(Kind.LITERAL, lexical, datatype, null);
    }

    public static GraphNode langLiteral(String lexical, String language) {
        return new GraphNode(Kind.LITERAL, lexical, null, language);
    }

    public boolean isIri() { return kind == Kind.IRI; }
    public boolean isBlank() { return kind == Kind.BLANK; }
    public boolean isLiteral() { return kind == Kind.LITERAL; }

    /** True for nodes that can be the subject of statements. */
    public boolean isResource() { return kind != Kind.LITERAL; }

    /** Turtle-like rendering with IRIs compacted against the ODRL prefixes. */
    public String display() {
        switch (kind) {
            case IRI:
                return OdrlVocabulary.compact(value);
            case BLANK:
                return value;
            default:
                if (datatype != null) {
                    return "\"" + value + "\"^^" + OdrlVocabulary.compact(datatype);
                }
                if (language != null) {
                    return "\"" + value + "\"@" + language;
                }
                return "\"" + value + "\"";
        }
    }

    @Override
    public String toString() {
        return display();
    }
}
