package com.e2eq.conformance.core;

import com.e2eq.conformance.graph.GraphNode;

import java.util.Locale;

public enum NodeKind {
    IRI,
    BLANK_NODE,
    LITERAL,
    BLANK_NODE_OR_IRI;

    public boolean matches(GraphNode node) {
        switch (this) {
            case IRI:
                return node.isIri();
            case BLANK_NODE:
                return node.isBlank();
            case LITERAL:
                return node.isLiteral();
            default:
                return node.isResource();
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    /** Accepts {@code IRI}, {@code BlankNodeOrIRI}, {@code blank_node} and similar spellings. */
    public static NodeKind parse(String value) {
        String v = value.trim().replace("_", "").replace("-", "").toUpperCase(Locale.ROOT);
        switch (v) {
            case "IRI":
                return IRI;
            case "BLANKNODE":
                return BLANK_NODE;
            case "LITERAL":
                return LITERAL;
            case "BLANKNODEORIRI":
                return BLANK_NODE_OR_IRI;
            default:
                throw new IllegalArgumentException("Unknown node kind '" + value + "'");
        }
    }
}
