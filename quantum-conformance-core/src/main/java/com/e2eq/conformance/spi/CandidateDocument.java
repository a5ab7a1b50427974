package com.e2eq.conformance.spi;

import com.e2eq.conformance.graph.PolicyGraph;

import java.util.Objects;

/**
 * A serialized policy document together with its parsed graph.
 */
public record CandidateDocument(String text, PolicyGraph graph) {

    public CandidateDocument {
        Objects.requireNonNull(graph, "graph");
        text = text == null ? "" : text;
    }
}
