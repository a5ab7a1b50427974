package com.e2eq.conformance.repair;

import com.e2eq.conformance.exceptions.DocumentParseException;
import com.e2eq.conformance.graph.PolicyGraph;
import com.e2eq.conformance.spi.CandidateDocument;
import com.e2eq.conformance.spi.DocumentDecoder;

import java.util.Map;

/**
 * Decodes a document name into one of a fixed set of graphs.
 */
class MapDecoder implements DocumentDecoder {
    private final Map<String, PolicyGraph> graphs;

    MapDecoder(Map<String, PolicyGraph> graphs) {
        this.graphs = graphs;
    }

    @Override
    public CandidateDocument decode(String raw) {
        String key = raw.strip();
        PolicyGraph g = graphs.get(key);
        if (g == null) {
            throw new DocumentParseException("No graph named '" + key + "'", raw);
        }
        return new CandidateDocument(key, g);
    }

    CandidateDocument document(String key) {
        return decode(key);
    }
}
