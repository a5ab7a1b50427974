package com.e2eq.conformance.turtle;

import com.e2eq.conformance.exceptions.DocumentParseException;
import com.e2eq.conformance.graph.OdrlVocabulary;
import com.e2eq.conformance.graph.PolicyGraph;
import com.e2eq.conformance.spi.CandidateDocument;
import com.e2eq.conformance.spi.DocumentDecoder;

/**
 * Extracts the Turtle body from transducer output and parses it. Output that parses to no
 * statements, or to no {@code odrl:Policy} subject, is not a policy document and is rejected.
 */
public class TurtleDocumentDecoder implements DocumentDecoder {

    private final JenaTurtleParser parser;

    public TurtleDocumentDecoder() {
        this(new JenaTurtleParser());
    }

    public TurtleDocumentDecoder(JenaTurtleParser parser) {
        this.parser = parser;
    }

    @Override
    public CandidateDocument decode(String raw) {
        String turtle = TurtleExtractor.extract(raw);
        if (turtle.isEmpty()) {
            throw new DocumentParseException("No Turtle content found in output", raw);
        }
        PolicyGraph graph = parser.parse(turtle);
        if (graph.isEmpty()) {
            throw new DocumentParseException("Turtle content holds no statements", turtle);
        }
        if (graph.entitiesOfType(OdrlVocabulary.POLICY).isEmpty()) {
            throw new DocumentParseException("Turtle content declares no odrl:Policy", turtle);
        }
        return new CandidateDocument(turtle, graph);
    }
}
