package com.e2eq.conformance.spi;

import com.e2eq.conformance.exceptions.DocumentParseException;

/**
 * Isolates the document body in raw transducer output and parses it into a graph.
 */
@FunctionalInterface
public interface DocumentDecoder {

    /**
     * @throws DocumentParseException when no document can be extracted or parsed
     */
    CandidateDocument decode(String rawText);
}
