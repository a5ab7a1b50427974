package com.e2eq.conformance.spi;

import com.e2eq.conformance.exceptions.TransducerException;

/**
 * External capability that turns a prompt payload into raw text expected to contain a
 * serialized policy document. The text may be wrapped in commentary; isolating the document is
 * the job of a {@link DocumentDecoder}.
 */
@FunctionalInterface
public interface TextTransducer {

    /**
     * @throws TransducerException when the call fails or produces nothing usable
     */
    String transduce(PromptPayload payload);
}
