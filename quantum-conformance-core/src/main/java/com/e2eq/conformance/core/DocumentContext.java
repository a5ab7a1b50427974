package com.e2eq.conformance.core;

/**
 * What a report is about: the request the document was produced for and the document text.
 */
public record DocumentContext(String requestText, String documentText) {

    public DocumentContext {
        requestText = requestText == null ? "" : requestText;
        documentText = documentText == null ? "" : documentText;
    }

    public DocumentContext withDocument(String text) {
        return new DocumentContext(requestText, text);
    }
}
