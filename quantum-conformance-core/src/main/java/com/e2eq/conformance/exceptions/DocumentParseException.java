package com.e2eq.conformance.exceptions;

/**
 * The candidate text could not be isolated or parsed into a policy graph.
 */
public class DocumentParseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String documentText;

    public DocumentParseException(String message, String documentText) {
        this(message, documentText, null);
    }

    public DocumentParseException(String message, String documentText, Throwable cause) {
        super(message, cause);
        this.documentText = documentText;
    }

    public String getDocumentText() {
        return documentText;
    }
}
