package com.e2eq.conformance.exceptions;

/**
 * Thrown while loading operand, shape or strategy tables when the configuration is
 * inconsistent (duplicate priorities, unknown operators, missing strategies, unreadable resources).
 * Raised before any document is evaluated.
 */
public class ConformanceConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String source;

    public ConformanceConfigurationException(String message) {
        this(message, null, null);
    }

    public ConformanceConfigurationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ConformanceConfigurationException(String message, String source, Throwable cause) {
        super(source != null ? message + " [" + source + "]" : message, cause);
        this.source = source;
    }

    /**
     * The resource or path the offending configuration was read from, when known.
     */
    public String getSource() {
        return source;
    }
}
