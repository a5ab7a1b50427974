package com.e2eq.conformance.exceptions;

import com.e2eq.conformance.taxonomy.ConflictSignal;

/**
 * Thrown when no detection strategy is satisfied by a conflict signal. The conflict is
 * reported as unclassified; it is never mapped to a default category.
 */
public class NoMatchingStrategyException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient ConflictSignal signal;

    public NoMatchingStrategyException(ConflictSignal signal) {
        super("Unclassified conflict: no detection strategy matches " + signal);
        this.signal = signal;
    }

    public ConflictSignal getSignal() {
        return signal;
    }
}
