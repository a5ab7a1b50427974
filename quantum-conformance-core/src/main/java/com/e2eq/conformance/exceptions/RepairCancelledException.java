package com.e2eq.conformance.exceptions;

import com.e2eq.conformance.repair.ConformanceAttempt;

import java.util.List;

/**
 * Cancellation was observed before a validation pass started.
 */
public class RepairCancelledException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int attemptIndex;
    private final transient List<ConformanceAttempt> attempts;

    public RepairCancelledException(int attemptIndex, List<ConformanceAttempt> attempts) {
        super("Repair session cancelled before attempt " + attemptIndex);
        this.attemptIndex = attemptIndex;
        this.attempts = List.copyOf(attempts);
    }

    public int getAttemptIndex() {
        return attemptIndex;
    }

    public List<ConformanceAttempt> getAttempts() {
        return attempts;
    }
}
