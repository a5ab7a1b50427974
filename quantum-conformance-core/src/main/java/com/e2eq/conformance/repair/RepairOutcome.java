package com.e2eq.conformance.repair;

import com.e2eq.conformance.core.Violation;
import com.e2eq.conformance.spi.CandidateDocument;

import java.util.List;
import java.util.Optional;

/**
 * Terminal result of a repair session.
 */
public record RepairOutcome(RepairState state,
                            CandidateDocument finalDocument,
                            int attemptsUsed,
                            List<Violation> unresolvedViolations,
                            List<ConformanceAttempt> attempts,
                            List<StateTransition> transitions,
                            Optional<String> failure) {

    public RepairOutcome {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Outcome requires a terminal state, got " + state);
        }
        unresolvedViolations = List.copyOf(unresolvedViolations);
        attempts = List.copyOf(attempts);
        transitions = List.copyOf(transitions);
        failure = failure == null ? Optional.empty() : failure;
    }

    public boolean isSuccess() {
        return state == RepairState.CONFORMANT;
    }

    public ConformanceAttempt lastAttempt() {
        return attempts.get(attempts.size() - 1);
    }
}
