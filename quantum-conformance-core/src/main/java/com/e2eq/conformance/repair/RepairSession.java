package com.e2eq.conformance.repair;

import com.e2eq.conformance.core.Violation;
import com.e2eq.conformance.spi.CandidateDocument;
import io.quarkus.logging.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mutable bookkeeping for one repair session. Owned by a single orchestrator call and never
 * shared between threads.
 */
final class RepairSession {
    private final String sessionId;
    private final int ceiling;
    private final List<ConformanceAttempt> attempts = new ArrayList<>();
    private final List<StateTransition> transitions = new ArrayList<>();
    private RepairState state = RepairState.VALIDATING;
    private int attemptIndex = 1;

    RepairSession(String sessionId, int ceiling) {
        this.sessionId = sessionId;
        this.ceiling = ceiling;
    }

    RepairState state() {
        return state;
    }

    int attemptIndex() {
        return attemptIndex;
    }

    boolean isLastAttempt() {
        return attemptIndex == ceiling;
    }

    List<ConformanceAttempt> attempts() {
        return attempts;
    }

    void record(ConformanceAttempt attempt) {
        if (attempts.size() >= ceiling) {
            throw new IllegalStateException("Attempt ceiling " + ceiling + " reached");
        }
        attempts.add(attempt);
    }

    void transition(RepairState to) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Session " + sessionId + " already ended in " + state);
        }
        StateTransition t = new StateTransition(state, to, attemptIndex);
        transitions.add(t);
        Log.debugf("[%s] %s", sessionId, t);
        state = to;
    }

    void nextAttempt() {
        attemptIndex++;
    }

    RepairOutcome outcome(CandidateDocument finalDocument, List<Violation> unresolved, String failure) {
        return new RepairOutcome(state, finalDocument, attempts.size(), unresolved, attempts, transitions,
                Optional.ofNullable(failure));
    }
}
