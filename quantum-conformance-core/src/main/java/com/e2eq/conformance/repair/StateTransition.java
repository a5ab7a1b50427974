package com.e2eq.conformance.repair;

public record StateTransition(RepairState from, RepairState to, int attemptIndex) {

    @Override
    public String toString() {
        return from + " -> " + to + " @" + attemptIndex;
    }
}
