package com.e2eq.conformance.repair;

public enum RepairState {
    VALIDATING(false),
    AWAITING_REGENERATION(false),
    CONFORMANT(true),
    EXHAUSTED_BUDGET(true);

    private final boolean terminal;

    RepairState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
