package com.e2eq.conformance.exceptions;

import com.e2eq.conformance.core.ViolationReport;
import com.e2eq.conformance.repair.RepairOutcome;

/**
 * A repair session ended because an external collaborator (transducer or document decoder)
 * failed. The session is terminal in {@code EXHAUSTED_BUDGET}; the outcome and the report of
 * the attempt that failed are attached so the caller can decide on manual intervention.
 */
public class RepairAbortedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int attemptIndex;
    private final transient ViolationReport lastReport;
    private final transient RepairOutcome outcome;

    public RepairAbortedException(int attemptIndex, ViolationReport lastReport, RepairOutcome outcome, Throwable cause) {
        super(String.format("Repair aborted at attempt %d: %s", attemptIndex,
                cause != null && cause.getMessage() != null ? cause.getMessage() : String.valueOf(cause)), cause);
        this.attemptIndex = attemptIndex;
        this.lastReport = lastReport;
        this.outcome = outcome;
    }

    /**
     * 1-based index of the attempt during which the collaborator failed.
     */
    public int getAttemptIndex() {
        return attemptIndex;
    }

    public ViolationReport getLastReport() {
        return lastReport;
    }

    public RepairOutcome getOutcome() {
        return outcome;
    }
}
