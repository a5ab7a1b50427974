package com.e2eq.conformance.repair;

import com.e2eq.conformance.core.ViolationReport;
import com.e2eq.conformance.spi.CandidateDocument;

import java.util.Optional;

/**
 * One validation pass of a repair session. Recorded once, after the pass's outcome is known,
 * and never changed afterwards.
 */
public record ConformanceAttempt(int index,
                                 CandidateDocument document,
                                 ViolationReport report,
                                 boolean terminal,
                                 Optional<String> failure) {

    public ConformanceAttempt {
        failure = failure == null ? Optional.empty() : failure;
    }

    public boolean isValid() {
        return report.isValid();
    }
}
