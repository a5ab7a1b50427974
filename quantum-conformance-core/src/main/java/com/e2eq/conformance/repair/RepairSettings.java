package com.e2eq.conformance.repair;

import com.e2eq.conformance.exceptions.ConformanceConfigurationException;

import java.time.Duration;

/**
 * Attempt ceiling and per-attempt transducer timeout of a repair session.
 */
public record RepairSettings(int maxAttempts, Duration attemptTimeout) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(60);

    public RepairSettings {
        if (maxAttempts < 1) {
            throw new ConformanceConfigurationException("max-attempts must be a positive integer, was " + maxAttempts);
        }
        attemptTimeout = attemptTimeout != null ? attemptTimeout : DEFAULT_ATTEMPT_TIMEOUT;
        if (attemptTimeout.isNegative() || attemptTimeout.isZero()) {
            throw new ConformanceConfigurationException("attempt-timeout must be positive, was " + attemptTimeout);
        }
    }

    public static RepairSettings defaults() {
        return new RepairSettings(DEFAULT_MAX_ATTEMPTS, DEFAULT_ATTEMPT_TIMEOUT);
    }

    public RepairSettings withMaxAttempts(int max) {
        return new RepairSettings(max, attemptTimeout);
    }
}
