package com.protocolguide.application.resilience;

import java.time.Instant;

/**
 * One state change of a {@link FailureTracker}.
 */
public record CircuitTransition(
        String circuit,
        CircuitState from,
        CircuitState to,
        Cause cause,
        Instant at,
        int windowFailures
) {

    public enum Cause {
        FAILURE_THRESHOLD,
        RESET_TIMEOUT,
        TRIAL_FAILED,
        RECOVERED,
        FORCED,
        RESET
    }

    public boolean administrative() {
        return cause == Cause.FORCED || cause == Cause.RESET;
    }
}
