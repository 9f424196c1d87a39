package com.protocolguide.application.resilience;

import java.time.Instant;

/**
 * Point-in-time snapshot of a {@link FailureTracker}.
 *
 * @param failures   failures currently inside the window
 * @param successes  consecutive successes since the last failure or state entry
 */
public record CircuitStats(
        String name,
        CircuitState state,
        int failures,
        int successes,
        Instant lastFailureTime,
        Instant lastSuccessTime,
        Instant openedAt,
        long totalRequests,
        long totalFailures,
        long totalSuccesses,
        long timesOpened
) {}
