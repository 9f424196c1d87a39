package com.protocolguide.application.resilience;

/**
 * Health of one guarded dependency.
 *
 * @param available false only while the circuit is OPEN
 * @param degraded  half-open, or failures inside the current window
 */
public record ServiceStatus(
        String name,
        boolean available,
        CircuitState state,
        boolean degraded,
        CircuitStats stats
) {

    static ServiceStatus of(CircuitStats stats) {
        CircuitState state = stats.state();
        boolean available = state != CircuitState.OPEN;
        boolean degraded = state == CircuitState.HALF_OPEN || stats.failures() > 0;
        return new ServiceStatus(stats.name(), available, state, degraded, stats);
    }
}
