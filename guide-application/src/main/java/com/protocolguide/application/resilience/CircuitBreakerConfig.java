package com.protocolguide.application.resilience;

/**
 * Tuning for one {@link FailureTracker}. Thresholds are counts inside a time window, not rates.
 *
 * @param name              dependency the breaker guards (used in logs, metrics and errors)
 * @param failureThreshold  failures inside {@code failureWindowMs} that open a closed circuit
 * @param successThreshold  consecutive half-open successes that close the circuit
 * @param resetTimeoutMs    time an open circuit waits before admitting a trial call
 * @param failureWindowMs   trailing window over which failures are counted
 */
public record CircuitBreakerConfig(
        String name,
        int failureThreshold,
        int successThreshold,
        long resetTimeoutMs,
        long failureWindowMs
) {

    public CircuitBreakerConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("circuit breaker name is required");
        }
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0 (" + name + ")");
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be > 0 (" + name + ")");
        }
        if (resetTimeoutMs <= 0) {
            throw new IllegalArgumentException("resetTimeoutMs must be > 0 (" + name + ")");
        }
        if (failureWindowMs <= 0) {
            throw new IllegalArgumentException("failureWindowMs must be > 0 (" + name + ")");
        }
    }

    public static CircuitBreakerConfig database() {
        return new CircuitBreakerConfig(Dependencies.DATABASE, 5, 3, 30_000, 60_000);
    }

    public static CircuitBreakerConfig ai() {
        return new CircuitBreakerConfig(Dependencies.AI, 3, 2, 60_000, 120_000);
    }

    public static CircuitBreakerConfig billing() {
        return new CircuitBreakerConfig(Dependencies.BILLING, 3, 2, 30_000, 60_000);
    }

    public static CircuitBreakerConfig defaultsFor(String name) {
        return switch (name) {
            case Dependencies.DATABASE -> database();
            case Dependencies.AI -> ai();
            case Dependencies.BILLING -> billing();
            default -> new CircuitBreakerConfig(name, 5, 3, 30_000, 60_000);
        };
    }
}
