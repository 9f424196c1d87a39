package com.protocolguide.application.resilience;

/**
 * Thrown when a guarded call is rejected because its circuit is open and no fallback was supplied.
 */
public class CircuitOpenException extends RuntimeException {

    private final String circuit;
    private final long retryAfterMs;

    public CircuitOpenException(String circuit, long retryAfterMs) {
        super("Circuit breaker open for service: " + circuit);
        this.circuit = circuit;
        this.retryAfterMs = Math.max(0, retryAfterMs);
    }

    public String circuit() {
        return circuit;
    }

    public long retryAfterMs() {
        return retryAfterMs;
    }

    /**
     * Retry-After header value (whole seconds, rounded up).
     */
    public long retryAfterSeconds() {
        return (retryAfterMs + 999) / 1000;
    }
}
