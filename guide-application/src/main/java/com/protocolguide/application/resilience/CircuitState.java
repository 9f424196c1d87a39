package com.protocolguide.application.resilience;

/**
 * CLOSED: calls pass through.
 * OPEN: calls are rejected until the reset timeout has elapsed.
 * HALF_OPEN: trial calls pass; enough consecutive successes close the circuit, one failure reopens it.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
