package com.protocolguide.application.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingCircuitTransitionListener implements CircuitTransitionListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingCircuitTransitionListener.class);

    @Override
    public void onTransition(CircuitTransition t) {
        if (t.administrative()) {
            log.warn("Circuit breaker {} {}: {} -> {}", t.circuit(),
                    t.cause() == CircuitTransition.Cause.RESET ? "reset" : "state forced", t.from(), t.to());
            return;
        }
        if (t.to() == CircuitState.OPEN) {
            log.warn("Circuit breaker {} opened: {} -> {} (cause={}, windowFailures={})",
                    t.circuit(), t.from(), t.to(), t.cause(), t.windowFailures());
        } else {
            log.info("Circuit breaker {} state transition: {} -> {} (cause={})",
                    t.circuit(), t.from(), t.to(), t.cause());
        }
    }
}
