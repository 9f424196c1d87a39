package com.protocolguide.application.resilience;

import java.util.List;

/**
 * Receives state changes after the tracker has released its lock.
 */
@FunctionalInterface
public interface CircuitTransitionListener {

    CircuitTransitionListener NOOP = t -> {};

    void onTransition(CircuitTransition transition);

    static CircuitTransitionListener composite(List<? extends CircuitTransitionListener> listeners) {
        List<CircuitTransitionListener> copy = List.copyOf(listeners);
        return t -> copy.forEach(l -> l.onTransition(t));
    }
}
