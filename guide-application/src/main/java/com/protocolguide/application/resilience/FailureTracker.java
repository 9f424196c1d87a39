package com.protocolguide.application.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Objects;

/**
 * Circuit breaker state machine for one external dependency.
 *
 * <pre>
 * CLOSED    --[failureThreshold failures inside failureWindow]--> OPEN
 * OPEN      --[resetTimeout elapsed, checked on the next call]--> HALF_OPEN
 * HALF_OPEN --[successThreshold consecutive successes]----------> CLOSED
 * HALF_OPEN --[any failure]-------------------------------------> OPEN
 * </pre>
 *
 * There is no timer: OPEN -> HALF_OPEN is evaluated lazily by {@link #canAttempt()},
 * {@link #getState()} and {@link #getStats()}, so those reads may mutate state.
 *
 * All mutations are serialized on the instance. Transitions are handed to the
 * {@link CircuitTransitionListener} after the lock is released.
 */
public final class FailureTracker {

    private static final Logger log = LoggerFactory.getLogger(FailureTracker.class);

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final CircuitTransitionListener listener;

    private CircuitState state = CircuitState.CLOSED;
    private final ArrayDeque<Long> failureTimestamps = new ArrayDeque<>();
    private int consecutiveSuccesses;
    private Long openedAt;
    private Long lastFailureAt;
    private Long lastSuccessAt;

    private long totalRequests;
    private long totalFailures;
    private long totalSuccesses;
    private long timesOpened;

    public FailureTracker(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC(), CircuitTransitionListener.NOOP);
    }

    public FailureTracker(CircuitBreakerConfig config, Clock clock, CircuitTransitionListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = listener == null ? CircuitTransitionListener.NOOP : listener;
    }

    public String name() {
        return config.name();
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    /**
     * True when a call may be attempted now. May move OPEN to HALF_OPEN.
     */
    public boolean canAttempt() {
        CircuitTransition transition;
        boolean allowed;
        synchronized (this) {
            long now = clock.millis();
            transition = refresh(now);
            allowed = state != CircuitState.OPEN;
        }
        publish(transition);
        return allowed;
    }

    public void recordSuccess() {
        CircuitTransition transition = null;
        synchronized (this) {
            long now = clock.millis();
            totalSuccesses++;
            lastSuccessAt = now;
            consecutiveSuccesses++;
            if (state == CircuitState.HALF_OPEN && consecutiveSuccesses >= config.successThreshold()) {
                transition = transitionTo(CircuitState.CLOSED, CircuitTransition.Cause.RECOVERED, now);
            }
        }
        publish(transition);
    }

    public void recordFailure() {
        CircuitTransition transition = null;
        synchronized (this) {
            long now = clock.millis();
            totalFailures++;
            lastFailureAt = now;
            failureTimestamps.addLast(now);
            consecutiveSuccesses = 0;
            prune(now);

            if (state == CircuitState.HALF_OPEN) {
                transition = transitionTo(CircuitState.OPEN, CircuitTransition.Cause.TRIAL_FAILED, now);
            } else if (state == CircuitState.CLOSED && failureTimestamps.size() >= config.failureThreshold()) {
                transition = transitionTo(CircuitState.OPEN, CircuitTransition.Cause.FAILURE_THRESHOLD, now);
            }
        }
        publish(transition);
    }

    /**
     * Administrative override. Forcing OPEN starts a fresh reset timeout; any other state clears openedAt.
     * Forcing HALF_OPEN starts the trial with no successes counted.
     */
    public void forceState(CircuitState target) {
        Objects.requireNonNull(target, "target");
        CircuitTransition transition;
        synchronized (this) {
            long now = clock.millis();
            CircuitState from = state;
            state = target;
            openedAt = target == CircuitState.OPEN ? now : null;
            if (target == CircuitState.HALF_OPEN) consecutiveSuccesses = 0;
            transition = new CircuitTransition(name(), from, target, CircuitTransition.Cause.FORCED,
                    Instant.ofEpochMilli(now), failureTimestamps.size());
        }
        publish(transition);
    }

    /**
     * Back to CLOSED with an empty window. Lifetime counters are kept.
     */
    public void reset() {
        CircuitTransition transition;
        synchronized (this) {
            long now = clock.millis();
            CircuitState from = state;
            state = CircuitState.CLOSED;
            failureTimestamps.clear();
            consecutiveSuccesses = 0;
            openedAt = null;
            transition = new CircuitTransition(name(), from, CircuitState.CLOSED, CircuitTransition.Cause.RESET,
                    Instant.ofEpochMilli(now), 0);
        }
        publish(transition);
    }

    /**
     * Current state after the lazy OPEN -> HALF_OPEN check (not a pure read).
     */
    public CircuitState getState() {
        CircuitTransition transition;
        CircuitState current;
        synchronized (this) {
            transition = refresh(clock.millis());
            current = state;
        }
        publish(transition);
        return current;
    }

    /**
     * Snapshot after the lazy OPEN -> HALF_OPEN check (not a pure read).
     */
    public CircuitStats getStats() {
        CircuitTransition transition;
        CircuitStats stats;
        synchronized (this) {
            transition = refresh(clock.millis());
            stats = new CircuitStats(
                    name(),
                    state,
                    failureTimestamps.size(),
                    consecutiveSuccesses,
                    toInstant(lastFailureAt),
                    toInstant(lastSuccessAt),
                    toInstant(openedAt),
                    totalRequests,
                    totalFailures,
                    totalSuccesses,
                    timesOpened
            );
        }
        publish(transition);
        return stats;
    }

    /**
     * Counts a request and decides whether it may proceed, in one step.
     */
    Admission admit() {
        CircuitTransition transition;
        Admission admission;
        synchronized (this) {
            long now = clock.millis();
            totalRequests++;
            transition = refresh(now);
            admission = state == CircuitState.OPEN
                    ? new Admission(false, retryAfterMs(now))
                    : new Admission(true, 0);
        }
        publish(transition);
        return admission;
    }

    record Admission(boolean allowed, long retryAfterMs) {}

    // --- state machine, caller holds the lock ---

    private CircuitTransition refresh(long now) {
        prune(now);
        if (state == CircuitState.OPEN && openedAt != null && now - openedAt >= config.resetTimeoutMs()) {
            return transitionTo(CircuitState.HALF_OPEN, CircuitTransition.Cause.RESET_TIMEOUT, now);
        }
        return null;
    }

    private void prune(long now) {
        long cutoff = now - config.failureWindowMs();
        while (!failureTimestamps.isEmpty() && failureTimestamps.peekFirst() <= cutoff) {
            failureTimestamps.pollFirst();
        }
    }

    private CircuitTransition transitionTo(CircuitState target, CircuitTransition.Cause cause, long now) {
        CircuitState from = state;
        state = target;
        switch (target) {
            case OPEN -> {
                openedAt = now;
                timesOpened++;
            }
            case CLOSED -> {
                openedAt = null;
                failureTimestamps.clear();
                consecutiveSuccesses = 0;
            }
            case HALF_OPEN -> consecutiveSuccesses = 0;
        }
        return new CircuitTransition(name(), from, target, cause, Instant.ofEpochMilli(now), failureTimestamps.size());
    }

    private long retryAfterMs(long now) {
        if (openedAt == null) return 0;
        return Math.max(0, config.resetTimeoutMs() - (now - openedAt));
    }

    private static Instant toInstant(Long millis) {
        return millis == null ? null : Instant.ofEpochMilli(millis);
    }

    private void publish(CircuitTransition transition) {
        if (transition == null) return;
        try {
            listener.onTransition(transition);
        } catch (RuntimeException e) {
            log.error("Circuit transition listener failed for {}: {}", transition.circuit(), e.toString());
        }
    }
}
