package com.protocolguide.application.resilience;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FailureTrackerTest {

    private final MutableClock clock = new MutableClock(0);
    private final List<CircuitTransition> transitions = new CopyOnWriteArrayList<>();

    private FailureTracker tracker(int failures, int successes, long resetMs, long windowMs) {
        return new FailureTracker(new CircuitBreakerConfig("db", failures, successes, resetMs, windowMs),
                clock, transitions::add);
    }

    @Test
    void opensAfterThresholdFailuresInsideWindow() {
        FailureTracker t = tracker(5, 3, 30_000, 60_000);

        for (int i = 0; i < 5; i++) {
            assertThat(t.canAttempt()).isTrue();
            t.recordFailure();
            clock.advance(2_000);
        }

        assertThat(t.canAttempt()).isFalse();
        assertThat(t.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(transitions).hasSize(1);
        assertThat(transitions.get(0).cause()).isEqualTo(CircuitTransition.Cause.FAILURE_THRESHOLD);
        assertThat(transitions.get(0).windowFailures()).isEqualTo(5);
    }

    @Test
    void staleFailuresOutsideWindowDoNotCount() {
        FailureTracker t = tracker(3, 1, 30_000, 10_000);

        t.recordFailure();
        t.recordFailure();
        clock.advance(10_000);
        t.recordFailure();

        assertThat(t.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(t.getStats().failures()).isEqualTo(1);
    }

    @Test
    void halfOpenExactlyAtResetTimeout() {
        FailureTracker t = tracker(1, 2, 30_000, 60_000);
        t.recordFailure();
        assertThat(t.getState()).isEqualTo(CircuitState.OPEN);

        clock.setMillis(29_999);
        assertThat(t.canAttempt()).isFalse();

        clock.setMillis(30_000);
        assertThat(t.canAttempt()).isTrue();
        assertThat(t.getState()).isEqualTo(CircuitState.HALF_OPEN);
    }

    @Test
    void halfOpenClosesAfterConsecutiveSuccesses() {
        FailureTracker t = tracker(1, 2, 1_000, 60_000);
        t.recordFailure();
        clock.advance(1_000);
        assertThat(t.canAttempt()).isTrue();

        t.recordSuccess();
        assertThat(t.getState()).isEqualTo(CircuitState.HALF_OPEN);
        t.recordSuccess();

        CircuitStats stats = t.getStats();
        assertThat(stats.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(stats.failures()).isZero();
        assertThat(stats.openedAt()).isNull();
        assertThat(transitions).extracting(CircuitTransition::cause).containsExactly(
                CircuitTransition.Cause.FAILURE_THRESHOLD,
                CircuitTransition.Cause.RESET_TIMEOUT,
                CircuitTransition.Cause.RECOVERED);
    }

    @Test
    void halfOpenFailureReopensWithFreshOpenedAt() {
        FailureTracker t = tracker(1, 3, 1_000, 60_000);
        t.recordFailure();
        clock.setMillis(1_000);
        assertThat(t.canAttempt()).isTrue();

        t.recordSuccess();
        clock.setMillis(1_500);
        t.recordFailure();

        CircuitStats stats = t.getStats();
        assertThat(stats.state()).isEqualTo(CircuitState.OPEN);
        assertThat(stats.openedAt()).isEqualTo(Instant.ofEpochMilli(1_500));
        assertThat(stats.timesOpened()).isEqualTo(2);

        clock.setMillis(2_499);
        assertThat(t.canAttempt()).isFalse();
    }

    @Test
    void successInClosedDoesNotClearWindow() {
        FailureTracker t = tracker(3, 1, 1_000, 60_000);
        t.recordFailure();
        t.recordFailure();
        t.recordSuccess();
        t.recordFailure();

        assertThat(t.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void forceStateKeepsFailuresAndResetClearsThem() {
        FailureTracker t = tracker(5, 1, 1_000, 60_000);
        t.recordFailure();
        t.recordFailure();

        t.forceState(CircuitState.OPEN);
        assertThat(t.canAttempt()).isFalse();
        assertThat(t.getStats().failures()).isEqualTo(2);

        t.reset();
        CircuitStats stats = t.getStats();
        assertThat(stats.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(stats.failures()).isZero();
        assertThat(stats.totalFailures()).isEqualTo(2);
        assertThat(transitions).extracting(CircuitTransition::cause)
                .containsExactly(CircuitTransition.Cause.FORCED, CircuitTransition.Cause.RESET);
        assertThat(transitions).allMatch(CircuitTransition::administrative);
    }

    @Test
    void forcedHalfOpenStartsTrialFromZeroSuccesses() {
        FailureTracker t = tracker(5, 2, 30_000, 60_000);
        t.recordSuccess();
        t.recordSuccess();
        t.recordSuccess();

        t.forceState(CircuitState.HALF_OPEN);
        assertThat(t.getStats().successes()).isZero();

        t.recordSuccess();
        assertThat(t.getState()).isEqualTo(CircuitState.HALF_OPEN);
        t.recordSuccess();
        assertThat(t.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void throwingListenerDoesNotBreakTracker() {
        FailureTracker t = new FailureTracker(new CircuitBreakerConfig("ai", 1, 1, 1_000, 1_000), clock,
                tr -> { throw new IllegalStateException("boom"); });

        t.recordFailure();

        assertThat(t.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void rejectsInvalidConfig() {
        assertThatThrownBy(() -> new CircuitBreakerConfig("x", 0, 1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CircuitBreakerConfig(" ", 1, 1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentFailuresAreAllRegistered() throws Exception {
        FailureTracker t = tracker(500, 1, 1_000, 60_000);
        int threads = 8;
        int perThread = 100;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int i = 0; i < threads; i++) {
                pool.submit(() -> {
                    start.await();
                    for (int j = 0; j < perThread; j++) t.recordFailure();
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        CircuitStats stats = t.getStats();
        assertThat(stats.totalFailures()).isEqualTo(threads * perThread);
        assertThat(stats.state()).isEqualTo(CircuitState.OPEN);
        assertThat(stats.timesOpened()).isEqualTo(1);
    }
}
