package com.protocolguide.application.resilience;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs calls against one external dependency through its {@link FailureTracker}.
 *
 * Rules:
 * - rejected attempt: fallback result if one is given, otherwise {@link CircuitOpenException}
 * - admitted attempt that fails: failure recorded, original exception re-raised unchanged
 * - the fallback never replaces the result of an admitted attempt
 * - exceptions the predicate does not classify as dependency failures are re-raised
 *   without touching the tracker (e.g. a unique-constraint violation is a valid answer
 *   from the store, not an outage)
 *
 * Timeouts are the caller's responsibility.
 */
public final class GuardedCall {

    private final FailureTracker tracker;
    private final Predicate<Throwable> recordFailure;

    public GuardedCall(FailureTracker tracker) {
        this(tracker, t -> true);
    }

    public GuardedCall(FailureTracker tracker, Predicate<Throwable> recordFailure) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.recordFailure = Objects.requireNonNull(recordFailure, "recordFailure");
    }

    public String name() {
        return tracker.name();
    }

    public FailureTracker tracker() {
        return tracker;
    }

    public <T> T call(Supplier<T> operation) {
        return call(operation, null);
    }

    public <T> T call(Supplier<T> operation, Supplier<T> fallback) {
        Objects.requireNonNull(operation, "operation");

        FailureTracker.Admission admission = tracker.admit();
        if (!admission.allowed()) {
            if (fallback != null) return fallback.get();
            throw new CircuitOpenException(name(), admission.retryAfterMs());
        }

        T result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            onFailure(e);
            throw e;
        }
        tracker.recordSuccess();
        return result;
    }

    public void run(Runnable operation) {
        Objects.requireNonNull(operation, "operation");
        call(() -> {
            operation.run();
            return null;
        });
    }

    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> operation) {
        return execute(operation, null);
    }

    /**
     * Asynchronous form. The returned future is independent of the operation's own stage:
     * cancelling it does not un-record an outcome already observed.
     */
    public <T> CompletableFuture<T> execute(
            Supplier<? extends CompletionStage<T>> operation,
            Supplier<? extends CompletionStage<T>> fallback
    ) {
        Objects.requireNonNull(operation, "operation");

        FailureTracker.Admission admission = tracker.admit();
        if (!admission.allowed()) {
            if (fallback == null) {
                return CompletableFuture.failedFuture(new CircuitOpenException(name(), admission.retryAfterMs()));
            }
            try {
                return fallback.get().toCompletableFuture();
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(operation.get(), "operation returned null stage");
        } catch (RuntimeException e) {
            onFailure(e);
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                tracker.recordSuccess();
                result.complete(value);
            } else {
                Throwable cause = unwrap(error);
                onFailure(cause);
                result.completeExceptionally(cause);
            }
        });
        return result;
    }

    private void onFailure(Throwable error) {
        if (recordFailure.test(error)) {
            tracker.recordFailure();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
