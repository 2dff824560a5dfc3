package com.questrail.consolelink.protocol.smartglass.internal.exec;

import com.questrail.consolelink.protocol.smartglass.internal.time.MonotonicClock;
import com.questrail.consolelink.protocol.smartglass.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retries
 * =============================================================================
 * Generic "retry until success or schedule exhausted" combinator.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>The attempt supplier is invoked once up front and once per retry; it
 *       builds fresh request state every time.</li>
 *   <li>Only failures accepted by {@code retryable} trigger a retry. Any other
 *       failure completes the result immediately.</li>
 *   <li>After a retryable failure the next attempt is scheduled on the
 *       {@link MonotonicScheduler} after the next delay in the schedule; no
 *       thread sleeps.</li>
 *   <li>When the schedule is exhausted the last failure is propagated
 *       unchanged; callers translate it.</li>
 *   <li>If the scheduler rejects the next attempt, the result fails with the
 *       rejection, carrying the last attempt failure as suppressed.</li>
 *   <li>Completing or cancelling the returned future stops further attempts.</li>
 * </ul>
 */
public final class Retries {

    /**
     * Notified before each retry is scheduled.
     */
    @FunctionalInterface
    public interface RetryObserver {
        /**
         * @param nextAttempt 1-based number of the attempt about to be scheduled
         * @param delay       pause before that attempt starts
         * @param failure     unwrapped failure of the previous attempt
         */
        void onRetry(int nextAttempt, Duration delay, Throwable failure);
    }

    private Retries() {
    }

    public static <T> CompletableFuture<T> withRetries(Supplier<CompletableFuture<T>> attempt,
                                                       RetrySchedule schedule,
                                                       Predicate<Throwable> retryable,
                                                       MonotonicClock clock,
                                                       MonotonicScheduler scheduler,
                                                       RetryObserver observer) {
        Objects.requireNonNull(attempt, "attempt");
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(retryable, "retryable");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(observer, "observer");

        CompletableFuture<T> result = new CompletableFuture<>();
        new Run<>(attempt, schedule.delays(), retryable, clock, scheduler, observer, result).attempt(0);
        return result;
    }

    private record Run<T>(Supplier<CompletableFuture<T>> attempt,
                          List<Duration> delays,
                          Predicate<Throwable> retryable,
                          MonotonicClock clock,
                          MonotonicScheduler scheduler,
                          RetryObserver observer,
                          CompletableFuture<T> result) {

        void attempt(int retriesUsed) {
            if (result.isDone()) {
                return;
            }

            CompletableFuture<T> pending;
            try {
                pending = attempt.get();
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return;
            }

            pending.whenComplete((value, failure) -> {
                if (failure == null) {
                    result.complete(value);
                    return;
                }

                Throwable cause = Futures.unwrap(failure);
                if (!retryable.test(cause) || retriesUsed >= delays.size()) {
                    result.completeExceptionally(cause);
                    return;
                }

                Duration delay = delays.get(retriesUsed);
                observer.onRetry(retriesUsed + 2, delay, cause);
                try {
                    scheduler.scheduleAfter(delay, clock, () -> attempt(retriesUsed + 1));
                } catch (RuntimeException e) {
                    e.addSuppressed(cause);
                    result.completeExceptionally(e);
                }
            });
        }
    }
}
