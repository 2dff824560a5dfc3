package com.questrail.consolelink.protocol.smartglass.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Absolute deadlines are converted to relative delays with the supplied
 * {@link MonotonicClock}; callers must compute their deadlines from the same
 * clock instance (normally {@link SystemMonotonicClock#INSTANCE}).</p>
 *
 * <p>Reply timeouts and handshake retries fire on the executor's thread, so
 * any continuation chained to a timed-out wait runs there too.</p>
 *
 * <p>The executor is not owned: callers shut it down.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Past deadlines run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
