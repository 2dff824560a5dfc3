package com.questrail.consolelink.protocol.smartglass.internal.exec;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * RetrySchedule
 * -----------------------------------------------------------------------------
 * Fixed, ordered list of delays between successive attempts.
 *
 * <p>Entry {@code i} is the pause after attempt {@code i + 1} fails and before
 * attempt {@code i + 2} starts, so a schedule of {@code n} delays permits
 * {@code n + 1} attempts. The schedule is data; {@link Retries} consumes it.</p>
 */
public record RetrySchedule(List<Duration> delays) {

    public RetrySchedule {
        Objects.requireNonNull(delays, "delays");
        delays = List.copyOf(delays);
        for (Duration delay : delays) {
            if (delay.isNegative()) {
                throw new IllegalArgumentException("retry delays must be non-negative: " + delay);
            }
        }
    }

    public static RetrySchedule of(Duration... delays) {
        return new RetrySchedule(List.of(delays));
    }

    /**
     * A schedule that never retries.
     */
    public static RetrySchedule none() {
        return new RetrySchedule(List.of());
    }

    /**
     * Total number of attempts this schedule allows, including the first.
     */
    public int maxAttempts() {
        return delays.size() + 1;
    }
}
