package com.questrail.consolelink.protocol.smartglass.config;

import com.questrail.consolelink.protocol.smartglass.internal.exec.RetrySchedule;

import java.time.Duration;
import java.util.Objects;

/**
 * ConsoleTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the client: reply windows and handshake backoff.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b>: window for a single handshake attempt.</li>
 *   <li><b>connectRetries</b>: pauses between handshake attempts; a handshake
 *       makes at most {@code connectRetries.maxAttempts()} attempts.</li>
 *   <li><b>channelOpenTimeout</b>: window for a start-channel response. Channel
 *       opens are never retried.</li>
 *   <li><b>auxiliaryHelloTimeout</b>: how long a new title channel waits for
 *       the optional auxiliary-stream hello.</li>
 *   <li><b>auxiliaryStreamTimeout</b>: window for auxiliary stream connection
 *       details after a request.</li>
 * </ul>
 */
public record ConsoleTimingPolicy(
        Duration connectTimeout,
        RetrySchedule connectRetries,
        Duration channelOpenTimeout,
        Duration auxiliaryHelloTimeout,
        Duration auxiliaryStreamTimeout
) {
    public ConsoleTimingPolicy {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(connectRetries, "connectRetries");
        Objects.requireNonNull(channelOpenTimeout, "channelOpenTimeout");
        Objects.requireNonNull(auxiliaryHelloTimeout, "auxiliaryHelloTimeout");
        Objects.requireNonNull(auxiliaryStreamTimeout, "auxiliaryStreamTimeout");

        requirePositive("connectTimeout", connectTimeout);
        requirePositive("channelOpenTimeout", channelOpenTimeout);
        requirePositive("auxiliaryStreamTimeout", auxiliaryStreamTimeout);
        if (auxiliaryHelloTimeout.isNegative()) {
            throw new IllegalArgumentException("auxiliaryHelloTimeout must be non-negative");
        }
    }

    /**
     * Protocol defaults.
     *
     * <ul>
     *   <li>connectTimeout: 1s</li>
     *   <li>connectRetries: 500ms, 500ms, 1500ms, 5000ms (five attempts)</li>
     *   <li>channelOpenTimeout: 1s</li>
     *   <li>auxiliaryHelloTimeout: 1s</li>
     *   <li>auxiliaryStreamTimeout: 1s</li>
     * </ul>
     */
    public static ConsoleTimingPolicy defaults() {
        return new ConsoleTimingPolicy(
                Duration.ofSeconds(1),
                RetrySchedule.of(
                        Duration.ofMillis(500),
                        Duration.ofMillis(500),
                        Duration.ofMillis(1500),
                        Duration.ofSeconds(5)
                ),
                Duration.ofSeconds(1),
                Duration.ofSeconds(1),
                Duration.ofSeconds(1)
        );
    }

    private static void requirePositive(String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
