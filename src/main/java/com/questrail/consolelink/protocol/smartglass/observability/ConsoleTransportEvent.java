package com.questrail.consolelink.protocol.smartglass.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a transport lifecycle change or defect.
 *
 * @param cause diagnostic cause; {@code null} for orderly transitions
 */
public record ConsoleTransportEvent(
    Instant timestamp,
    Kind kind,
    String detail,
    Throwable cause
) {
    public enum Kind {
        STARTED,
        DOWN,
        CLOSED,
        DATAGRAM_DROPPED
    }

    public ConsoleTransportEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }
}
