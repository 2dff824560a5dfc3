package com.questrail.consolelink.protocol.smartglass.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a protocol milestone in the client.
 */
public record ConsoleProtocolEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        HANDSHAKE_ATTEMPT,
        HANDSHAKE_RETRY,
        SESSION_ESTABLISHED,
        LOCAL_JOIN_SENT,
        CHANNEL_OPENED,
        CHANNEL_OPEN_FAILED,
        WAIT_TIMEOUT
    }

    public ConsoleProtocolEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }
}
