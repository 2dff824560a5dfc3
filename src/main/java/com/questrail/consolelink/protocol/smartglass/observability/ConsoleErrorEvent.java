package com.questrail.consolelink.protocol.smartglass.observability;

import java.time.Instant;

/**
 * Record representing an error that was reported rather than thrown.
 */
public record ConsoleErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
