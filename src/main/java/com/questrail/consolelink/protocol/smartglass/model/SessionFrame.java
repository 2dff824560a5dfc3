package com.questrail.consolelink.protocol.smartglass.model;

import java.util.Objects;

/**
 * A session-scoped message stamped with its session context.
 *
 * <p>Outbound frames carry the local participant id; both directions carry
 * the channel id the payload belongs to ({@code 0} for the core channel).</p>
 */
public record SessionFrame(
        int participantId,
        long channelId,
        SessionMessage message
) implements ConsoleMessage {

    public SessionFrame {
        Objects.requireNonNull(message, "message");
        if (channelId < 0) {
            throw new IllegalArgumentException("channelId must be >= 0");
        }
    }
}
