package com.questrail.consolelink.protocol.smartglass.model;

import com.questrail.consolelink.api.GamepadState;

import java.util.Objects;

/**
 * Gamepad snapshot sent on the input channel.
 *
 * @param timestamp milliseconds since the epoch at which the snapshot was taken
 * @param state     the snapshot
 */
public record GamepadMessage(
        long timestamp,
        GamepadState state
) implements SessionMessage {

    public GamepadMessage {
        Objects.requireNonNull(state, "state");
    }
}
