package com.questrail.consolelink.protocol.smartglass.channel;

import com.questrail.consolelink.api.GamepadState;
import com.questrail.consolelink.protocol.smartglass.internal.time.WallClock;
import com.questrail.consolelink.protocol.smartglass.model.GamepadMessage;

import java.util.Objects;

/**
 * The session's system input channel.
 */
public class InputChannel implements AutoCloseable {

    private final ChannelMessageTransport transport;
    private final WallClock wallClock;

    public InputChannel(ChannelMessageTransport transport, WallClock wallClock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public long channelId() {
        return transport.channelId();
    }

    /**
     * Send a full controller snapshot, timestamped in epoch milliseconds.
     */
    public void sendGamepadState(GamepadState state) {
        Objects.requireNonNull(state, "state");
        transport.send(new GamepadMessage(wallClock.now().toEpochMilli(), state));
    }

    @Override
    public void close() {
        transport.close();
    }
}
