package com.questrail.consolelink.protocol.smartglass.channel;

import com.questrail.consolelink.protocol.smartglass.model.AuxiliaryStreamConnectionInfo;
import com.questrail.consolelink.protocol.smartglass.model.AuxiliaryStreamHello;
import com.questrail.consolelink.protocol.smartglass.model.AuxiliaryStreamRequest;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A channel bound to one running title.
 *
 * <p>Titles that support an auxiliary stream greet a new channel with an
 * {@link AuxiliaryStreamHello}; titles that do not stay silent.</p>
 */
public final class TitleChannel implements AutoCloseable {

    private final ChannelMessageTransport transport;
    private final long titleId;
    private final AuxiliaryStreamHello hello;
    private final Duration auxiliaryStreamTimeout;

    /**
     * @param hello the greeting received after the open, or {@code null} if none arrived
     */
    public TitleChannel(ChannelMessageTransport transport,
                        long titleId,
                        AuxiliaryStreamHello hello,
                        Duration auxiliaryStreamTimeout) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.titleId = titleId;
        this.hello = hello;
        this.auxiliaryStreamTimeout = Objects.requireNonNull(auxiliaryStreamTimeout, "auxiliaryStreamTimeout");
    }

    public long channelId() {
        return transport.channelId();
    }

    public long titleId() {
        return titleId;
    }

    public Optional<AuxiliaryStreamHello> auxiliaryHello() {
        return Optional.ofNullable(hello);
    }

    /**
     * Ask the title for its auxiliary stream endpoints and keys.
     */
    public CompletableFuture<AuxiliaryStreamConnectionInfo> openAuxiliaryStream() {
        return transport.sendAndWait(
                () -> transport.send(new AuxiliaryStreamRequest()),
                AuxiliaryStreamConnectionInfo.class,
                info -> true,
                auxiliaryStreamTimeout);
    }

    @Override
    public void close() {
        transport.close();
    }
}
