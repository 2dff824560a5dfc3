package com.questrail.consolelink.protocol.smartglass.transport;

import com.questrail.consolelink.protocol.smartglass.model.ConsoleMessage;

/**
 * MessageTransport
 * -----------------------------------------------------------------------------
 * Port for the raw, encrypted message transport to one console.
 *
 * <p>Accepts pre-built {@link ConsoleMessage}s for transmission and emits
 * received messages as they are decoded. Framing, field encoding and
 * encryption live behind this port.</p>
 *
 * <p>Implementations must deliver listener callbacks serialized and in
 * arrival order.</p>
 */
public interface MessageTransport
{
    /**
     * Register the listener for inbound messages and lifecycle events.
     * Must be called before {@link #start()}.
     */
    void setListener(MessageTransportListener listener);

    /**
     * Make the transport usable. Returns once outbound sends can be delivered,
     * or throws if that is impossible.
     */
    void start();

    /**
     * Transmit a message. Side effect only; no reply is awaited.
     */
    void send(ConsoleMessage message);

    /**
     * Release all transport resources. Idempotent.
     */
    void close();
}
