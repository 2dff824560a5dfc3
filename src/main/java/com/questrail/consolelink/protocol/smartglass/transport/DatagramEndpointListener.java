package com.questrail.consolelink.protocol.smartglass.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>All callbacks must be delivered serialized. Netty endpoints deliver them
 * on the channel's event loop.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * Called when the endpoint is bound and usable.
     */
    void onTransportUp();

    /**
     * Called when the endpoint becomes unusable.
     *
     * @param cause an exception or diagnostic cause; may be {@code null} for
     *              orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called when a datagram is received.
     *
     * <p>The payload is a full datagram copied out of any framework buffer.</p>
     *
     * @param remote remote sender endpoint
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
