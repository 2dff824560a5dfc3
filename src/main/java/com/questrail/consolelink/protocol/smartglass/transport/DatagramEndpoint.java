package com.questrail.consolelink.protocol.smartglass.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>{@link DatagramMessageTransport} sits above it: encoding outbound
 * messages, decoding inbound datagrams and forwarding the results.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind the endpoint and begin receiving datagrams. Returns once bound.
     *
     * <p>On success the listener is notified via
     * {@link DatagramEndpointListener#onTransportUp()}; if binding fails the
     * listener is notified via {@link DatagramEndpointListener#onTransportDown(Throwable)}
     * and this method throws.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint.
     *
     * @param remote remote destination
     * @param payload datagram payload
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}
