/**
 * Console Transport Ports
 * =============================================================================
 *
 * These interfaces define the boundary between a concrete networking
 * implementation (Netty UDP, a simulator, or a test double) and the session
 * orchestration above it.
 *
 * <h2>Layers</h2>
 * <pre>
 *   byte[] datagram
 *        → DatagramEndpoint            (socket I/O only)
 *            → DatagramMessageTransport (MessageCodec: decrypt + decode)
 *                → CorrelatedMessageTransport (replies matched to waits,
 *                                              everything else broadcast)
 *                    → session dispatcher / channels
 * </pre>
 *
 * <h2>Netty containment</h2>
 * Netty types MUST NOT escape {@code transport.udp.netty}. Everything above
 * the endpoint sees only {@code byte[]} payloads, {@link java.net.SocketAddress}
 * peers and up/down notifications.
 *
 * <p>Endpoints and message transports never retry, time out or interpret
 * messages; correlation and deadlines live in
 * {@link com.questrail.consolelink.protocol.smartglass.transport.CorrelatedMessageTransport}.</p>
 */
package com.questrail.consolelink.protocol.smartglass.transport;
