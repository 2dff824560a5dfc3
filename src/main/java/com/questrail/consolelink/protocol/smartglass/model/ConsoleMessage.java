package com.questrail.consolelink.protocol.smartglass.model;

/**
 * Canonical semantic representation of a message exchanged with the console.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code ConsoleMessage} is the only form of message the orchestration layer
 * (correlation, session dispatch, channels) reasons about. Wire framing,
 * field encoding and per-message encryption are resolved by the transport's
 * codec <em>before</em> an instance is created.
 * </p>
 *
 * <h2>Shape</h2>
 * <ul>
 *   <li>{@link ConnectRequest} / {@link ConnectResponse}: the handshake pair,
 *       exchanged before a session exists</li>
 *   <li>{@link SessionFrame}: every message of an established session, stamped
 *       with participant and channel context</li>
 * </ul>
 */
public sealed interface ConsoleMessage
        permits ConnectRequest, ConnectResponse, SessionFrame {
}
