package com.questrail.consolelink.protocol.smartglass.observability;

/**
 * Receives observability events from the client stack.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on whichever thread produced the event (inbound
 * dispatch, scheduler, or caller) and must not block.</p>
 */
public interface ConsoleObservabilitySink {
    /**
     * Called for handshake, session and channel milestones (attempts, retries,
     * established sessions, opened channels, reply timeouts).
     * @param event the protocol event
     */
    void onProtocolEvent(ConsoleProtocolEvent event);

    /**
     * Called when a transport-level event occurs (start, loss, close, dropped datagram).
     * @param event the transport event
     */
    void onTransportEvent(ConsoleTransportEvent event);

    /**
     * Called when a failure cannot be surfaced to a caller: fire-and-forget
     * sends, listener callbacks and disposal steps.
     * @param event the error event
     */
    void onError(ConsoleErrorEvent event);
}
