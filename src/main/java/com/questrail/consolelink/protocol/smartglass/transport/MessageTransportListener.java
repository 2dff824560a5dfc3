package com.questrail.consolelink.protocol.smartglass.transport;

import com.questrail.consolelink.protocol.smartglass.model.ConsoleMessage;

/**
 * Callback sink for {@link MessageTransport}.
 */
public interface MessageTransportListener
{
    /**
     * Called for every decoded inbound message, in arrival order.
     * Must not block.
     */
    void onMessage(ConsoleMessage message);

    /**
     * Called when the transport becomes unusable.
     *
     * @param cause the failure, or {@code null} for an orderly shutdown
     */
    void onTransportDown(Throwable cause);
}
