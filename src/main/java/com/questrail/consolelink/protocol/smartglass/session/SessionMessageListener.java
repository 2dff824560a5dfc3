package com.questrail.consolelink.protocol.smartglass.session;

import com.questrail.consolelink.protocol.smartglass.model.SessionFrame;

/**
 * Receives every inbound session frame, correlated or not.
 *
 * <p>Invoked synchronously on the dispatch path in arrival order.</p>
 */
@FunctionalInterface
public interface SessionMessageListener
{
    void onMessage(SessionFrame frame);
}
