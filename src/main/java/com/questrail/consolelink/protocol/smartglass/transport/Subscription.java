package com.questrail.consolelink.protocol.smartglass.transport;

/**
 * Handle for a registered subscriber or listener. Closing it unregisters;
 * closing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable
{
    @Override
    void close();
}
