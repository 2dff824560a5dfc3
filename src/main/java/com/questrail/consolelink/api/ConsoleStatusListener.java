package com.questrail.consolelink.api;

/**
 * Receives console status snapshots.
 *
 * <p>Invoked synchronously on the inbound dispatch path, in arrival order.
 * Implementations must return promptly.</p>
 */
@FunctionalInterface
public interface ConsoleStatusListener
{
    void onConsoleStatusChanged(ConsoleStatus status);
}
