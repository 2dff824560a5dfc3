package com.questrail.consolelink.protocol.smartglass.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a scheduled deadline or delayed retry.
 *
 * <p>Reply waits cancel their deadline when a matching message arrives;
 * the handshake never cancels a scheduled retry, it simply completes.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
