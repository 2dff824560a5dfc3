package com.questrail.consolelink.protocol.smartglass.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational deadline in the client: reply timeouts,
 * handshake retry spacing and optional-message waits.
 *
 * <h2>Binding invariant</h2>
 * A reply wait's deadline is computed from this clock at the moment the wait
 * is registered, never from wall-clock time and never from the moment the
 * transport came up.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
