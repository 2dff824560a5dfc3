package com.questrail.consolelink.protocol.smartglass.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for observability timestamps and gamepad snapshot
 * timestamps.
 *
 * <p>It MUST NOT be used for deadlines or retry spacing; those use
 * {@link MonotonicClock}.</p>
 */
public interface WallClock
{
    Instant now();
}
