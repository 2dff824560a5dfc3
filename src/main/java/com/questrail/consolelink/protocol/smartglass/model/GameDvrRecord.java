package com.questrail.consolelink.protocol.smartglass.model;

/**
 * Asks the console to record a game clip.
 *
 * <p>Deltas are in seconds relative to now; a negative start delta records
 * footage that already happened.</p>
 */
public record GameDvrRecord(
        int startTimeDelta,
        int endTimeDelta
) implements SessionMessage {
}
