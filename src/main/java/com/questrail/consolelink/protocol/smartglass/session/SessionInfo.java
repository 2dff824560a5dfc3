package com.questrail.consolelink.protocol.smartglass.session;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of an established session.
 *
 * @param participantId participant id assigned by the console in its connect response
 * @param deviceId      device id this client generated for the connection attempt
 */
public record SessionInfo(int participantId, UUID deviceId) {

    public SessionInfo {
        Objects.requireNonNull(deviceId, "deviceId");
    }
}
