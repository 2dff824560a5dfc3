package com.questrail.consolelink.protocol.smartglass.model;

import com.questrail.consolelink.api.PairingState;

import java.util.Objects;

/**
 * Handshake response.
 *
 * @param result        zero on success, console-specific failure code otherwise
 * @param pairingState  pairing state of the connecting device
 * @param participantId participant id assigned to the new session
 */
public record ConnectResponse(
        int result,
        PairingState pairingState,
        int participantId
) implements ConsoleMessage {

    public ConnectResponse {
        Objects.requireNonNull(pairingState, "pairingState");
    }

    public boolean isSuccess() {
        return result == 0;
    }
}
