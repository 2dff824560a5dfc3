package com.questrail.consolelink.protocol.smartglass.connection;

import com.questrail.consolelink.api.PairingState;
import com.questrail.consolelink.protocol.smartglass.crypto.CryptoContext;
import com.questrail.consolelink.protocol.smartglass.session.SessionInfo;

import java.util.Objects;

/**
 * Outcome of a successful handshake.
 */
public record ConnectionResult(SessionInfo sessionInfo, PairingState pairingState, CryptoContext cryptoContext) {

    public ConnectionResult {
        Objects.requireNonNull(sessionInfo, "sessionInfo");
        Objects.requireNonNull(pairingState, "pairingState");
        Objects.requireNonNull(cryptoContext, "cryptoContext");
    }
}
