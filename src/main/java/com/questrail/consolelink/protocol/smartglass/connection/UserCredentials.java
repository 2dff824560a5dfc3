package com.questrail.consolelink.protocol.smartglass.connection;

import java.util.Objects;

/**
 * Account credentials presented during the handshake.
 *
 * <p>Both values are opaque to this client. Connecting without credentials
 * is anonymous.</p>
 */
public record UserCredentials(String userHash, String authorization) {

    public UserCredentials {
        Objects.requireNonNull(userHash, "userHash");
        Objects.requireNonNull(authorization, "authorization");
    }

    @Override
    public String toString() {
        return "UserCredentials[userHash=" + userHash + ", authorization=<redacted>]";
    }
}
