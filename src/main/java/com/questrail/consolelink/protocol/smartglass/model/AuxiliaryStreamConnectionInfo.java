package com.questrail.consolelink.protocol.smartglass.model;

import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Connection details for a title's auxiliary stream.
 *
 * <p>Key material is opaque to this layer and handed to whoever opens the
 * stream.</p>
 */
public record AuxiliaryStreamConnectionInfo(
        byte[] cryptoKey,
        byte[] serverInitVector,
        byte[] clientInitVector,
        byte[] signHash,
        List<InetSocketAddress> endpoints
) implements SessionMessage {

    public AuxiliaryStreamConnectionInfo {
        cryptoKey = Objects.requireNonNull(cryptoKey, "cryptoKey").clone();
        serverInitVector = Objects.requireNonNull(serverInitVector, "serverInitVector").clone();
        clientInitVector = Objects.requireNonNull(clientInitVector, "clientInitVector").clone();
        signHash = Objects.requireNonNull(signHash, "signHash").clone();
        endpoints = List.copyOf(endpoints);
    }

    @Override
    public byte[] cryptoKey() {
        return cryptoKey.clone();
    }

    @Override
    public byte[] serverInitVector() {
        return serverInitVector.clone();
    }

    @Override
    public byte[] clientInitVector() {
        return clientInitVector.clone();
    }

    @Override
    public byte[] signHash() {
        return signHash.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof AuxiliaryStreamConnectionInfo other
                && Arrays.equals(cryptoKey, other.cryptoKey)
                && Arrays.equals(serverInitVector, other.serverInitVector)
                && Arrays.equals(clientInitVector, other.clientInitVector)
                && Arrays.equals(signHash, other.signHash)
                && endpoints.equals(other.endpoints);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(cryptoKey);
        result = 31 * result + Arrays.hashCode(serverInitVector);
        result = 31 * result + Arrays.hashCode(clientInitVector);
        result = 31 * result + Arrays.hashCode(signHash);
        return 31 * result + endpoints.hashCode();
    }

    // Key material stays out of logs.
    @Override
    public String toString() {
        return "AuxiliaryStreamConnectionInfo[endpoints=" + endpoints + "]";
    }
}
