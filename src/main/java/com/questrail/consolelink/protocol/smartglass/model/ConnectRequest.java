package com.questrail.consolelink.protocol.smartglass.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Handshake request.
 *
 * <p>The init vector and device id identify the connection attempt and are
 * identical across retries; the sequence triple advances with every attempt.</p>
 *
 * @param initVector     random init vector seeding the encrypted transport
 * @param deviceId       locally generated device identifier
 * @param userHash       optional account user hash (null when anonymous)
 * @param authorization  optional account authorization token (null when anonymous)
 * @param sequenceNumber sequence number of this attempt
 * @param sequenceBegin  first sequence number reserved by this attempt
 * @param sequenceEnd    last sequence number reserved by this attempt
 */
public record ConnectRequest(
        byte[] initVector,
        UUID deviceId,
        String userHash,
        String authorization,
        long sequenceNumber,
        long sequenceBegin,
        long sequenceEnd
) implements ConsoleMessage {

    public ConnectRequest {
        Objects.requireNonNull(initVector, "initVector");
        Objects.requireNonNull(deviceId, "deviceId");
        if (sequenceNumber < 0 || sequenceBegin < 0 || sequenceEnd < 0) {
            throw new IllegalArgumentException("sequence values are unsigned");
        }
        initVector = initVector.clone();
    }

    @Override
    public byte[] initVector() {
        return initVector.clone();
    }

    public Optional<String> userHashIfPresent() {
        return Optional.ofNullable(userHash);
    }

    public Optional<String> authorizationIfPresent() {
        return Optional.ofNullable(authorization);
    }

    /**
     * Content equality; the init vector is compared by value.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConnectRequest other)) {
            return false;
        }
        return sequenceNumber == other.sequenceNumber
                && sequenceBegin == other.sequenceBegin
                && sequenceEnd == other.sequenceEnd
                && Arrays.equals(initVector, other.initVector)
                && deviceId.equals(other.deviceId)
                && Objects.equals(userHash, other.userHash)
                && Objects.equals(authorization, other.authorization);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(deviceId, userHash, authorization, sequenceNumber, sequenceBegin, sequenceEnd);
        return 31 * result + Arrays.hashCode(initVector);
    }

    @Override
    public String toString() {
        return "ConnectRequest[deviceId=" + deviceId
                + ", userHash=" + userHash
                + ", authorization=" + (authorization == null ? "null" : "<redacted>")
                + ", sequenceNumber=" + sequenceNumber
                + ", sequenceBegin=" + sequenceBegin
                + ", sequenceEnd=" + sequenceEnd + "]";
    }
}
