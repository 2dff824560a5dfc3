package com.questrail.consolelink.protocol.smartglass.connection;

import com.questrail.consolelink.protocol.smartglass.ConsoleLinkException;

import java.util.OptionalInt;

/**
 * The handshake did not produce a session.
 *
 * <p>Either no reply arrived within the retry schedule, or the console
 * replied with a non-zero result code.</p>
 */
public final class ConnectionFailedException extends ConsoleLinkException {

    private final int attempts;
    private final Integer resultCode;

    /**
     * No reply after {@code attempts} attempts.
     */
    public ConnectionFailedException(int attempts, Throwable lastFailure) {
        super("Console did not answer the connect request after " + attempts + " attempt(s)", lastFailure);
        this.attempts = attempts;
        this.resultCode = null;
    }

    /**
     * The console rejected the connection.
     */
    public ConnectionFailedException(int attempts, int resultCode) {
        super("Console rejected the connect request with result code " + resultCode);
        this.attempts = attempts;
        this.resultCode = resultCode;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * Result code of the rejecting response; empty when the console never answered.
     */
    public OptionalInt resultCode() {
        return resultCode == null ? OptionalInt.empty() : OptionalInt.of(resultCode);
    }
}
