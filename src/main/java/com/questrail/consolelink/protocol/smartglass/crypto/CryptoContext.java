package com.questrail.consolelink.protocol.smartglass.crypto;

/**
 * Opaque encryption capability for one console.
 *
 * <p>Owned by the connection that created it and handed to the transport;
 * the orchestration layer never looks inside. Key agreement and cipher
 * details belong to the implementation.</p>
 */
public interface CryptoContext
{
    byte[] encrypt(byte[] plaintext, byte[] initVector);

    byte[] decrypt(byte[] ciphertext, byte[] initVector);

    /**
     * A fresh random init vector for a new connection attempt.
     */
    byte[] generateRandomInitVector();
}
