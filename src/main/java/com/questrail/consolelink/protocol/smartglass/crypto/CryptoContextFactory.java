package com.questrail.consolelink.protocol.smartglass.crypto;

/**
 * Derives a {@link CryptoContext} from a console's published certificate.
 */
@FunctionalInterface
public interface CryptoContextFactory
{
    CryptoContext fromCertificate(byte[] certificate);
}
