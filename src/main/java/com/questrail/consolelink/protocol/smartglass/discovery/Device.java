package com.questrail.consolelink.protocol.smartglass.discovery;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.Objects;

/**
 * A console found by discovery.
 *
 * <p>Immutable. The certificate is opaque here; it seeds the
 * {@link com.questrail.consolelink.protocol.smartglass.crypto.CryptoContext}
 * and is never inspected otherwise.</p>
 *
 * @param address     console address
 * @param certificate certificate material published by the console
 */
public record Device(InetAddress address, byte[] certificate) {

    public Device {
        Objects.requireNonNull(address, "address");
        certificate = Objects.requireNonNull(certificate, "certificate").clone();
    }

    @Override
    public byte[] certificate() {
        return certificate.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Device other
                && address.equals(other.address)
                && Arrays.equals(certificate, other.certificate);
    }

    @Override
    public int hashCode() {
        return 31 * address.hashCode() + Arrays.hashCode(certificate);
    }

    @Override
    public String toString() {
        return "Device[address=" + address + ", certificate=" + certificate.length + " bytes]";
    }
}
