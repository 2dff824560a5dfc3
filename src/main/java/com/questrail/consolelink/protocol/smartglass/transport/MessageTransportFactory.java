package com.questrail.consolelink.protocol.smartglass.transport;

import com.questrail.consolelink.protocol.smartglass.crypto.CryptoContext;
import com.questrail.consolelink.protocol.smartglass.discovery.Device;

/**
 * Opens an unstarted {@link MessageTransport} to a console.
 *
 * <p>Called once for the handshake and once for the established session.</p>
 */
@FunctionalInterface
public interface MessageTransportFactory
{
    MessageTransport open(Device device, CryptoContext cryptoContext);
}
