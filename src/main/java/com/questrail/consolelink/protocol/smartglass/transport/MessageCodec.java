package com.questrail.consolelink.protocol.smartglass.transport;

import com.questrail.consolelink.protocol.smartglass.crypto.CryptoContext;
import com.questrail.consolelink.protocol.smartglass.model.ConsoleMessage;

/**
 * Port to the wire codec: framing, field encoding and per-message encryption.
 *
 * <p>The binary layout is defined outside this project; the datagram
 * transport only moves whole datagrams through this codec.</p>
 */
public interface MessageCodec
{
    byte[] encode(ConsoleMessage message, CryptoContext cryptoContext);

    /**
     * @throws MessageDecodeException if the datagram is not a valid message
     */
    ConsoleMessage decode(byte[] datagram, CryptoContext cryptoContext);
}
