package com.questrail.consolelink.protocol.smartglass.transport;

import com.questrail.consolelink.protocol.smartglass.ConsoleLinkException;

/**
 * Indicates that a received datagram could not be translated into a
 * {@link com.questrail.consolelink.protocol.smartglass.model.ConsoleMessage}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Truncated or malformed framing</li>
 *   <li>Unknown message type</li>
 *   <li>Decryption or signature failure</li>
 * </ul>
 */
public final class MessageDecodeException extends ConsoleLinkException
{
    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
