package com.questrail.consolelink.protocol.smartglass.model;

/**
 * Greeting sent by some console versions right after a title channel opens,
 * advertising that an auxiliary stream is available.
 */
public record AuxiliaryStreamHello(
        int majorVersion,
        int minorVersion
) implements SessionMessage {
}
