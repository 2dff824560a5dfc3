package com.questrail.consolelink.protocol.smartglass.model;

/**
 * Asks the title for auxiliary stream connection details.
 */
public record AuxiliaryStreamRequest() implements SessionMessage {
}
