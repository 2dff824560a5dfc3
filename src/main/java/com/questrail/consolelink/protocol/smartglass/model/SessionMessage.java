package com.questrail.consolelink.protocol.smartglass.model;

/**
 * Payload of a {@link SessionFrame}.
 *
 * <p>Only the fields the orchestration layer reads or writes are modeled;
 * the binary layout belongs to the codec.</p>
 */
public sealed interface SessionMessage
        permits LocalJoin,
                ConsoleStatusMessage,
                TitleLaunch,
                GameDvrRecord,
                StartChannelRequest,
                StartChannelResponse,
                AuxiliaryStreamHello,
                AuxiliaryStreamRequest,
                AuxiliaryStreamConnectionInfo,
                GamepadMessage {
}
