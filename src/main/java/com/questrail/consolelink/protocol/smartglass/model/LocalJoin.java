package com.questrail.consolelink.protocol.smartglass.model;

import java.util.Objects;

/**
 * Announces this client as an active participant of the session.
 */
public record LocalJoin(
        String deviceType,
        int nativeWidth,
        int nativeHeight,
        int dpiX,
        int dpiY,
        long deviceCapabilities,
        int clientVersion,
        int osMajorVersion,
        int osMinorVersion,
        String displayName
) implements SessionMessage {

    /** All capability bits set. */
    public static final long ALL_CAPABILITIES = 0xFFFFFFFFFFFFFFFFL;

    public LocalJoin {
        Objects.requireNonNull(deviceType, "deviceType");
        Objects.requireNonNull(displayName, "displayName");
    }

    /**
     * The announcement sent by default: a portrait 1080x1920 store client at
     * 96 dpi advertising every capability.
     */
    public static LocalJoin defaults() {
        return new LocalJoin("WindowsStore", 1080, 1920, 96, 96, ALL_CAPABILITIES, 0, 0, 0, "");
    }
}
