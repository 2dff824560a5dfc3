package com.questrail.consolelink.protocol.smartglass.model;

import com.questrail.consolelink.api.ActiveTitleLocation;

import java.util.Objects;

/**
 * Asks the console to launch the title addressed by {@code uri}.
 */
public record TitleLaunch(
        String uri,
        ActiveTitleLocation location
) implements SessionMessage {

    public TitleLaunch {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(location, "location");
    }
}
