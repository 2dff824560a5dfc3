package com.questrail.consolelink.protocol.smartglass.model;

import com.questrail.consolelink.api.ActiveTitle;
import com.questrail.consolelink.api.ConsoleConfiguration;
import com.questrail.consolelink.api.ConsoleStatus;

import java.util.List;
import java.util.Objects;

/**
 * Unsolicited console status update.
 */
public record ConsoleStatusMessage(
        ConsoleConfiguration configuration,
        List<ActiveTitle> activeTitles
) implements SessionMessage {

    public ConsoleStatusMessage {
        Objects.requireNonNull(configuration, "configuration");
        activeTitles = List.copyOf(activeTitles);
    }

    public ConsoleStatus toStatus() {
        return new ConsoleStatus(configuration, activeTitles);
    }
}
