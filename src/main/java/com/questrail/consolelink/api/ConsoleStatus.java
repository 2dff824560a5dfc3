package com.questrail.consolelink.api;

import java.util.List;
import java.util.Objects;

/**
 * Point-in-time snapshot of the console derived from the most recent
 * unsolicited status message.
 *
 * <p>Snapshots are delivered to {@link ConsoleStatusListener}s as they arrive;
 * they are never queried on demand.</p>
 */
public record ConsoleStatus(
        ConsoleConfiguration configuration,
        List<ActiveTitle> activeTitles
) {
    public ConsoleStatus {
        Objects.requireNonNull(configuration, "configuration");
        activeTitles = List.copyOf(activeTitles);
    }
}
