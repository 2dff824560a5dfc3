package com.questrail.consolelink.api;

import java.util.Objects;

/**
 * Console-wide configuration as reported in a console status message.
 */
public record ConsoleConfiguration(
        long liveTvProvider,
        int majorVersion,
        int minorVersion,
        int buildNumber,
        String locale
) {
    public ConsoleConfiguration {
        Objects.requireNonNull(locale, "locale");
    }
}
