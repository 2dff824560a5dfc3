package com.questrail.consolelink.protocol.smartglass;

/**
 * Base type for failures surfaced by the console client.
 *
 * <p>Reply waits that run out of time fail with
 * {@link java.util.concurrent.TimeoutException} instead; waits abandoned by
 * disposal fail with {@link java.util.concurrent.CancellationException}.</p>
 */
public class ConsoleLinkException extends RuntimeException
{
    public ConsoleLinkException(String message) {
        super(message);
    }

    public ConsoleLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
