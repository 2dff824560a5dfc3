package com.questrail.consolelink.api;

/**
 * Service a logical channel is opened for.
 *
 * <p>{@link #NONE} is used for title channels, which are identified by a title
 * id rather than a system service.</p>
 */
public enum ServiceType
{
    NONE,
    SYSTEM_INPUT,
    SYSTEM_INPUT_TV_REMOTE,
    SYSTEM_MEDIA,
    SYSTEM_TEXT,
    SYSTEM_BROADCAST
}
