package com.questrail.consolelink.protocol.smartglass.model;

/**
 * Outcome of a {@link StartChannelRequest}.
 *
 * @param channelRequestId request id copied from the request
 * @param channelId        server-assigned channel id (meaningful only on success)
 * @param result           zero on success
 */
public record StartChannelResponse(
        long channelRequestId,
        long channelId,
        int result
) implements SessionMessage {

    public boolean isSuccess() {
        return result == 0;
    }
}
