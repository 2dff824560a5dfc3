package com.questrail.consolelink.protocol.smartglass.model;

import com.questrail.consolelink.api.ServiceType;

import java.util.Objects;

/**
 * Requests a new logical channel.
 *
 * @param channelRequestId locally allocated id echoed by the response
 * @param serviceType      service the channel is for ({@link ServiceType#NONE} for title channels)
 * @param titleId          title the channel is for ({@code 0} for service channels)
 */
public record StartChannelRequest(
        long channelRequestId,
        ServiceType serviceType,
        long titleId
) implements SessionMessage {

    public StartChannelRequest {
        Objects.requireNonNull(serviceType, "serviceType");
        if (channelRequestId <= 0) {
            throw new IllegalArgumentException("channelRequestId must be > 0");
        }
    }
}
