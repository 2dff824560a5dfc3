package com.questrail.consolelink.protocol.smartglass.channel;

import com.questrail.consolelink.api.ServiceType;
import com.questrail.consolelink.protocol.smartglass.ConsoleLinkException;

/**
 * The console answered a start-channel request with a non-zero result.
 */
public final class ChannelOpenFailedException extends ConsoleLinkException {

    private final ServiceType serviceType;
    private final long titleId;
    private final int resultCode;

    public ChannelOpenFailedException(ServiceType serviceType, long titleId, int resultCode) {
        super("Console refused to open a " + serviceType + " channel (title "
                + Long.toUnsignedString(titleId) + "): result code " + resultCode);
        this.serviceType = serviceType;
        this.titleId = titleId;
        this.resultCode = resultCode;
    }

    public ServiceType serviceType() {
        return serviceType;
    }

    public long titleId() {
        return titleId;
    }

    public int resultCode() {
        return resultCode;
    }
}
