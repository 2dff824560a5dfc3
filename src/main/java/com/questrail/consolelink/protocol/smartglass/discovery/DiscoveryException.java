package com.questrail.consolelink.protocol.smartglass.discovery;

import com.questrail.consolelink.protocol.smartglass.ConsoleLinkException;

/**
 * The console could not be reached or identified. Not retried.
 */
public final class DiscoveryException extends ConsoleLinkException
{
    private final String addressOrHostname;

    public DiscoveryException(String addressOrHostname, Throwable cause) {
        super("Discovery failed for " + addressOrHostname, cause);
        this.addressOrHostname = addressOrHostname;
    }

    public String addressOrHostname() {
        return addressOrHostname;
    }
}
