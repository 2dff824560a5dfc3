package com.questrail.consolelink.protocol.smartglass.discovery;

import java.util.concurrent.CompletableFuture;

/**
 * DeviceDiscovery
 * -----------------------------------------------------------------------------
 * Port to the discovery collaborator that probes a console for liveness and
 * identity.
 *
 * <p>Implementations live outside the orchestration layer. A failed probe
 * completes the future exceptionally; the connector surfaces it as a
 * {@link DiscoveryException} and never starts a handshake.</p>
 */
@FunctionalInterface
public interface DeviceDiscovery
{
    CompletableFuture<Device> ping(String addressOrHostname);
}
