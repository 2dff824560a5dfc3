package com.questrail.consolelink.protocol.smartglass.observability;

/**
 * No-op implementation of ConsoleObservabilitySink.
 */
public final class NullObservabilitySink implements ConsoleObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onProtocolEvent(ConsoleProtocolEvent event) {}

    @Override
    public void onTransportEvent(ConsoleTransportEvent event) {}

    @Override
    public void onError(ConsoleErrorEvent event) {}
}
