package com.questrail.consolelink.protocol.smartglass.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ConsoleObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jConsoleObservabilitySink implements ConsoleObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jConsoleObservabilitySink.class);

    @Override
    public void onProtocolEvent(ConsoleProtocolEvent event) {
        switch (event.kind()) {
            case SESSION_ESTABLISHED, CHANNEL_OPENED ->
                log.info("Console {}: {}", event.kind(), event.detail());
            case CHANNEL_OPEN_FAILED ->
                log.warn("Console {}: {}", event.kind(), event.detail());
            default ->
                log.debug("Console {}: {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onTransportEvent(ConsoleTransportEvent event) {
        if (event.cause() != null) {
            log.warn("Console transport {}: {}", event.kind(), event.detail(), event.cause());
        } else {
            log.info("Console transport {}: {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onError(ConsoleErrorEvent event) {
        log.error("Console error: {}", event.message(), event.cause());
    }
}
