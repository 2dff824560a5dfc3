package com.questrail.consolelink.protocol.smartglass.channel;

import com.questrail.consolelink.api.ServiceType;
import com.questrail.consolelink.protocol.smartglass.internal.time.WallClock;
import com.questrail.consolelink.protocol.smartglass.model.StartChannelRequest;
import com.questrail.consolelink.protocol.smartglass.model.StartChannelResponse;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleObservabilitySink;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleProtocolEvent;
import com.questrail.consolelink.protocol.smartglass.session.SessionMessageTransport;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ChannelMultiplexer
 * =============================================================================
 * Opens logical service channels inside an established session.
 *
 * <h2>Request ids</h2>
 * Every open allocates the next request id, starting at 1, unique for the
 * life of the session. The response is matched on that id alone, so
 * concurrent opens never see each other's responses.
 *
 * <h2>Failure</h2>
 * Opens are not retried. No response within the channel-open timeout fails
 * with {@link java.util.concurrent.TimeoutException}; a non-zero result fails
 * with {@link ChannelOpenFailedException}.
 */
public final class ChannelMultiplexer {

    private final SessionMessageTransport session;
    private final Duration channelOpenTimeout;
    private final WallClock wallClock;
    private final ConsoleObservabilitySink observabilitySink;
    private final AtomicLong nextRequestId = new AtomicLong(1);

    public ChannelMultiplexer(SessionMessageTransport session,
                              Duration channelOpenTimeout,
                              WallClock wallClock,
                              ConsoleObservabilitySink observabilitySink) {
        this.session = Objects.requireNonNull(session, "session");
        this.channelOpenTimeout = Objects.requireNonNull(channelOpenTimeout, "channelOpenTimeout");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public CompletableFuture<ChannelMessageTransport> openChannel(ServiceType serviceType) {
        return openChannel(serviceType, 0L);
    }

    public CompletableFuture<ChannelMessageTransport> openChannel(ServiceType serviceType, long titleId) {
        Objects.requireNonNull(serviceType, "serviceType");

        long requestId = nextRequestId.getAndIncrement();
        StartChannelRequest request = new StartChannelRequest(requestId, serviceType, titleId);

        return session.sendAndWait(
                () -> session.send(request),
                StartChannelResponse.class,
                response -> response.channelRequestId() == requestId,
                channelOpenTimeout
        ).thenApply(response -> {
            if (!response.isSuccess()) {
                report(ConsoleProtocolEvent.Kind.CHANNEL_OPEN_FAILED,
                        serviceType + " request " + requestId + " result " + response.result());
                throw new ChannelOpenFailedException(serviceType, titleId, response.result());
            }

            report(ConsoleProtocolEvent.Kind.CHANNEL_OPENED,
                    serviceType + " request " + requestId + " channel " + response.channelId());
            return new ChannelMessageTransport(response.channelId(), session);
        });
    }

    private void report(ConsoleProtocolEvent.Kind kind, String detail) {
        observabilitySink.onProtocolEvent(new ConsoleProtocolEvent(wallClock.now(), kind, detail));
    }
}
