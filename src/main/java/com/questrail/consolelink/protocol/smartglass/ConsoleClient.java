package com.questrail.consolelink.protocol.smartglass;

import com.questrail.consolelink.api.ActiveTitleLocation;
import com.questrail.consolelink.api.ConsoleStatus;
import com.questrail.consolelink.api.ConsoleStatusListener;
import com.questrail.consolelink.api.PairingState;
import com.questrail.consolelink.api.ServiceType;
import com.questrail.consolelink.protocol.smartglass.channel.ChannelMessageTransport;
import com.questrail.consolelink.protocol.smartglass.channel.ChannelMultiplexer;
import com.questrail.consolelink.protocol.smartglass.channel.InputChannel;
import com.questrail.consolelink.protocol.smartglass.channel.SingleFlightLazy;
import com.questrail.consolelink.protocol.smartglass.channel.TitleChannel;
import com.questrail.consolelink.protocol.smartglass.config.ConsoleTimingPolicy;
import com.questrail.consolelink.protocol.smartglass.connection.ConnectionResult;
import com.questrail.consolelink.protocol.smartglass.discovery.Device;
import com.questrail.consolelink.protocol.smartglass.internal.exec.Futures;
import com.questrail.consolelink.protocol.smartglass.internal.exec.OrderedRelease;
import com.questrail.consolelink.protocol.smartglass.internal.time.WallClock;
import com.questrail.consolelink.protocol.smartglass.model.AuxiliaryStreamHello;
import com.questrail.consolelink.protocol.smartglass.model.GameDvrRecord;
import com.questrail.consolelink.protocol.smartglass.model.TitleLaunch;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleErrorEvent;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleObservabilitySink;
import com.questrail.consolelink.protocol.smartglass.session.SessionInfo;
import com.questrail.consolelink.protocol.smartglass.session.SessionMessageTransport;
import com.questrail.consolelink.protocol.smartglass.transport.CorrelatedMessageTransport;
import com.questrail.consolelink.protocol.smartglass.transport.Subscription;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * ConsoleClient
 * =============================================================================
 * A connected console session.
 *
 * <p>Instances are produced by {@link ConsoleConnector#connect(String)} and own
 * the session transport. Session-level commands are fire-and-forget; channel
 * operations return futures.</p>
 *
 * <h2>Input channel</h2>
 * The system input channel is opened on the first {@link #inputChannel()}
 * call and shared by every caller for the life of the client. Concurrent
 * first calls trigger exactly one open.
 *
 * <h2>Teardown</h2>
 * {@link #close()} releases, in order, the input channel, the session
 * dispatcher and the transport. Every step runs even if an earlier one
 * fails; failures go to the observability sink and are not rethrown.
 * Nothing is sent to the console on close.
 */
public final class ConsoleClient implements AutoCloseable {

    /** Seconds of past footage recorded by {@link #startDvrRecording()}. */
    public static final int DEFAULT_DVR_SECONDS = 60;

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final Device device;
    private final ConnectionResult connection;
    private final CorrelatedMessageTransport transport;
    private final SessionMessageTransport session;
    private final ChannelMultiplexer multiplexer;
    private final ConsoleTimingPolicy timingPolicy;
    private final WallClock wallClock;
    private final ConsoleObservabilitySink observabilitySink;
    private final SingleFlightLazy<InputChannel> inputChannel;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ConsoleClient(Device device,
                  ConnectionResult connection,
                  CorrelatedMessageTransport transport,
                  ConsoleTimingPolicy timingPolicy,
                  WallClock wallClock,
                  ConsoleObservabilitySink observabilitySink) {
        this(device, connection, transport, timingPolicy, wallClock, observabilitySink,
                channel -> new InputChannel(channel, wallClock));
    }

    ConsoleClient(Device device,
                  ConnectionResult connection,
                  CorrelatedMessageTransport transport,
                  ConsoleTimingPolicy timingPolicy,
                  WallClock wallClock,
                  ConsoleObservabilitySink observabilitySink,
                  Function<ChannelMessageTransport, InputChannel> inputChannelFactory) {
        Objects.requireNonNull(inputChannelFactory, "inputChannelFactory");
        this.device = Objects.requireNonNull(device, "device");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");

        this.session = new SessionMessageTransport(transport, connection.sessionInfo(), wallClock, observabilitySink);
        this.multiplexer = new ChannelMultiplexer(session, timingPolicy.channelOpenTimeout(), wallClock, observabilitySink);
        this.inputChannel = new SingleFlightLazy<>(
                () -> multiplexer.openChannel(ServiceType.SYSTEM_INPUT)
                        .thenApply(inputChannelFactory),
                this::reportReleaseFailure);
    }

    public Device device() {
        return device;
    }

    public SessionInfo sessionInfo() {
        return connection.sessionInfo();
    }

    public PairingState pairingState() {
        return connection.pairingState();
    }

    /**
     * The last console status received on this session.
     */
    public Optional<ConsoleStatus> consoleStatus() {
        return session.latestConsoleStatus();
    }

    /**
     * Receive a snapshot every time the console reports its status.
     */
    public Subscription addConsoleStatusListener(ConsoleStatusListener listener) {
        return session.addConsoleStatusListener(listener);
    }

    public void launchTitle(long titleId) {
        launchTitle(titleId, null, ActiveTitleLocation.DEFAULT);
    }

    public void launchTitle(long titleId, String launchParams) {
        launchTitle(titleId, launchParams, ActiveTitleLocation.DEFAULT);
    }

    public void launchTitle(long titleId, ActiveTitleLocation location) {
        launchTitle(titleId, null, location);
    }

    /**
     * Ask the console to launch a title. No reply is awaited.
     *
     * @param titleId      32-bit title id
     * @param launchParams optional launch parameters, percent-encoded into the URI
     * @param location     where the title should appear
     */
    public void launchTitle(long titleId, String launchParams, ActiveTitleLocation location) {
        Objects.requireNonNull(location, "location");
        session.send(new TitleLaunch(launchUri(titleId, launchParams), location));
    }

    public void startDvrRecording() {
        startDvrRecording(DEFAULT_DVR_SECONDS);
    }

    /**
     * Record the last {@code lastSeconds} seconds of gameplay. No reply is awaited.
     * The value is sent as a start delta of {@code -lastSeconds} without range checks.
     */
    public void startDvrRecording(int lastSeconds) {
        session.send(new GameDvrRecord(-lastSeconds, 0));
    }

    /**
     * The session's input channel, opened on first use.
     */
    public CompletableFuture<InputChannel> inputChannel() {
        return inputChannel.get();
    }

    /**
     * Open a channel to a running title.
     *
     * <p>After the open, waits up to the auxiliary hello timeout for the title
     * to greet the channel. Not every title does; a missing hello still yields
     * a usable channel.</p>
     */
    public CompletableFuture<TitleChannel> startTitleChannel(long titleId) {
        return multiplexer.openChannel(ServiceType.NONE, titleId)
                .thenCompose(channel -> awaitHello(channel, titleId));
    }

    private CompletableFuture<TitleChannel> awaitHello(ChannelMessageTransport channel, long titleId) {
        return channel.sendAndWait(
                () -> { },
                AuxiliaryStreamHello.class,
                hello -> true,
                timingPolicy.auxiliaryHelloTimeout()
        ).handle((hello, failure) -> {
            if (failure == null) {
                return new TitleChannel(channel, titleId, hello, timingPolicy.auxiliaryStreamTimeout());
            }

            Throwable cause = Futures.unwrap(failure);
            if (cause instanceof TimeoutException) {
                return new TitleChannel(channel, titleId, null, timingPolicy.auxiliaryStreamTimeout());
            }

            channel.close();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ConsoleLinkException("Title channel setup failed", cause);
        });
    }

    /**
     * Release the input channel, the session dispatcher and the transport.
     * Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        new OrderedRelease(this::reportReleaseFailure)
                .then("input channel", inputChannel::close)
                .then("session dispatcher", session::close)
                .then("transport", transport::close)
                .releaseAll();
    }

    private void reportReleaseFailure(String resource, Throwable failure) {
        observabilitySink.onError(new ConsoleErrorEvent(wallClock.now(), "Failed to release " + resource, failure));
    }

    static String launchUri(long titleId, String launchParams) {
        String base = String.format("ms-xbl-%08X://default", titleId & 0xFFFFFFFFL);
        if (launchParams == null || launchParams.isEmpty()) {
            return base;
        }
        return base + "/" + percentEncode(launchParams);
    }

    /**
     * RFC 3986 percent-encoding of everything outside the unreserved set.
     */
    static String percentEncode(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xFF);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '.' || c == '_' || c == '~') {
                out.append(c);
            } else {
                out.append('%').append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
            }
        }
        return out.toString();
    }
}
