package com.questrail.consolelink.protocol.smartglass;

import com.questrail.consolelink.protocol.smartglass.config.ConsoleClientConfig;
import com.questrail.consolelink.protocol.smartglass.connection.ConnectionEstablisher;
import com.questrail.consolelink.protocol.smartglass.connection.ConnectionResult;
import com.questrail.consolelink.protocol.smartglass.connection.UserCredentials;
import com.questrail.consolelink.protocol.smartglass.crypto.CryptoContext;
import com.questrail.consolelink.protocol.smartglass.crypto.CryptoContextFactory;
import com.questrail.consolelink.protocol.smartglass.discovery.Device;
import com.questrail.consolelink.protocol.smartglass.discovery.DeviceDiscovery;
import com.questrail.consolelink.protocol.smartglass.discovery.DiscoveryException;
import com.questrail.consolelink.protocol.smartglass.internal.exec.Futures;
import com.questrail.consolelink.protocol.smartglass.internal.time.MonotonicClock;
import com.questrail.consolelink.protocol.smartglass.internal.time.MonotonicScheduler;
import com.questrail.consolelink.protocol.smartglass.internal.time.ScheduledExecutorScheduler;
import com.questrail.consolelink.protocol.smartglass.internal.time.SystemMonotonicClock;
import com.questrail.consolelink.protocol.smartglass.internal.time.SystemWallClock;
import com.questrail.consolelink.protocol.smartglass.internal.time.WallClock;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleObservabilitySink;
import com.questrail.consolelink.protocol.smartglass.observability.NullObservabilitySink;
import com.questrail.consolelink.protocol.smartglass.transport.CorrelatedMessageTransport;
import com.questrail.consolelink.protocol.smartglass.transport.DatagramMessageTransport;
import com.questrail.consolelink.protocol.smartglass.transport.MessageCodec;
import com.questrail.consolelink.protocol.smartglass.transport.MessageTransportFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * ConsoleConnector
 * =============================================================================
 * Composition root for console sessions.
 *
 * <p>{@link #connect(String)} runs discovery, derives the crypto context,
 * performs the handshake over a dedicated transport, closes it, and opens a
 * fresh transport for the established session.</p>
 *
 * <p>When no scheduler is supplied the connector owns a single daemon
 * scheduler thread and shuts it down in {@link #close()}. Clients produced by
 * the connector stop receiving timeouts after that.</p>
 */
public final class ConsoleConnector implements AutoCloseable {

    private final DeviceDiscovery discovery;
    private final CryptoContextFactory cryptoContextFactory;
    private final MessageTransportFactory transportFactory;
    private final ConsoleClientConfig config;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final ConsoleObservabilitySink observabilitySink;
    private final ScheduledExecutorService ownedExecutor;

    private ConsoleConnector(Builder builder, MessageTransportFactory transportFactory,
                             MonotonicScheduler scheduler, ScheduledExecutorService ownedExecutor) {
        this.discovery = builder.discovery;
        this.cryptoContextFactory = builder.cryptoContextFactory;
        this.transportFactory = transportFactory;
        this.config = builder.config;
        this.clock = builder.clock;
        this.scheduler = scheduler;
        this.wallClock = builder.wallClock;
        this.observabilitySink = builder.observabilitySink;
        this.ownedExecutor = ownedExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public CompletableFuture<ConsoleClient> connect(String addressOrHostname) {
        return connect(addressOrHostname, null);
    }

    /**
     * Connect to a console.
     *
     * @param credentials account credentials, or {@code null} to connect anonymously
     * @return completes with a live client; fails with {@link DiscoveryException}
     *         or {@link com.questrail.consolelink.protocol.smartglass.connection.ConnectionFailedException}
     */
    public CompletableFuture<ConsoleClient> connect(String addressOrHostname, UserCredentials credentials) {
        Objects.requireNonNull(addressOrHostname, "addressOrHostname");

        return discover(addressOrHostname)
                .thenCompose(device -> {
                    CryptoContext cryptoContext = cryptoContextFactory.fromCertificate(device.certificate());
                    return handshake(device, cryptoContext, credentials)
                            .thenApply(connection -> openSession(device, connection));
                });
    }

    private CompletableFuture<Device> discover(String addressOrHostname) {
        CompletableFuture<Device> probe;
        try {
            probe = discovery.ping(addressOrHostname);
        } catch (RuntimeException e) {
            probe = Futures.failed(e);
        }

        CompletableFuture<Device> result = new CompletableFuture<>();
        probe.whenComplete((device, failure) -> {
            if (failure == null) {
                result.complete(device);
                return;
            }
            Throwable cause = Futures.unwrap(failure);
            result.completeExceptionally(cause instanceof DiscoveryException
                    ? cause
                    : new DiscoveryException(addressOrHostname, cause));
        });
        return result;
    }

    private CompletableFuture<ConnectionResult> handshake(Device device,
                                                          CryptoContext cryptoContext,
                                                          UserCredentials credentials) {
        CorrelatedMessageTransport handshakeTransport = newTransport(device, cryptoContext);
        try {
            handshakeTransport.start();
        } catch (RuntimeException e) {
            handshakeTransport.close();
            return Futures.failed(e);
        }

        ConnectionEstablisher establisher = new ConnectionEstablisher(
                config.timingPolicy(), clock, scheduler, wallClock, observabilitySink);

        return establisher.establish(handshakeTransport, cryptoContext, credentials)
                .whenComplete((connection, failure) -> handshakeTransport.close());
    }

    private ConsoleClient openSession(Device device, ConnectionResult connection) {
        CorrelatedMessageTransport sessionTransport = newTransport(device, connection.cryptoContext());
        try {
            sessionTransport.start();
            return new ConsoleClient(device, connection, sessionTransport,
                    config.timingPolicy(), wallClock, observabilitySink);
        } catch (RuntimeException e) {
            sessionTransport.close();
            throw e;
        }
    }

    private CorrelatedMessageTransport newTransport(Device device, CryptoContext cryptoContext) {
        return new CorrelatedMessageTransport(
                transportFactory.open(device, cryptoContext), clock, scheduler, wallClock, observabilitySink);
    }

    /**
     * Shut down the owned scheduler thread, if any.
     */
    @Override
    public void close() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static final class Builder {
        private DeviceDiscovery discovery;
        private CryptoContextFactory cryptoContextFactory;
        private MessageTransportFactory transportFactory;
        private MessageCodec messageCodec;
        private ConsoleClientConfig config = ConsoleClientConfig.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private ConsoleObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withDiscovery(DeviceDiscovery discovery) {
            this.discovery = discovery;
            return this;
        }

        public Builder withCryptoContextFactory(CryptoContextFactory factory) {
            this.cryptoContextFactory = factory;
            return this;
        }

        /**
         * Use a custom transport. Takes precedence over {@link #withMessageCodec}.
         */
        public Builder withTransportFactory(MessageTransportFactory factory) {
            this.transportFactory = factory;
            return this;
        }

        /**
         * Use the Netty datagram transport with this wire codec.
         */
        public Builder withMessageCodec(MessageCodec codec) {
            this.messageCodec = codec;
            return this;
        }

        public Builder withConfig(ConsoleClientConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Drive timeouts and retries from the given clock and scheduler. The
         * caller keeps ownership of the scheduler.
         */
        public Builder withClock(MonotonicClock clock, MonotonicScheduler scheduler) {
            this.clock = clock;
            this.scheduler = scheduler;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(ConsoleObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public ConsoleConnector build() {
            Objects.requireNonNull(discovery, "discovery");
            Objects.requireNonNull(cryptoContextFactory, "cryptoContextFactory");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            MessageTransportFactory effectiveFactory = transportFactory;
            if (effectiveFactory == null) {
                if (messageCodec == null) {
                    throw new IllegalStateException("either a transport factory or a message codec is required");
                }
                effectiveFactory = DatagramMessageTransport.factory(messageCodec, config, observabilitySink, wallClock);
            }

            ScheduledExecutorService ownedExecutor = null;
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                ownedExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                    Thread thread = new Thread(runnable, "consolelink-scheduler");
                    thread.setDaemon(true);
                    return thread;
                });
                effectiveScheduler = new ScheduledExecutorScheduler(ownedExecutor, clock);
            }

            return new ConsoleConnector(this, effectiveFactory, effectiveScheduler, ownedExecutor);
        }
    }
}
