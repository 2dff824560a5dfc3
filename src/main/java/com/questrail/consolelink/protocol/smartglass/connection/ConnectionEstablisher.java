package com.questrail.consolelink.protocol.smartglass.connection;

import com.questrail.consolelink.protocol.smartglass.ConsoleLinkException;
import com.questrail.consolelink.protocol.smartglass.config.ConsoleTimingPolicy;
import com.questrail.consolelink.protocol.smartglass.crypto.CryptoContext;
import com.questrail.consolelink.protocol.smartglass.internal.exec.Futures;
import com.questrail.consolelink.protocol.smartglass.internal.exec.Retries;
import com.questrail.consolelink.protocol.smartglass.internal.time.MonotonicClock;
import com.questrail.consolelink.protocol.smartglass.internal.time.MonotonicScheduler;
import com.questrail.consolelink.protocol.smartglass.internal.time.WallClock;
import com.questrail.consolelink.protocol.smartglass.model.ConnectRequest;
import com.questrail.consolelink.protocol.smartglass.model.ConnectResponse;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleObservabilitySink;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleProtocolEvent;
import com.questrail.consolelink.protocol.smartglass.session.SessionInfo;
import com.questrail.consolelink.protocol.smartglass.transport.CorrelatedMessageTransport;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * ConnectionEstablisher
 * =============================================================================
 * Performs the connect handshake with retry.
 *
 * <h2>Attempt identity</h2>
 * The init vector and device id are generated once per {@link #establish}
 * call and reused by every attempt. Each attempt carries a sequence triple
 * {@code (n, n+1, n+1)} where {@code n} starts at 0 and advances by 2.
 *
 * <h2>Retry</h2>
 * An attempt that sees no {@link ConnectResponse} within
 * {@link ConsoleTimingPolicy#connectTimeout()} is retried after the next
 * pause of {@link ConsoleTimingPolicy#connectRetries()}. Only timeouts are
 * retried; a rejecting response or a transport failure ends the handshake.
 */
public final class ConnectionEstablisher {

    private final ConsoleTimingPolicy timingPolicy;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final ConsoleObservabilitySink observabilitySink;

    public ConnectionEstablisher(ConsoleTimingPolicy timingPolicy,
                                 MonotonicClock clock,
                                 MonotonicScheduler scheduler,
                                 WallClock wallClock,
                                 ConsoleObservabilitySink observabilitySink) {
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Run the handshake over a started transport.
     *
     * @param credentials account credentials, or {@code null} for an anonymous connection
     * @return completes with the session identity; fails with
     *         {@link ConnectionFailedException} when the console never answers
     *         or rejects the request, or with the transport's own failure
     */
    public CompletableFuture<ConnectionResult> establish(CorrelatedMessageTransport transport,
                                                         CryptoContext cryptoContext,
                                                         UserCredentials credentials) {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(cryptoContext, "cryptoContext");

        return new Handshake(transport, cryptoContext, credentials).run();
    }

    /**
     * State of one handshake across its attempts.
     */
    private final class Handshake {
        private final CorrelatedMessageTransport transport;
        private final CryptoContext cryptoContext;
        private final UserCredentials credentials;
        private final byte[] initVector;
        private final UUID deviceId = UUID.randomUUID();

        // Guarded by this; attempts never overlap.
        private int attempts;
        private long sequenceNumber;

        private Handshake(CorrelatedMessageTransport transport,
                          CryptoContext cryptoContext,
                          UserCredentials credentials) {
            this.transport = transport;
            this.cryptoContext = cryptoContext;
            this.credentials = credentials;
            this.initVector = cryptoContext.generateRandomInitVector();
        }

        CompletableFuture<ConnectionResult> run() {
            return Retries.withRetries(
                    this::attempt,
                    timingPolicy.connectRetries(),
                    TimeoutException.class::isInstance,
                    clock,
                    scheduler,
                    (nextAttempt, delay, failure) -> report(
                            ConsoleProtocolEvent.Kind.HANDSHAKE_RETRY,
                            "attempt " + nextAttempt + " in " + delay.toMillis() + "ms")
            ).handle((response, failure) -> {
                if (failure != null) {
                    throw translate(Futures.unwrap(failure));
                }
                return complete(response);
            });
        }

        private synchronized CompletableFuture<ConnectResponse> attempt() {
            int attempt = ++attempts;
            ConnectRequest request = new ConnectRequest(
                    initVector,
                    deviceId,
                    credentials == null ? null : credentials.userHash(),
                    credentials == null ? null : credentials.authorization(),
                    sequenceNumber,
                    sequenceNumber + 1,
                    sequenceNumber + 1);
            sequenceNumber += 2;

            report(ConsoleProtocolEvent.Kind.HANDSHAKE_ATTEMPT,
                    "attempt " + attempt + " seq " + request.sequenceNumber());

            return transport.sendAndWait(
                    () -> transport.send(request),
                    ConnectResponse.class,
                    response -> true,
                    timingPolicy.connectTimeout());
        }

        private synchronized int attemptsMade() {
            return attempts;
        }

        private RuntimeException translate(Throwable failure) {
            if (failure instanceof TimeoutException) {
                return new ConnectionFailedException(attemptsMade(), failure);
            }
            if (failure instanceof RuntimeException runtime) {
                return runtime;
            }
            return new ConsoleLinkException("Handshake failed", failure);
        }

        private ConnectionResult complete(ConnectResponse response) {
            if (!response.isSuccess()) {
                throw new ConnectionFailedException(attemptsMade(), response.result());
            }

            SessionInfo sessionInfo = new SessionInfo(response.participantId(), deviceId);
            report(ConsoleProtocolEvent.Kind.SESSION_ESTABLISHED,
                    "participant " + response.participantId() + ", " + response.pairingState());
            return new ConnectionResult(sessionInfo, response.pairingState(), cryptoContext);
        }

        private void report(ConsoleProtocolEvent.Kind kind, String detail) {
            observabilitySink.onProtocolEvent(new ConsoleProtocolEvent(wallClock.now(), kind, detail));
        }
    }
}
