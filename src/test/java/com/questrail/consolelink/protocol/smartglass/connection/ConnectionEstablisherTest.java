package com.questrail.consolelink.protocol.smartglass.connection;

import com.questrail.consolelink.api.PairingState;
import com.questrail.consolelink.protocol.smartglass.ConsoleLinkException;
import com.questrail.consolelink.protocol.smartglass.config.ConsoleTimingPolicy;
import com.questrail.consolelink.protocol.smartglass.crypto.FakeCryptoContext;
import com.questrail.consolelink.protocol.smartglass.model.ConnectRequest;
import com.questrail.consolelink.protocol.smartglass.model.ConnectResponse;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleProtocolEvent;
import com.questrail.consolelink.protocol.smartglass.observability.RecordingObservabilitySink;
import com.questrail.consolelink.protocol.smartglass.time.DeterministicScheduler;
import com.questrail.consolelink.protocol.smartglass.time.ManualMonotonicClock;
import com.questrail.consolelink.protocol.smartglass.transport.CorrelatedMessageTransport;
import com.questrail.consolelink.protocol.smartglass.transport.FakeMessageTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static com.questrail.consolelink.protocol.smartglass.FutureAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ConnectionEstablisherTest
 * -----------------------------------------------------------------------------
 * Handshake retry behavior in virtual time.
 *
 * With the default policy an unanswered attempt times out after 1000ms and
 * the next one starts after the scheduled pause, so attempts begin at
 * 0, 1500, 3000, 5500 and 11500ms.
 */
class ConnectionEstablisherTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeMessageTransport fake;
    private RecordingObservabilitySink sink;
    private FakeCryptoContext crypto;
    private CorrelatedMessageTransport transport;
    private ConnectionEstablisher establisher;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        fake = new FakeMessageTransport();
        sink = new RecordingObservabilitySink();
        crypto = new FakeCryptoContext();
        transport = new CorrelatedMessageTransport(fake, clock, scheduler, () -> Instant.EPOCH, sink);
        transport.start();
        establisher = new ConnectionEstablisher(ConsoleTimingPolicy.defaults(), clock, scheduler, () -> Instant.EPOCH, sink);
    }

    @Test
    void immediateReplyEstablishesTheSession() {
        fake.respondWith(message -> new ConnectResponse(0, PairingState.PAIRED, 31));

        CompletableFuture<ConnectionResult> result = establisher.establish(transport, crypto, null);

        ConnectionResult connection = valueOf(result);
        assertEquals(31, connection.sessionInfo().participantId());
        assertEquals(PairingState.PAIRED, connection.pairingState());
        assertSame(crypto, connection.cryptoContext());
        assertEquals(1, fake.sentOfType(ConnectRequest.class).size());
        assertEquals(1, sink.protocolEvents(ConsoleProtocolEvent.Kind.SESSION_ESTABLISHED).size());
    }

    @Test
    void replyToTheThirdAttemptCompletesAtThreeSecondsOfVirtualTime() {
        long[] completedAtMillis = {-1};
        fake.respondWith(message -> message instanceof ConnectRequest request && request.sequenceNumber() == 4
                ? new ConnectResponse(0, PairingState.NOT_PAIRED, 12)
                : null);

        CompletableFuture<ConnectionResult> result = establisher.establish(transport, crypto, null);
        result.thenRun(() -> completedAtMillis[0] = clock.nowMillis());

        scheduler.advanceMillis(2999);
        assertFalse(result.isDone());

        scheduler.advanceMillis(1);
        assertEquals(12, valueOf(result).sessionInfo().participantId());
        assertEquals(PairingState.NOT_PAIRED, valueOf(result).pairingState());
        assertEquals(3000, completedAtMillis[0]);
        assertEquals(3, fake.sentOfType(ConnectRequest.class).size());
        assertEquals(2, sink.protocolEvents(ConsoleProtocolEvent.Kind.HANDSHAKE_RETRY).size());
    }

    @Test
    void attemptsShareIdentityAndAdvanceTheSequenceByTwo() {
        fake.respondWith(message -> message instanceof ConnectRequest request && request.sequenceNumber() == 4
                ? new ConnectResponse(0, PairingState.PAIRED, 1)
                : null);

        CompletableFuture<ConnectionResult> result = establisher.establish(
                transport, crypto, new UserCredentials("hash", "XBL3.0 x=token"));
        scheduler.advanceMillis(3000);
        assertTrue(result.isDone());

        List<ConnectRequest> requests = fake.sentOfType(ConnectRequest.class);
        assertEquals(3, requests.size());
        for (int i = 0; i < requests.size(); i++) {
            ConnectRequest request = requests.get(i);
            assertEquals(2L * i, request.sequenceNumber());
            assertEquals(2L * i + 1, request.sequenceBegin());
            assertEquals(2L * i + 1, request.sequenceEnd());
            assertArrayEquals(requests.get(0).initVector(), request.initVector());
            assertEquals(requests.get(0).deviceId(), request.deviceId());
            assertEquals("hash", request.userHash());
            assertEquals("XBL3.0 x=token", request.authorization());
        }
        assertEquals(1, crypto.initVectorsIssued());
        assertEquals(requests.get(0).deviceId(), valueOf(result).sessionInfo().deviceId());
    }

    @Test
    void anonymousHandshakeCarriesNoCredentials() {
        fake.respondWith(message -> new ConnectResponse(0, PairingState.NOT_PAIRED, 1));

        establisher.establish(transport, crypto, null);

        ConnectRequest request = fake.sentOfType(ConnectRequest.class).get(0);
        assertTrue(request.userHashIfPresent().isEmpty());
        assertTrue(request.authorizationIfPresent().isEmpty());
    }

    @Test
    void silentConsoleFailsAfterFiveAttempts() {
        CompletableFuture<ConnectionResult> result = establisher.establish(transport, crypto, null);

        scheduler.advanceMillis(12_499);
        assertFalse(result.isDone());
        assertEquals(5, fake.sentOfType(ConnectRequest.class).size());

        scheduler.advanceMillis(1);
        ConnectionFailedException failure = assertFailsWith(ConnectionFailedException.class, result);
        assertEquals(5, failure.attempts());
        assertTrue(failure.resultCode().isEmpty());
        assertInstanceOf(TimeoutException.class, failure.getCause());

        scheduler.advanceMillis(60_000);
        assertEquals(5, fake.sentOfType(ConnectRequest.class).size());
        assertEquals(5, sink.protocolEvents(ConsoleProtocolEvent.Kind.HANDSHAKE_ATTEMPT).size());
    }

    @Test
    void rejectionIsNotRetried() {
        fake.respondWith(message -> new ConnectResponse(2, PairingState.NOT_PAIRED, 0));

        CompletableFuture<ConnectionResult> result = establisher.establish(transport, crypto, null);

        ConnectionFailedException failure = assertFailsWith(ConnectionFailedException.class, result);
        assertEquals(2, failure.resultCode().orElseThrow());
        assertEquals(1, failure.attempts());
        scheduler.advanceMillis(20_000);
        assertEquals(1, fake.sentOfType(ConnectRequest.class).size());
    }

    @Test
    void transportFailureIsNotRetried() {
        CompletableFuture<ConnectionResult> result = establisher.establish(transport, crypto, null);

        fake.failTransport(new IOException("network unreachable"));

        ConsoleLinkException failure = assertFailsWith(ConsoleLinkException.class, result);
        assertFalse(failure instanceof ConnectionFailedException);
        scheduler.advanceMillis(20_000);
        assertEquals(1, fake.sentOfType(ConnectRequest.class).size());
    }

    @Test
    void lateReplyToAnEarlierAttemptIsStillAccepted() {
        CompletableFuture<ConnectionResult> result = establisher.establish(transport, crypto, null);

        scheduler.advanceMillis(1600);
        assertEquals(2, fake.sentOfType(ConnectRequest.class).size());

        fake.inject(new ConnectResponse(0, PairingState.PAIRED, 5));

        assertEquals(5, valueOf(result).sessionInfo().participantId());
    }
}
