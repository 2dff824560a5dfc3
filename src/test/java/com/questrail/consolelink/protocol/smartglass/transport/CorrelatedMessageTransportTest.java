package com.questrail.consolelink.protocol.smartglass.transport;

import com.questrail.consolelink.api.PairingState;
import com.questrail.consolelink.protocol.smartglass.ConsoleLinkException;
import com.questrail.consolelink.protocol.smartglass.model.AuxiliaryStreamHello;
import com.questrail.consolelink.protocol.smartglass.model.ConnectResponse;
import com.questrail.consolelink.protocol.smartglass.model.ConsoleMessage;
import com.questrail.consolelink.protocol.smartglass.model.GameDvrRecord;
import com.questrail.consolelink.protocol.smartglass.model.SessionFrame;
import com.questrail.consolelink.protocol.smartglass.model.SessionMessage;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleProtocolEvent;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleTransportEvent;
import com.questrail.consolelink.protocol.smartglass.observability.RecordingObservabilitySink;
import com.questrail.consolelink.protocol.smartglass.time.DeterministicScheduler;
import com.questrail.consolelink.protocol.smartglass.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

import static com.questrail.consolelink.protocol.smartglass.FutureAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CorrelatedMessageTransportTest
 * -----------------------------------------------------------------------------
 * Reply correlation, deadlines and broadcast over a fake transport.
 *
 * Fully deterministic: manual clock, deterministic scheduler, no sleeps.
 */
class CorrelatedMessageTransportTest {

    private static final Duration ONE_SECOND = Duration.ofSeconds(1);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeMessageTransport fake;
    private RecordingObservabilitySink sink;
    private CorrelatedMessageTransport transport;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        fake = new FakeMessageTransport();
        sink = new RecordingObservabilitySink();
        transport = new CorrelatedMessageTransport(fake, clock, scheduler, () -> Instant.EPOCH, sink);
        transport.start();
    }

    @Test
    void replyDeliveredWhileSendIsOnTheStackIsMatched() {
        ConnectResponse reply = new ConnectResponse(0, PairingState.PAIRED, 7);
        fake.respondWith(message -> reply);

        CompletableFuture<ConnectResponse> wait = transport.sendAndWait(
                () -> transport.send(frame(0, new GameDvrRecord(-60, 0))),
                ConnectResponse.class,
                r -> true,
                ONE_SECOND);

        assertSame(reply, valueOf(wait));
        assertEquals(0, transport.pendingWaitCount());
    }

    @Test
    void firstRegisteredMatchingWaitWinsAndOthersKeepWaiting() {
        CompletableFuture<ConnectResponse> first = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);
        CompletableFuture<ConnectResponse> second = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);

        fake.inject(new ConnectResponse(0, PairingState.PAIRED, 1));

        assertEquals(1, valueOf(first).participantId());
        assertFalse(second.isDone());

        fake.inject(new ConnectResponse(0, PairingState.PAIRED, 2));
        assertEquals(2, valueOf(second).participantId());
    }

    @Test
    void predicateSelectsAmongConcurrentWaits() {
        CompletableFuture<SessionFrame> onChannelOne = transport.sendAndWait(
                () -> { }, SessionFrame.class, f -> f.channelId() == 1, ONE_SECOND);
        CompletableFuture<SessionFrame> onChannelTwo = transport.sendAndWait(
                () -> { }, SessionFrame.class, f -> f.channelId() == 2, ONE_SECOND);

        fake.inject(frame(2, new AuxiliaryStreamHello(1, 0)));

        assertFalse(onChannelOne.isDone());
        assertEquals(2, valueOf(onChannelTwo).channelId());
    }

    @Test
    void messagesOfOtherTypesDoNotMatch() {
        CompletableFuture<ConnectResponse> wait = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);

        fake.inject(frame(0, new AuxiliaryStreamHello(1, 0)));

        assertFalse(wait.isDone());
    }

    @Test
    void unmatchedWaitTimesOutAfterItsDuration() {
        CompletableFuture<ConnectResponse> wait = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);

        scheduler.advanceMillis(999);
        assertFalse(wait.isDone());

        scheduler.advanceMillis(1);
        assertFailsWith(TimeoutException.class, wait);
        assertEquals(0, transport.pendingWaitCount());
        assertEquals(1, sink.protocolEvents(ConsoleProtocolEvent.Kind.WAIT_TIMEOUT).size());
    }

    @Test
    void timeoutOfOneWaitLeavesOthersAlone() {
        CompletableFuture<ConnectResponse> shortWait = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, Duration.ofMillis(100));
        CompletableFuture<ConnectResponse> longWait = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);

        scheduler.advanceMillis(100);
        assertFailsWith(TimeoutException.class, shortWait);
        assertFalse(longWait.isDone());

        fake.inject(new ConnectResponse(0, PairingState.NOT_PAIRED, 3));
        assertEquals(3, valueOf(longWait).participantId());
    }

    @Test
    void matchCancelsTheDeadline() {
        CompletableFuture<ConnectResponse> wait = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);
        assertEquals(1, scheduler.pendingTaskCount());

        fake.inject(new ConnectResponse(0, PairingState.PAIRED, 1));

        assertTrue(wait.isDone());
        assertEquals(0, scheduler.pendingTaskCount());

        scheduler.advanceMillis(2000);
        assertTrue(sink.protocolEvents(ConsoleProtocolEvent.Kind.WAIT_TIMEOUT).isEmpty());
    }

    @Test
    void messageThatArrivedBeforeRegistrationIsNotMatched() {
        fake.inject(new ConnectResponse(0, PairingState.PAIRED, 1));

        CompletableFuture<ConnectResponse> wait = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);

        assertFalse(wait.isDone());
    }

    @Test
    void everyMessageIsBroadcastEvenWhenItFulfilsAWait() {
        List<ConsoleMessage> seen = new ArrayList<>();
        transport.addSubscriber(seen::add);

        CompletableFuture<ConnectResponse> wait = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);
        ConnectResponse reply = new ConnectResponse(0, PairingState.PAIRED, 1);
        SessionFrame unrelated = frame(0, new AuxiliaryStreamHello(2, 1));

        fake.inject(reply);
        fake.inject(unrelated);

        assertTrue(wait.isDone());
        assertEquals(List.of(reply, unrelated), seen);
    }

    @Test
    void failingSubscriberIsReportedAndDoesNotStopCorrelation() {
        transport.addSubscriber(message -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<ConnectResponse> wait = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);

        fake.inject(new ConnectResponse(0, PairingState.PAIRED, 1));

        assertTrue(wait.isDone());
        assertEquals(1, sink.errors().size());
        assertInstanceOf(IllegalStateException.class, sink.errors().get(0).cause());
    }

    @Test
    void closedSubscriptionStopsDelivery() {
        List<ConsoleMessage> seen = new ArrayList<>();
        Subscription subscription = transport.addSubscriber(seen::add);

        subscription.close();
        fake.inject(new ConnectResponse(0, PairingState.PAIRED, 1));

        assertTrue(seen.isEmpty());
    }

    @Test
    void sendFailureFailsTheWaitAndDropsIt() {
        CompletableFuture<ConnectResponse> wait = transport.sendAndWait(
                () -> {
                    throw new IllegalStateException("socket gone");
                },
                ConnectResponse.class, r -> true, ONE_SECOND);

        assertFailsWith(IllegalStateException.class, wait);
        assertEquals(0, transport.pendingWaitCount());
        assertEquals(0, scheduler.pendingTaskCount());
    }

    @Test
    void rejectedDeadlineFailsTheWaitWithoutLeavingItRegistered() {
        List<String> sends = new ArrayList<>();
        scheduler.rejectNewTasks();

        CompletableFuture<ConnectResponse> rejected = transport.sendAndWait(
                () -> sends.add("connect"), ConnectResponse.class, r -> true, ONE_SECOND);

        assertFailsWith(RejectedExecutionException.class, rejected);
        assertTrue(sends.isEmpty());
        assertEquals(0, transport.pendingWaitCount());

        scheduler.acceptNewTasks();
        CompletableFuture<ConnectResponse> live = transport.sendAndWait(
                () -> { }, ConnectResponse.class, r -> true, ONE_SECOND);
        fake.inject(new ConnectResponse(0, PairingState.PAIRED, 9));

        assertEquals(9, valueOf(live).participantId());
    }

    @Test
    void throwingPredicateFailsOnlyThatWait() {
        CompletableFuture<ConnectResponse> broken = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> {
            throw new IllegalArgumentException("bad predicate");
        }, ONE_SECOND);
        CompletableFuture<ConnectResponse> healthy = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);

        fake.inject(new ConnectResponse(0, PairingState.PAIRED, 1));

        assertFailsWith(IllegalArgumentException.class, broken);
        assertEquals(1, valueOf(healthy).participantId());
    }

    @Test
    void closeCancelsPendingWaitsAndClosesTheTransport() {
        CompletableFuture<ConnectResponse> wait = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);

        transport.close();
        transport.close();

        assertFailsWith(CancellationException.class, wait);
        assertEquals(1, fake.closeCount());
        assertEquals(1, sink.transportEvents(ConsoleTransportEvent.Kind.CLOSED).size());
    }

    @Test
    void operationsAfterCloseAreRejected() {
        transport.close();

        assertThrows(IllegalStateException.class, () -> transport.send(new ConnectResponse(0, PairingState.PAIRED, 1)));
        assertFailsWith(CancellationException.class,
                transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND));
    }

    @Test
    void transportFailureFailsPendingWaits() {
        CompletableFuture<ConnectResponse> wait = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);
        IOException cause = new IOException("port unreachable");

        fake.failTransport(cause);

        ConsoleLinkException failure = assertFailsWith(ConsoleLinkException.class, wait);
        assertSame(cause, failure.getCause());
        assertEquals(1, sink.transportEvents(ConsoleTransportEvent.Kind.DOWN).size());
    }

    @Test
    void orderlyTransportDownLeavesWaitsToTheirDeadlines() {
        CompletableFuture<ConnectResponse> wait = transport.sendAndWait(() -> { }, ConnectResponse.class, r -> true, ONE_SECOND);

        fake.failTransport(null);
        assertFalse(wait.isDone());

        scheduler.advanceMillis(1000);
        assertFailsWith(TimeoutException.class, wait);
    }

    private static SessionFrame frame(long channelId, SessionMessage message) {
        return new SessionFrame(7, channelId, message);
    }
}
