package com.questrail.consolelink.protocol.smartglass.session;

import com.questrail.consolelink.api.ConsoleStatus;
import com.questrail.consolelink.api.ConsoleStatusListener;
import com.questrail.consolelink.protocol.smartglass.internal.time.WallClock;
import com.questrail.consolelink.protocol.smartglass.model.ConsoleMessage;
import com.questrail.consolelink.protocol.smartglass.model.ConsoleStatusMessage;
import com.questrail.consolelink.protocol.smartglass.model.LocalJoin;
import com.questrail.consolelink.protocol.smartglass.model.SessionFrame;
import com.questrail.consolelink.protocol.smartglass.model.SessionMessage;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleErrorEvent;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleObservabilitySink;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleProtocolEvent;
import com.questrail.consolelink.protocol.smartglass.transport.CorrelatedMessageTransport;
import com.questrail.consolelink.protocol.smartglass.transport.Subscription;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * SessionMessageTransport
 * =============================================================================
 * Owns an established session's identity and layers it over the shared
 * {@link CorrelatedMessageTransport}.
 *
 * <h2>Outbound</h2>
 * Every message is stamped into a {@link SessionFrame} carrying the participant
 * id and a channel id ({@link #CORE_CHANNEL_ID} unless a channel sends it).
 *
 * <h2>Inbound</h2>
 * Every session frame is fanned out to all {@link SessionMessageListener}s.
 * A {@link ConsoleStatusMessage} additionally becomes a {@link ConsoleStatus}
 * snapshot: it replaces the latest status, then is delivered to every
 * {@link ConsoleStatusListener}. Other kinds are
 * ignored by the status path.
 *
 * <h2>Correlation</h2>
 * {@link #sendAndWait} delegates to the correlated transport; the session
 * context only narrows the match to session frames with the expected payload.
 *
 * <h2>Local join</h2>
 * Construction sends a {@link LocalJoin} so the console registers this
 * participant. It is fire-and-forget: a failure is reported to the
 * observability sink and shows up later only as reply timeouts.
 */
public final class SessionMessageTransport implements AutoCloseable {

    /** Channel id of session-level (non-channel) traffic. */
    public static final long CORE_CHANNEL_ID = 0L;

    private final CorrelatedMessageTransport transport;
    private final SessionInfo sessionInfo;
    private final WallClock wallClock;
    private final ConsoleObservabilitySink observabilitySink;

    private final List<SessionMessageListener> messageListeners = new CopyOnWriteArrayList<>();
    private final List<ConsoleStatusListener> statusListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Subscription subscription;
    private volatile ConsoleStatus latestStatus;

    public SessionMessageTransport(CorrelatedMessageTransport transport,
                                   SessionInfo sessionInfo,
                                   WallClock wallClock,
                                   ConsoleObservabilitySink observabilitySink) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sessionInfo = Objects.requireNonNull(sessionInfo, "sessionInfo");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");

        this.subscription = transport.addSubscriber(this::dispatch);

        sendLocalJoin();
    }

    public SessionInfo sessionInfo() {
        return sessionInfo;
    }

    /**
     * The most recent status the console reported, if any arrived yet.
     */
    public Optional<ConsoleStatus> latestConsoleStatus() {
        return Optional.ofNullable(latestStatus);
    }

    /**
     * Send a session-level message on the core channel.
     */
    public void send(SessionMessage message) {
        send(CORE_CHANNEL_ID, message);
    }

    /**
     * Send a message on the given channel.
     *
     * @throws IllegalStateException if the session has been closed
     */
    public void send(long channelId, SessionMessage message) {
        Objects.requireNonNull(message, "message");
        if (closed.get()) {
            throw new IllegalStateException("session is closed");
        }
        transport.send(new SessionFrame(sessionInfo.participantId(), channelId, message));
    }

    /**
     * Run {@code send}, then wait for the first {@code type} payload on any
     * channel that satisfies {@code predicate}.
     */
    public <T extends SessionMessage> CompletableFuture<T> sendAndWait(Runnable send,
                                                                       Class<T> type,
                                                                       Predicate<? super T> predicate,
                                                                       Duration timeout) {
        return sendAndWait(frame -> true, send, type, predicate, timeout);
    }

    /**
     * Like {@link #sendAndWait(Runnable, Class, Predicate, Duration)}, restricted
     * to frames on {@code channelId}.
     */
    public <T extends SessionMessage> CompletableFuture<T> sendAndWait(long channelId,
                                                                       Runnable send,
                                                                       Class<T> type,
                                                                       Predicate<? super T> predicate,
                                                                       Duration timeout) {
        return sendAndWait(frame -> frame.channelId() == channelId, send, type, predicate, timeout);
    }

    private <T extends SessionMessage> CompletableFuture<T> sendAndWait(Predicate<SessionFrame> scope,
                                                                        Runnable send,
                                                                        Class<T> type,
                                                                        Predicate<? super T> predicate,
                                                                        Duration timeout) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(predicate, "predicate");

        return transport.sendAndWait(
                send,
                SessionFrame.class,
                frame -> scope.test(frame)
                        && type.isInstance(frame.message())
                        && predicate.test(type.cast(frame.message())),
                timeout
        ).thenApply(frame -> type.cast(frame.message()));
    }

    public Subscription addMessageListener(SessionMessageListener listener) {
        Objects.requireNonNull(listener, "listener");
        messageListeners.add(listener);
        return () -> messageListeners.remove(listener);
    }

    public Subscription addConsoleStatusListener(ConsoleStatusListener listener) {
        Objects.requireNonNull(listener, "listener");
        statusListeners.add(listener);
        return () -> statusListeners.remove(listener);
    }

    /**
     * Detach from the transport. Sends no leave message. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            subscription.close();
            messageListeners.clear();
            statusListeners.clear();
        }
    }

    private void sendLocalJoin() {
        try {
            send(LocalJoin.defaults());
            observabilitySink.onProtocolEvent(new ConsoleProtocolEvent(
                    wallClock.now(),
                    ConsoleProtocolEvent.Kind.LOCAL_JOIN_SENT,
                    "participant " + sessionInfo.participantId()));
        } catch (RuntimeException e) {
            observabilitySink.onError(new ConsoleErrorEvent(wallClock.now(), "Local join failed", e));
        }
    }

    private void dispatch(ConsoleMessage message) {
        if (!(message instanceof SessionFrame frame)) {
            return;
        }

        for (SessionMessageListener listener : messageListeners) {
            try {
                listener.onMessage(frame);
            } catch (RuntimeException e) {
                observabilitySink.onError(new ConsoleErrorEvent(wallClock.now(), "Session listener failed", e));
            }
        }

        if (frame.message() instanceof ConsoleStatusMessage statusMessage) {
            ConsoleStatus status = statusMessage.toStatus();
            latestStatus = status;
            for (ConsoleStatusListener listener : statusListeners) {
                try {
                    listener.onConsoleStatusChanged(status);
                } catch (RuntimeException e) {
                    observabilitySink.onError(new ConsoleErrorEvent(wallClock.now(), "Console status listener failed", e));
                }
            }
        }
    }
}
