package com.questrail.consolelink.protocol.smartglass.transport;

import com.questrail.consolelink.protocol.smartglass.ConsoleLinkException;
import com.questrail.consolelink.protocol.smartglass.internal.exec.Futures;
import com.questrail.consolelink.protocol.smartglass.internal.time.Cancellable;
import com.questrail.consolelink.protocol.smartglass.internal.time.MonotonicClock;
import com.questrail.consolelink.protocol.smartglass.internal.time.MonotonicScheduler;
import com.questrail.consolelink.protocol.smartglass.internal.time.WallClock;
import com.questrail.consolelink.protocol.smartglass.model.ConsoleMessage;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleErrorEvent;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleObservabilitySink;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleProtocolEvent;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleTransportEvent;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * CorrelatedMessageTransport
 * =============================================================================
 * Send-then-await-reply on top of a {@link MessageTransport}, while every
 * inbound message is still broadcast to passive subscribers.
 *
 * <h2>Two delivery paths</h2>
 * Each inbound message is, in arrival order:
 * <ol>
 *   <li>published to every subscriber registered at that moment</li>
 *   <li>offered to the live pending waits in registration order; the first
 *       wait whose type and predicate accept it is fulfilled and no other wait
 *       sees it</li>
 * </ol>
 * The paths are independent: a message that fulfils a wait is still published,
 * and a failing subscriber does not stop correlation.
 *
 * <h2>Registration before send</h2>
 * {@link #sendAndWait} registers the pending wait and arms its deadline
 * before running the send action, so a reply delivered while the send is
 * still on the stack is matched. Messages that arrived before registration
 * are never matched retroactively.
 *
 * <h2>Deadlines</h2>
 * A wait's deadline is measured on the {@link MonotonicClock} from its
 * registration. Expiry fails that wait alone with {@link TimeoutException};
 * it does not cancel the send, touch other waits, or stop the transport.
 *
 * <h2>Threading</h2>
 * Dispatch runs on the transport's callback thread and never blocks. Wait
 * futures complete on the dispatch thread (match) or the scheduler thread
 * (timeout); continuations that do real work should hop to their own executor.
 */
public final class CorrelatedMessageTransport implements MessageTransportListener, AutoCloseable {

    private final MessageTransport transport;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final ConsoleObservabilitySink observabilitySink;

    private final AtomicLong nextWaitId = new AtomicLong();
    private final ConcurrentSkipListMap<Long, PendingWait<?>> pendingWaits = new ConcurrentSkipListMap<>();
    private final List<Consumer<? super ConsoleMessage>> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public CorrelatedMessageTransport(MessageTransport transport,
                                      MonotonicClock clock,
                                      MonotonicScheduler scheduler,
                                      WallClock wallClock,
                                      ConsoleObservabilitySink observabilitySink) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");

        this.transport.setListener(this);
    }

    public void start() {
        transport.start();
    }

    /**
     * Transmit a message; no reply is awaited.
     *
     * @throws IllegalStateException if this transport has been closed
     */
    public void send(ConsoleMessage message) {
        Objects.requireNonNull(message, "message");
        if (closed.get()) {
            throw new IllegalStateException("transport is closed");
        }
        transport.send(message);
    }

    /**
     * Register a wait for the first inbound {@code type} message accepted by
     * {@code predicate}, then run {@code send}.
     *
     * @return completes with the matched message; fails with
     *         {@link TimeoutException} after {@code timeout}, with
     *         {@link CancellationException} if the transport is closed first,
     *         with the scheduler's rejection if the deadline cannot be armed
     *         (the send is then skipped), or with whatever {@code send} threw
     */
    public <T extends ConsoleMessage> CompletableFuture<T> sendAndWait(Runnable send,
                                                                       Class<T> type,
                                                                       Predicate<? super T> predicate,
                                                                       Duration timeout) {
        Objects.requireNonNull(send, "send");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }

        if (closed.get()) {
            return Futures.failed(new CancellationException("transport is closed"));
        }

        long waitId = nextWaitId.incrementAndGet();
        PendingWait<T> wait = new PendingWait<>(waitId, type, predicate);

        pendingWaits.put(waitId, wait);
        wait.future.whenComplete((value, failure) -> {
            pendingWaits.remove(waitId, wait);
            wait.cancelDeadline();
        });
        try {
            wait.deadline = scheduler.scheduleAfter(timeout, clock, () -> wait.expire(timeout));
        } catch (RuntimeException e) {
            // A wait without a deadline must not stay registered and consume replies.
            pendingWaits.remove(waitId, wait);
            wait.future.completeExceptionally(e);
            return wait.future;
        }

        // close() may have swept the map before our put.
        if (closed.get()) {
            wait.future.completeExceptionally(new CancellationException("transport is closed"));
            return wait.future;
        }

        try {
            send.run();
        } catch (RuntimeException e) {
            wait.future.completeExceptionally(e);
        }

        return wait.future;
    }

    /**
     * Register a passive subscriber for every inbound message.
     */
    public Subscription addSubscriber(Consumer<? super ConsoleMessage> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    /**
     * Number of waits still outstanding.
     */
    public int pendingWaitCount() {
        return pendingWaits.size();
    }

    /**
     * Cancel every outstanding wait, then close the underlying transport.
     * Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        failAll(new CancellationException("transport is closed"));
        subscribers.clear();
        transport.close();

        observabilitySink.onTransportEvent(new ConsoleTransportEvent(
                wallClock.now(), ConsoleTransportEvent.Kind.CLOSED, "correlated transport closed", null));
    }

    // -------------------------------------------------------------------------
    // MessageTransportListener
    // -------------------------------------------------------------------------

    @Override
    public void onMessage(ConsoleMessage message) {
        Objects.requireNonNull(message, "message");
        if (closed.get()) {
            return;
        }

        for (Consumer<? super ConsoleMessage> subscriber : subscribers) {
            try {
                subscriber.accept(message);
            } catch (RuntimeException e) {
                observabilitySink.onError(new ConsoleErrorEvent(
                        wallClock.now(), "Subscriber failed on " + message.getClass().getSimpleName(), e));
            }
        }

        for (Map.Entry<Long, PendingWait<?>> entry : pendingWaits.entrySet()) {
            if (entry.getValue().offer(message)) {
                break;
            }
        }
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (closed.get()) {
            return;
        }

        observabilitySink.onTransportEvent(new ConsoleTransportEvent(
                wallClock.now(), ConsoleTransportEvent.Kind.DOWN, "transport down", cause));

        // Transport failures are not retried here; waiters see them at once.
        if (cause != null) {
            failAll(new ConsoleLinkException("transport failed", cause));
        }
    }

    private void failAll(Throwable failure) {
        for (PendingWait<?> wait : pendingWaits.values()) {
            wait.future.completeExceptionally(failure);
        }
    }

    /**
     * One outstanding correlation record.
     */
    private final class PendingWait<T extends ConsoleMessage> {
        private final long id;
        private final Class<T> type;
        private final Predicate<? super T> predicate;
        private final CompletableFuture<T> future = new CompletableFuture<>();
        private volatile Cancellable deadline;

        private PendingWait(long id, Class<T> type, Predicate<? super T> predicate) {
            this.id = id;
            this.type = type;
            this.predicate = predicate;
        }

        /**
         * @return {@code true} if this wait consumed the message
         */
        boolean offer(ConsoleMessage message) {
            if (!type.isInstance(message)) {
                return false;
            }

            T candidate = type.cast(message);
            boolean matches;
            try {
                matches = predicate.test(candidate);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
                return false;
            }

            if (!matches || !pendingWaits.remove(id, this)) {
                return false;
            }
            return future.complete(candidate);
        }

        void expire(Duration timeout) {
            if (!pendingWaits.remove(id, this)) {
                return;
            }

            observabilitySink.onProtocolEvent(new ConsoleProtocolEvent(
                    wallClock.now(),
                    ConsoleProtocolEvent.Kind.WAIT_TIMEOUT,
                    "no " + type.getSimpleName() + " within " + timeout.toMillis() + "ms"));
            future.completeExceptionally(new TimeoutException(
                    "No " + type.getSimpleName() + " received within " + timeout.toMillis() + "ms"));
        }

        void cancelDeadline() {
            Cancellable d = deadline;
            if (d != null) {
                d.cancel();
            }
        }
    }
}
