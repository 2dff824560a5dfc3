package com.questrail.consolelink.protocol.smartglass.transport;

import com.questrail.consolelink.protocol.smartglass.model.ConsoleMessage;
import com.questrail.consolelink.protocol.smartglass.model.SessionFrame;
import com.questrail.consolelink.protocol.smartglass.model.SessionMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * FakeMessageTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link MessageTransport}.
 *
 * <p>Records every outbound message and lets tests inject inbound messages.
 * An optional responder is consulted synchronously inside {@link #send}; a
 * non-null reply is delivered before {@code send} returns, which is the
 * tightest ordering a real console could produce.</p>
 */
public final class FakeMessageTransport implements MessageTransport {

    private MessageTransportListener listener;
    private final List<ConsoleMessage> sent = new ArrayList<>();
    private Function<ConsoleMessage, ConsoleMessage> responder = message -> null;
    private RuntimeException startFailure;
    private RuntimeException closeFailure;
    private Runnable closeHook = () -> { };
    private boolean started;
    private int closeCount;

    @Override
    public synchronized void setListener(MessageTransportListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized void start() {
        if (startFailure != null) {
            throw startFailure;
        }
        started = true;
    }

    @Override
    public void send(ConsoleMessage message) {
        Objects.requireNonNull(message, "message");
        ConsoleMessage reply;
        synchronized (this) {
            sent.add(message);
            reply = responder.apply(message);
        }
        if (reply != null) {
            inject(reply);
        }
    }

    @Override
    public synchronized void close() {
        closeCount++;
        closeHook.run();
        if (closeFailure != null) {
            throw closeFailure;
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void inject(ConsoleMessage message) {
        MessageTransportListener l;
        synchronized (this) {
            l = listener;
        }
        if (l == null) {
            throw new IllegalStateException("No listener installed");
        }
        l.onMessage(message);
    }

    public void injectFrame(int participantId, long channelId, SessionMessage message) {
        inject(new SessionFrame(participantId, channelId, message));
    }

    public void failTransport(Throwable cause) {
        MessageTransportListener l;
        synchronized (this) {
            l = listener;
        }
        l.onTransportDown(cause);
    }

    public synchronized void respondWith(Function<ConsoleMessage, ConsoleMessage> responder) {
        this.responder = Objects.requireNonNull(responder, "responder");
    }

    public synchronized void failStartWith(RuntimeException failure) {
        this.startFailure = failure;
    }

    public synchronized void failCloseWith(RuntimeException failure) {
        this.closeFailure = failure;
    }

    /**
     * Runs inside {@link #close()}, before any configured close failure.
     */
    public synchronized void onClose(Runnable hook) {
        this.closeHook = Objects.requireNonNull(hook, "hook");
    }

    public synchronized List<ConsoleMessage> sent() {
        return new ArrayList<>(sent);
    }

    public synchronized <T extends ConsoleMessage> List<T> sentOfType(Class<T> type) {
        return sent.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    /**
     * Payloads of every outbound session frame of the given kind.
     */
    public synchronized <T extends SessionMessage> List<T> sentPayloads(Class<T> type) {
        return sent.stream()
                .filter(SessionFrame.class::isInstance)
                .map(m -> ((SessionFrame) m).message())
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public synchronized List<SessionFrame> sentFrames() {
        return sentOfType(SessionFrame.class);
    }

    public synchronized boolean isStarted() {
        return started;
    }

    public synchronized int closeCount() {
        return closeCount;
    }

    public synchronized void clearSent() {
        sent.clear();
    }
}
