package com.questrail.consolelink.protocol.smartglass.channel;

import com.questrail.consolelink.protocol.smartglass.model.SessionMessage;
import com.questrail.consolelink.protocol.smartglass.session.SessionMessageListener;
import com.questrail.consolelink.protocol.smartglass.session.SessionMessageTransport;
import com.questrail.consolelink.protocol.smartglass.transport.Subscription;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * A session dispatcher view bound to one console-assigned channel id.
 *
 * <p>Outbound messages are stamped with the channel id; listeners and waits
 * only see frames carrying it. Closing drops this view's listeners and sends
 * nothing to the console; the session keeps running.</p>
 */
public final class ChannelMessageTransport implements AutoCloseable {

    private final long channelId;
    private final SessionMessageTransport session;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public ChannelMessageTransport(long channelId, SessionMessageTransport session) {
        if (channelId < 0) {
            throw new IllegalArgumentException("channelId must be >= 0");
        }
        this.channelId = channelId;
        this.session = Objects.requireNonNull(session, "session");
    }

    public long channelId() {
        return channelId;
    }

    public void send(SessionMessage message) {
        session.send(channelId, message);
    }

    public <T extends SessionMessage> CompletableFuture<T> sendAndWait(Runnable send,
                                                                       Class<T> type,
                                                                       Predicate<? super T> predicate,
                                                                       Duration timeout) {
        return session.sendAndWait(channelId, send, type, predicate, timeout);
    }

    /**
     * Listen for frames on this channel only.
     */
    public Subscription addMessageListener(SessionMessageListener listener) {
        Objects.requireNonNull(listener, "listener");
        Subscription subscription = session.addMessageListener(frame -> {
            if (frame.channelId() == channelId) {
                listener.onMessage(frame);
            }
        });
        subscriptions.add(subscription);
        return () -> {
            subscriptions.remove(subscription);
            subscription.close();
        };
    }

    @Override
    public void close() {
        for (Subscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
    }
}
