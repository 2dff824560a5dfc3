package com.questrail.consolelink.protocol.smartglass.transport;

import com.questrail.consolelink.protocol.smartglass.config.ConsoleClientConfig;
import com.questrail.consolelink.protocol.smartglass.crypto.CryptoContext;
import com.questrail.consolelink.protocol.smartglass.internal.time.WallClock;
import com.questrail.consolelink.protocol.smartglass.model.ConsoleMessage;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleObservabilitySink;
import com.questrail.consolelink.protocol.smartglass.observability.ConsoleTransportEvent;
import com.questrail.consolelink.protocol.smartglass.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DatagramMessageTransport
 * =============================================================================
 * {@link MessageTransport} over a {@link DatagramEndpoint}.
 *
 * <h2>Inbound path (decode-before-dispatch)</h2>
 *
 * <pre>
 *   DatagramEndpoint
 *        → MessageCodec.decode (decrypt + parse)
 *            → MessageTransportListener.onMessage
 * </pre>
 *
 * <h2>Outbound path</h2>
 *
 * <pre>
 *   ConsoleMessage
 *        → MessageCodec.encode (serialize + encrypt)
 *            → DatagramEndpoint.send(console address)
 * </pre>
 *
 * <h2>Explicit non-responsibilities</h2>
 * This class MUST NOT add retries, timing, or correlation. Datagrams from
 * anyone other than the console, and datagrams the codec rejects, are dropped
 * and reported as transport events; they never reach the listener.
 */
public final class DatagramMessageTransport implements MessageTransport, DatagramEndpointListener {

    private final DatagramEndpoint endpoint;
    private final SocketAddress remote;
    private final MessageCodec codec;
    private final CryptoContext cryptoContext;
    private final ConsoleObservabilitySink observabilitySink;
    private final WallClock wallClock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile MessageTransportListener listener;

    public DatagramMessageTransport(DatagramEndpoint endpoint,
                                    SocketAddress remote,
                                    MessageCodec codec,
                                    CryptoContext cryptoContext,
                                    ConsoleObservabilitySink observabilitySink,
                                    WallClock wallClock) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.cryptoContext = Objects.requireNonNull(cryptoContext, "cryptoContext");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.endpoint.setListener(this);
    }

    /**
     * Factory producing Netty-backed transports to {@code device:config.remotePort()}.
     */
    public static MessageTransportFactory factory(MessageCodec codec,
                                                  ConsoleClientConfig config,
                                                  ConsoleObservabilitySink observabilitySink,
                                                  WallClock wallClock) {
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");

        return (device, cryptoContext) -> new DatagramMessageTransport(
                new NettyUdpDatagramEndpoint(config.bindAddress()),
                new InetSocketAddress(device.address(), config.remotePort()),
                codec,
                cryptoContext,
                observabilitySink,
                wallClock
        );
    }

    @Override
    public void setListener(MessageTransportListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        if (listener == null) {
            throw new IllegalStateException("MessageTransportListener must be set before start()");
        }
        endpoint.start();
    }

    /**
     * Encode and send a message to the console as one datagram.
     */
    @Override
    public void send(ConsoleMessage message) {
        Objects.requireNonNull(message, "message");
        if (closed.get()) {
            throw new IllegalStateException("transport is closed");
        }

        byte[] payload = codec.encode(message, cryptoContext);
        endpoint.send(remote, payload);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            endpoint.stop();
        }
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        observabilitySink.onTransportEvent(new ConsoleTransportEvent(
                wallClock.now(), ConsoleTransportEvent.Kind.STARTED, "bound for " + remote, null));
    }

    @Override
    public void onTransportDown(Throwable cause) {
        MessageTransportListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }
    }

    @Override
    public void onDatagram(SocketAddress sender, byte[] payload) {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(payload, "payload");

        if (!remote.equals(sender)) {
            drop("datagram from unexpected sender " + sender, null);
            return;
        }

        final ConsoleMessage message;
        try {
            message = codec.decode(payload, cryptoContext);
        } catch (MessageDecodeException e) {
            drop("undecodable datagram of " + payload.length + " bytes", e);
            return;
        }

        MessageTransportListener l = listener;
        if (l != null) {
            l.onMessage(message);
        }
    }

    private void drop(String detail, Throwable cause) {
        observabilitySink.onTransportEvent(new ConsoleTransportEvent(
                wallClock.now(), ConsoleTransportEvent.Kind.DATAGRAM_DROPPED, detail, cause));
    }
}
