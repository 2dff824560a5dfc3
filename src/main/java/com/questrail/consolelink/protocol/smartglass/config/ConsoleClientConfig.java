package com.questrail.consolelink.protocol.smartglass.config;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Aggregated configuration for connecting to a console.
 *
 * @param timingPolicy reply windows and handshake backoff
 * @param remotePort   UDP port the console listens on
 * @param bindAddress  local address the datagram endpoint binds to
 */
public record ConsoleClientConfig(
    ConsoleTimingPolicy timingPolicy,
    int remotePort,
    InetSocketAddress bindAddress
) {
    public static final int DEFAULT_REMOTE_PORT = 5050;

    public ConsoleClientConfig {
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(bindAddress, "bindAddress");
        if (remotePort < 1 || remotePort > 65535) {
            throw new IllegalArgumentException("remotePort must be 1-65535");
        }
    }

    public static ConsoleClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ConsoleTimingPolicy timingPolicy = ConsoleTimingPolicy.defaults();
        private int remotePort = DEFAULT_REMOTE_PORT;
        private InetSocketAddress bindAddress = new InetSocketAddress(0);

        public Builder withTimingPolicy(ConsoleTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withRemotePort(int remotePort) {
            this.remotePort = remotePort;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public ConsoleClientConfig build() {
            return new ConsoleClientConfig(timingPolicy, remotePort, bindAddress);
        }
    }
}
