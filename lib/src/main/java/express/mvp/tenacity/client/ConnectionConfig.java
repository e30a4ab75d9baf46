package express.mvp.tenacity.client;

import express.mvp.tenacity.client.codec.MessageCodec;
import express.mvp.tenacity.client.error.BackoffPolicy;
import express.mvp.tenacity.client.error.BackoffStrategy;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of a {@link ConnectionClient}.
 *
 * <p>Built with {@link #builder()} or loaded from JSON by {@link ConnectionConfigLoader}. Every
 * option is validated when it is set or at {@link Builder#build()}; invalid values raise
 * {@link ConfigurationException}.
 *
 * <h2>Defaults</h2>
 *
 * <table>
 *   <caption>Option defaults</caption>
 *   <tr><th>Option</th><th>Default</th></tr>
 *   <tr><td>connectTimeout</td><td>5 s</td></tr>
 *   <tr><td>maxRetryAttempts</td><td>3</td></tr>
 *   <tr><td>retryBaseDelay</td><td>1 s, linear</td></tr>
 *   <tr><td>maxRetryDelay</td><td>30 s</td></tr>
 *   <tr><td>enableJitter</td><td>false</td></tr>
 *   <tr><td>keepaliveInterval</td><td>30 s</td></tr>
 *   <tr><td>reconnectDelay</td><td>5 s</td></tr>
 *   <tr><td>compressionThreshold</td><td>512 bytes</td></tr>
 *   <tr><td>maxFrameSize</td><td>4 MiB</td></tr>
 *   <tr><td>sendQueueCapacity</td><td>1024 messages</td></tr>
 *   <tr><td>disconnectTimeout</td><td>2 s</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ConnectionConfig config = ConnectionConfig.builder()
 *     .serverAddress("tcp://game.example.com:4000")
 *     .backoffStrategy(BackoffStrategy.EXPONENTIAL)
 *     .enableJitter(true)
 *     .build();
 * }</pre>
 */
public final class ConnectionConfig {

    private final String clientName;
    private final ServerAddress serverAddress;
    private final Duration connectTimeout;
    private final int maxRetryAttempts;
    private final Duration retryBaseDelay;
    private final BackoffStrategy backoffStrategy;
    private final Duration maxRetryDelay;
    private final boolean enableJitter;
    private final Duration keepaliveInterval;
    private final boolean enableKeepalive;
    private final Duration reconnectDelay;
    private final boolean enableAutoReconnect;
    private final Duration probeTimeout;
    private final boolean heartbeatAckRequired;
    private final int compressionThreshold;
    private final boolean compressionEnabled;
    private final int maxFrameSize;
    private final int sendQueueCapacity;
    private final Duration disconnectTimeout;
    private final Duration gracefulCloseTimeout;
    private final Duration readPollInterval;

    private ConnectionConfig(Builder builder, ServerAddress serverAddress) {
        this.clientName = builder.clientName;
        this.serverAddress = serverAddress;
        this.connectTimeout = builder.connectTimeout;
        this.maxRetryAttempts = builder.maxRetryAttempts;
        this.retryBaseDelay = builder.retryBaseDelay;
        this.backoffStrategy = builder.backoffStrategy;
        this.maxRetryDelay = builder.maxRetryDelay;
        this.enableJitter = builder.enableJitter;
        this.keepaliveInterval = builder.keepaliveInterval;
        this.enableKeepalive = builder.enableKeepalive;
        this.reconnectDelay = builder.reconnectDelay;
        this.enableAutoReconnect = builder.enableAutoReconnect;
        this.probeTimeout = builder.probeTimeout != null ? builder.probeTimeout : builder.connectTimeout;
        this.heartbeatAckRequired = builder.heartbeatAckRequired;
        this.compressionThreshold = builder.compressionThreshold;
        this.compressionEnabled = builder.compressionEnabled;
        this.maxFrameSize = builder.maxFrameSize;
        this.sendQueueCapacity = builder.sendQueueCapacity;
        this.disconnectTimeout = builder.disconnectTimeout;
        this.gracefulCloseTimeout = builder.gracefulCloseTimeout;
        this.readPollInterval = builder.readPollInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this configuration.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder()
                .clientName(clientName)
                .serverAddress(serverAddress.toString())
                .connectTimeout(connectTimeout)
                .maxRetryAttempts(maxRetryAttempts)
                .retryBaseDelay(retryBaseDelay)
                .backoffStrategy(backoffStrategy)
                .maxRetryDelay(maxRetryDelay)
                .enableJitter(enableJitter)
                .keepaliveInterval(keepaliveInterval)
                .enableKeepalive(enableKeepalive)
                .reconnectDelay(reconnectDelay)
                .enableAutoReconnect(enableAutoReconnect)
                .probeTimeout(probeTimeout)
                .heartbeatAckRequired(heartbeatAckRequired)
                .compressionThreshold(compressionThreshold)
                .compressionEnabled(compressionEnabled)
                .maxFrameSize(maxFrameSize)
                .sendQueueCapacity(sendQueueCapacity)
                .disconnectTimeout(disconnectTimeout)
                .gracefulCloseTimeout(gracefulCloseTimeout)
                .readPollInterval(readPollInterval);
    }

    /**
     * Creates the backoff policy described by the retry options.
     *
     * @return a new policy
     */
    public BackoffPolicy backoffPolicy() {
        return BackoffPolicy.builder()
                .strategy(backoffStrategy)
                .baseDelay(retryBaseDelay)
                .maxDelay(maxRetryDelay)
                .maxAttempts(maxRetryAttempts)
                .jitter(enableJitter)
                .build();
    }

    /**
     * Creates the codec described by the framing options.
     *
     * @return a new codec
     */
    public MessageCodec codec() {
        return new MessageCodec(compressionThreshold, compressionEnabled, maxFrameSize);
    }

    public String clientName() {
        return clientName;
    }

    public ServerAddress serverAddress() {
        return serverAddress;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public int maxRetryAttempts() {
        return maxRetryAttempts;
    }

    public Duration retryBaseDelay() {
        return retryBaseDelay;
    }

    public BackoffStrategy backoffStrategy() {
        return backoffStrategy;
    }

    public Duration maxRetryDelay() {
        return maxRetryDelay;
    }

    public boolean enableJitter() {
        return enableJitter;
    }

    public Duration keepaliveInterval() {
        return keepaliveInterval;
    }

    public boolean enableKeepalive() {
        return enableKeepalive;
    }

    public Duration reconnectDelay() {
        return reconnectDelay;
    }

    public boolean enableAutoReconnect() {
        return enableAutoReconnect;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public boolean heartbeatAckRequired() {
        return heartbeatAckRequired;
    }

    public int compressionThreshold() {
        return compressionThreshold;
    }

    public boolean compressionEnabled() {
        return compressionEnabled;
    }

    public int maxFrameSize() {
        return maxFrameSize;
    }

    public int sendQueueCapacity() {
        return sendQueueCapacity;
    }

    public Duration disconnectTimeout() {
        return disconnectTimeout;
    }

    public Duration gracefulCloseTimeout() {
        return gracefulCloseTimeout;
    }

    public Duration readPollInterval() {
        return readPollInterval;
    }

    @Override
    public String toString() {
        return "ConnectionConfig[" + clientName + " -> " + serverAddress
                + ", retries=" + maxRetryAttempts + " " + backoffStrategy
                + ", keepalive=" + (enableKeepalive ? keepaliveInterval.toMillis() + "ms" : "off")
                + ", reconnect=" + (enableAutoReconnect ? reconnectDelay.toMillis() + "ms" : "off")
                + ", maxFrame=" + maxFrameSize + "]";
    }

    /** Builder for {@link ConnectionConfig}. */
    public static final class Builder {
        private String clientName = "client";
        private String serverAddress;
        private Duration connectTimeout = Duration.ofMillis(5000);
        private int maxRetryAttempts = 3;
        private Duration retryBaseDelay = Duration.ofMillis(1000);
        private BackoffStrategy backoffStrategy = BackoffStrategy.LINEAR;
        private Duration maxRetryDelay = Duration.ofSeconds(30);
        private boolean enableJitter = false;
        private Duration keepaliveInterval = Duration.ofMillis(30_000);
        private boolean enableKeepalive = true;
        private Duration reconnectDelay = Duration.ofMillis(5000);
        private boolean enableAutoReconnect = true;
        private Duration probeTimeout;
        private boolean heartbeatAckRequired = false;
        private int compressionThreshold = MessageCodec.DEFAULT_COMPRESSION_THRESHOLD;
        private boolean compressionEnabled = true;
        private int maxFrameSize = MessageCodec.DEFAULT_MAX_FRAME_SIZE;
        private int sendQueueCapacity = 1024;
        private Duration disconnectTimeout = Duration.ofMillis(2000);
        private Duration gracefulCloseTimeout = Duration.ofMillis(100);
        private Duration readPollInterval = Duration.ofMillis(100);

        private Builder() {}

        public Builder clientName(String clientName) {
            if (clientName == null || clientName.isBlank()) {
                throw new ConfigurationException("clientName must not be blank");
            }
            this.clientName = clientName;
            return this;
        }

        public Builder serverAddress(String serverAddress) {
            this.serverAddress = serverAddress;
            return this;
        }

        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = positive(timeout, "connectTimeout");
            return this;
        }

        public Builder maxRetryAttempts(int attempts) {
            if (attempts < 1) {
                throw new ConfigurationException("maxRetryAttempts must be >= 1: " + attempts);
            }
            this.maxRetryAttempts = attempts;
            return this;
        }

        public Builder retryBaseDelay(Duration delay) {
            this.retryBaseDelay = nonNegative(delay, "retryBaseDelay");
            return this;
        }

        public Builder backoffStrategy(BackoffStrategy strategy) {
            this.backoffStrategy = Objects.requireNonNull(strategy, "backoffStrategy");
            return this;
        }

        public Builder maxRetryDelay(Duration delay) {
            this.maxRetryDelay = nonNegative(delay, "maxRetryDelay");
            return this;
        }

        public Builder enableJitter(boolean enable) {
            this.enableJitter = enable;
            return this;
        }

        public Builder keepaliveInterval(Duration interval) {
            this.keepaliveInterval = positive(interval, "keepaliveInterval");
            return this;
        }

        public Builder enableKeepalive(boolean enable) {
            this.enableKeepalive = enable;
            return this;
        }

        public Builder reconnectDelay(Duration delay) {
            this.reconnectDelay = positive(delay, "reconnectDelay");
            return this;
        }

        public Builder enableAutoReconnect(boolean enable) {
            this.enableAutoReconnect = enable;
            return this;
        }

        /**
         * Sets how long a liveness probe may take. Defaults to the connect timeout.
         *
         * @param timeout probe timeout
         * @return this builder
         */
        public Builder probeTimeout(Duration timeout) {
            this.probeTimeout = positive(timeout, "probeTimeout");
            return this;
        }

        /**
         * Makes framed-stream probes wait for the server to echo the heartbeat, which also yields
         * a latency sample. Without it a probe only sends the heartbeat.
         *
         * @param required whether to wait for the echo
         * @return this builder
         */
        public Builder heartbeatAckRequired(boolean required) {
            this.heartbeatAckRequired = required;
            return this;
        }

        public Builder compressionThreshold(int bytes) {
            if (bytes < 0) {
                throw new ConfigurationException("compressionThreshold must not be negative: " + bytes);
            }
            this.compressionThreshold = bytes;
            return this;
        }

        public Builder compressionEnabled(boolean enabled) {
            this.compressionEnabled = enabled;
            return this;
        }

        public Builder maxFrameSize(int bytes) {
            if (bytes < MessageCodec.MESSAGE_HEADER_SIZE
                    || bytes > Integer.MAX_VALUE - MessageCodec.LENGTH_PREFIX_SIZE) {
                throw new ConfigurationException("maxFrameSize out of range: " + bytes);
            }
            this.maxFrameSize = bytes;
            return this;
        }

        public Builder sendQueueCapacity(int capacity) {
            if (capacity < 1) {
                throw new ConfigurationException("sendQueueCapacity must be >= 1: " + capacity);
            }
            this.sendQueueCapacity = capacity;
            return this;
        }

        public Builder disconnectTimeout(Duration timeout) {
            this.disconnectTimeout = positive(timeout, "disconnectTimeout");
            return this;
        }

        public Builder gracefulCloseTimeout(Duration timeout) {
            this.gracefulCloseTimeout = nonNegative(timeout, "gracefulCloseTimeout");
            return this;
        }

        public Builder readPollInterval(Duration interval) {
            this.readPollInterval = positive(interval, "readPollInterval");
            return this;
        }

        /**
         * Validates and builds the configuration.
         *
         * @return the configuration
         * @throws ConfigurationException if the address is missing or malformed
         */
        public ConnectionConfig build() {
            ServerAddress address = ServerAddress.parse(serverAddress);
            if (maxRetryDelay.compareTo(retryBaseDelay) < 0) {
                throw new ConfigurationException("maxRetryDelay " + maxRetryDelay
                        + " is shorter than retryBaseDelay " + retryBaseDelay);
            }
            return new ConnectionConfig(this, address);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new ConfigurationException(name + " must be positive: " + value);
            }
            return value;
        }

        private static Duration nonNegative(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative()) {
                throw new ConfigurationException(name + " must not be negative: " + value);
            }
            return value;
        }
    }
}
