package express.mvp.tenacity.client;

import express.mvp.tenacity.client.lifecycle.ConnectionState;
import java.time.Instant;

/**
 * Point-in-time snapshot of a client's counters and health.
 *
 * <p>The counters are monotonic over the client's lifetime. The snapshot is immutable; take a
 * new one with {@link ConnectionClient#metrics()} to see later values.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ClientMetrics metrics = client.metrics();
 * if (metrics.getTotalErrors() > 0) {
 *     log.warning("Last error: " + metrics.getLastErrorMessage());
 * }
 * log.info("Average latency: " + metrics.getAverageLatencyMillis() + " ms");
 * }</pre>
 */
public final class ClientMetrics {

    private final ConnectionState state;
    private final long totalConnections;
    private final long totalDisconnections;
    private final long totalErrors;
    private final long messagesSent;
    private final long messagesReceived;
    private final double averageLatencyMillis;
    private final int latencySamples;
    private final int queuedMessages;
    private final Instant lastActivity;
    private final Instant connectedSince;
    private final String lastErrorMessage;

    private ClientMetrics(Builder builder) {
        this.state = builder.state;
        this.totalConnections = builder.totalConnections;
        this.totalDisconnections = builder.totalDisconnections;
        this.totalErrors = builder.totalErrors;
        this.messagesSent = builder.messagesSent;
        this.messagesReceived = builder.messagesReceived;
        this.averageLatencyMillis = builder.averageLatencyMillis;
        this.latencySamples = builder.latencySamples;
        this.queuedMessages = builder.queuedMessages;
        this.lastActivity = builder.lastActivity;
        this.connectedSince = builder.connectedSince;
        this.lastErrorMessage = builder.lastErrorMessage;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ConnectionState getState() {
        return state;
    }

    /**
     * Returns the number of connections established.
     *
     * @return successful connects, including automatic reconnects
     */
    public long getTotalConnections() {
        return totalConnections;
    }

    /**
     * Returns the number of connections that ended, intentionally or not.
     *
     * @return disconnect count
     */
    public long getTotalDisconnections() {
        return totalDisconnections;
    }

    public long getTotalErrors() {
        return totalErrors;
    }

    public long getMessagesSent() {
        return messagesSent;
    }

    public long getMessagesReceived() {
        return messagesReceived;
    }

    /**
     * Returns the rolling average of the retained latency samples.
     *
     * @return average in milliseconds, 0 without samples
     */
    public double getAverageLatencyMillis() {
        return averageLatencyMillis;
    }

    public int getLatencySamples() {
        return latencySamples;
    }

    public int getQueuedMessages() {
        return queuedMessages;
    }

    /**
     * Returns when a message was last sent or received.
     *
     * @return the time, or null if there was no traffic yet
     */
    public Instant getLastActivity() {
        return lastActivity;
    }

    /**
     * Returns when the current connection was established.
     *
     * @return the time, or null when not connected
     */
    public Instant getConnectedSince() {
        return connectedSince;
    }

    /**
     * Returns the description of the most recent error.
     *
     * @return the message, or null if none
     */
    public String getLastErrorMessage() {
        return lastErrorMessage;
    }

    @Override
    public String toString() {
        return String.format(
                "ClientMetrics[state=%s, connections=%d, disconnections=%d, errors=%d, "
                        + "sent=%d, received=%d, avgLatency=%.2fms]",
                state, totalConnections, totalDisconnections, totalErrors,
                messagesSent, messagesReceived, averageLatencyMillis);
    }

    /** Builder for {@link ClientMetrics}. */
    public static final class Builder {
        private ConnectionState state = ConnectionState.DISCONNECTED;
        private long totalConnections;
        private long totalDisconnections;
        private long totalErrors;
        private long messagesSent;
        private long messagesReceived;
        private double averageLatencyMillis;
        private int latencySamples;
        private int queuedMessages;
        private Instant lastActivity;
        private Instant connectedSince;
        private String lastErrorMessage;

        private Builder() {}

        public Builder state(ConnectionState state) {
            this.state = state;
            return this;
        }

        public Builder totalConnections(long count) {
            this.totalConnections = count;
            return this;
        }

        public Builder totalDisconnections(long count) {
            this.totalDisconnections = count;
            return this;
        }

        public Builder totalErrors(long count) {
            this.totalErrors = count;
            return this;
        }

        public Builder messagesSent(long count) {
            this.messagesSent = count;
            return this;
        }

        public Builder messagesReceived(long count) {
            this.messagesReceived = count;
            return this;
        }

        public Builder latency(double averageMillis, int samples) {
            this.averageLatencyMillis = averageMillis;
            this.latencySamples = samples;
            return this;
        }

        public Builder queuedMessages(int count) {
            this.queuedMessages = count;
            return this;
        }

        public Builder lastActivity(Instant time) {
            this.lastActivity = time;
            return this;
        }

        public Builder connectedSince(Instant time) {
            this.connectedSince = time;
            return this;
        }

        public Builder lastErrorMessage(String message) {
            this.lastErrorMessage = message;
            return this;
        }

        public ClientMetrics build() {
            return new ClientMetrics(this);
        }
    }
}
