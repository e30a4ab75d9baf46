package express.mvp.tenacity.client.event;

import express.mvp.tenacity.client.codec.Message;
import java.util.Objects;

/**
 * Closed set of events published by a connection client.
 *
 * <p>Each event knows which {@link ConnectionListener} method it maps to, so publishing is a
 * plain virtual call.
 */
public sealed interface ConnectionEvent {

    /**
     * Delivers this event to the matching listener method.
     *
     * @param listener the receiver
     */
    void dispatchTo(ConnectionListener listener);

    /** The connection is established. */
    record Connected() implements ConnectionEvent {
        @Override
        public void dispatchTo(ConnectionListener listener) {
            listener.onConnected();
        }
    }

    /** The connection is gone, intentionally or not. */
    record Disconnected() implements ConnectionEvent {
        @Override
        public void dispatchTo(ConnectionListener listener) {
            listener.onDisconnected();
        }
    }

    /**
     * An error worth reporting to the application.
     *
     * @param message description
     */
    record Error(String message) implements ConnectionEvent {
        public Error {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public void dispatchTo(ConnectionListener listener) {
            listener.onError(message);
        }
    }

    /**
     * A latency sample from a liveness probe.
     *
     * @param latencyMillis round-trip time in milliseconds
     */
    record LatencyMeasured(double latencyMillis) implements ConnectionEvent {
        @Override
        public void dispatchTo(ConnectionListener listener) {
            listener.onLatencyMeasured(latencyMillis);
        }
    }

    /**
     * An application message arrived.
     *
     * @param message the message
     */
    record MessageReceived(Message message) implements ConnectionEvent {
        public MessageReceived {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public void dispatchTo(ConnectionListener listener) {
            listener.onMessageReceived(message);
        }
    }
}
