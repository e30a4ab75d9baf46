package express.mvp.tenacity.client.event;

import express.mvp.tenacity.client.codec.Message;

/**
 * Receiver of connection lifecycle events.
 *
 * <p>All methods have empty defaults, so implementations override only what they need.
 * Callbacks run synchronously on the thread that published the event, which may be a client
 * background thread; keep them short and non-blocking.
 */
public interface ConnectionListener {

    default void onConnected() {}

    default void onDisconnected() {}

    /**
     * Called when the client reports an error.
     *
     * @param message human-readable description
     */
    default void onError(String message) {}

    /**
     * Called for each latency sample.
     *
     * @param latencyMillis round-trip time in milliseconds
     */
    default void onLatencyMeasured(double latencyMillis) {}

    /**
     * Called for each inbound application message.
     *
     * @param message the message
     */
    default void onMessageReceived(Message message) {}
}
