package express.mvp.tenacity.client.lifecycle;

/**
 * Lifecycle states of a connection client.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * ┌──────────────┐ connect() ┌────────────┐ success ┌───────────┐
 * │ DISCONNECTED │──────────▶│ CONNECTING │────────▶│ CONNECTED │
 * └──────────────┘           └────────────┘         └───────────┘
 *        ▲   ▲    retries exhausted │  │                │   │
 *        │   └──────────────────────┘  │ disconnect()   │   │ disconnect() or loss
 *        │                             ▼                ▼   │
 *        │                      ┌───────────────┐           │
 *        └──────────────────────│ DISCONNECTING │◀──────────┘
 *                               └───────────────┘
 *                                      ▲ disconnect()
 *                               ┌──────┴─────┐
 *                               │  FAULTED   │◀── unrecoverable error
 *                               └────────────┘    (from CONNECTING or CONNECTED)
 * </pre>
 *
 * <p>{@link #FAULTED} is left only through an explicit disconnect; nothing reconnects out of
 * it automatically.
 *
 * @see ConnectionStateMachine
 */
public enum ConnectionState {

    /** No connection and no attempt in progress. The initial state. */
    DISCONNECTED("Disconnected", false),

    /** A connect call is running its attempts. */
    CONNECTING("Connecting", false),

    /** Connected; sends are accepted. */
    CONNECTED("Connected", true),

    /** Teardown in progress. */
    DISCONNECTING("Disconnecting", false),

    /** Stopped by a protocol, configuration or fatal error. Requires disconnect then connect. */
    FAULTED("Faulted", false);

    private final String displayName;
    private final boolean active;

    ConnectionState(String displayName, boolean active) {
        this.displayName = displayName;
        this.active = active;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Checks if sends are accepted.
     *
     * @return true only for {@link #CONNECTED}
     */
    public boolean isActive() {
        return active;
    }

    /**
     * Checks if a connect call may start from this state.
     *
     * @return true only for {@link #DISCONNECTED}
     */
    public boolean canConnect() {
        return this == DISCONNECTED;
    }

    /**
     * Checks if the reconnect supervisor may act in this state.
     *
     * @return true only for {@link #DISCONNECTED}
     */
    public boolean needsReconnect() {
        return this == DISCONNECTED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
