package express.mvp.tenacity.client.lifecycle;

/**
 * Callback for connection state changes.
 *
 * <p>Invoked synchronously on the thread that made the transition. Keep implementations short.
 *
 * @see ConnectionStateMachine
 */
@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * Called after a transition.
     *
     * @param previousState state before the transition
     * @param currentState state after the transition
     * @param cause reason for the transition, may be null
     */
    void onStateChanged(ConnectionState previousState, ConnectionState currentState, Throwable cause);
}
