package express.mvp.tenacity.client.lifecycle;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe state machine for the client lifecycle.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * DISCONNECTED  → CONNECTING
 * CONNECTING    → CONNECTED, DISCONNECTED, DISCONNECTING, FAULTED
 * CONNECTED     → DISCONNECTING, FAULTED
 * DISCONNECTING → DISCONNECTED
 * FAULTED       → DISCONNECTING
 * </pre>
 *
 * <p>Every transition is a compare-and-set on a single reference, so two threads can never both
 * leave the same state: exactly one {@code connect()} wins DISCONNECTED → CONNECTING and exactly
 * one teardown wins CONNECTED → DISCONNECTING.
 *
 * @see ConnectionState
 */
public final class ConnectionStateMachine {

    private static final Logger LOGGER = Logger.getLogger(ConnectionStateMachine.class.getName());

    private static final Set<ConnectionState> FROM_DISCONNECTED =
            EnumSet.of(ConnectionState.CONNECTING);

    private static final Set<ConnectionState> FROM_CONNECTING = EnumSet.of(
            ConnectionState.CONNECTED,
            ConnectionState.DISCONNECTED,
            ConnectionState.DISCONNECTING,
            ConnectionState.FAULTED);

    private static final Set<ConnectionState> FROM_CONNECTED =
            EnumSet.of(ConnectionState.DISCONNECTING, ConnectionState.FAULTED);

    private static final Set<ConnectionState> FROM_DISCONNECTING =
            EnumSet.of(ConnectionState.DISCONNECTED);

    private static final Set<ConnectionState> FROM_FAULTED =
            EnumSet.of(ConnectionState.DISCONNECTING);

    private final AtomicReference<ConnectionState> state =
            new AtomicReference<>(ConnectionState.DISCONNECTED);

    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    private final String connectionId;

    /**
     * Creates a state machine in {@link ConnectionState#DISCONNECTED}.
     *
     * @param connectionId identifier used in log messages
     */
    public ConnectionStateMachine(String connectionId) {
        this.connectionId = connectionId;
    }

    public ConnectionStateMachine() {
        this("client");
    }

    public ConnectionState getState() {
        return state.get();
    }

    public String getConnectionId() {
        return connectionId;
    }

    public boolean isActive() {
        return state.get().isActive();
    }

    public void addListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(ConnectionStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Transitions from an expected state.
     *
     * @param expectedState the state the caller believes is current
     * @param newState the target state
     * @return true if the state was {@code expectedState} and the transition is valid
     */
    public boolean transitionFrom(ConnectionState expectedState, ConnectionState newState) {
        return transitionFrom(expectedState, newState, null);
    }

    /**
     * Transitions from an expected state, passing a cause to listeners.
     *
     * @param expectedState the state the caller believes is current
     * @param newState the target state
     * @param cause reason for the transition, may be null
     * @return true if the transition happened
     */
    public boolean transitionFrom(
            ConnectionState expectedState, ConnectionState newState, Throwable cause) {
        if (!isValidTransition(expectedState, newState)) {
            return false;
        }
        if (state.compareAndSet(expectedState, newState)) {
            LOGGER.fine(() -> connectionId + ": " + expectedState + " -> " + newState);
            notifyListeners(expectedState, newState, cause);
            return true;
        }
        return false;
    }

    /**
     * Transitions from whatever the current state is, if the transition is valid.
     *
     * @param newState the target state
     * @param cause reason for the transition, may be null
     * @return the state that was left, or null if no transition happened
     */
    public ConnectionState transitionTo(ConnectionState newState, Throwable cause) {
        while (true) {
            ConnectionState current = state.get();
            if (!isValidTransition(current, newState)) {
                return null;
            }
            if (state.compareAndSet(current, newState)) {
                LOGGER.fine(() -> connectionId + ": " + current + " -> " + newState);
                notifyListeners(current, newState, cause);
                return current;
            }
        }
    }

    /**
     * Checks if a transition is allowed.
     *
     * @param from the source state
     * @param to the target state
     * @return true if allowed
     */
    public static boolean isValidTransition(ConnectionState from, ConnectionState to) {
        if (from == to) {
            return false;
        }
        return getValidTransitions(from).contains(to);
    }

    /**
     * Returns the states reachable from a state.
     *
     * @param from the source state
     * @return a copy of the target set
     */
    public static Set<ConnectionState> getValidTransitions(ConnectionState from) {
        return switch (from) {
            case DISCONNECTED -> EnumSet.copyOf(FROM_DISCONNECTED);
            case CONNECTING -> EnumSet.copyOf(FROM_CONNECTING);
            case CONNECTED -> EnumSet.copyOf(FROM_CONNECTED);
            case DISCONNECTING -> EnumSet.copyOf(FROM_DISCONNECTING);
            case FAULTED -> EnumSet.copyOf(FROM_FAULTED);
        };
    }

    private void notifyListeners(
            ConnectionState previous, ConnectionState current, Throwable cause) {
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current, cause);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Connection state listener failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return "ConnectionStateMachine[" + connectionId + ":" + state.get() + "]";
    }
}
