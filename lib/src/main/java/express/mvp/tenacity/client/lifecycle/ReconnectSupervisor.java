package express.mvp.tenacity.client.lifecycle;

import express.mvp.tenacity.client.scope.CancellationToken;
import express.mvp.tenacity.client.scope.CancellationTokenSource;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Brings a lost connection back.
 *
 * <p>Every reconnect delay the supervisor looks at the connection state. When it is
 * {@link ConnectionState#DISCONNECTED} it runs one reconnect cycle; a cycle uses the connection's
 * own retry and backoff settings. It never acts while the connection is connecting, connected,
 * disconnecting or faulted, and it stops when its token is cancelled, which an intentional
 * disconnect does before touching the socket. A {@linkplain #reportFailure reported failure} ends
 * the current wait early, so the reconnect cycle starts without waiting out the delay.
 */
public final class ReconnectSupervisor implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(ReconnectSupervisor.class.getName());

    private final SupervisedConnection connection;
    private final Duration reconnectDelay;
    private final CancellationToken token;

    private final AtomicLong reconnectAttempts = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();
    private final AtomicLong reportedFailures = new AtomicLong();

    private final AtomicBoolean wakeRequested = new AtomicBoolean(false);
    private volatile CancellationTokenSource currentWait;

    /**
     * Creates a supervisor.
     *
     * @param connection the supervised connection
     * @param reconnectDelay time between state checks
     * @param token stops the supervisor
     */
    public ReconnectSupervisor(
            SupervisedConnection connection, Duration reconnectDelay, CancellationToken token) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        this.token = Objects.requireNonNull(token, "token");
        if (reconnectDelay.isZero() || reconnectDelay.isNegative()) {
            throw new IllegalArgumentException("reconnectDelay must be positive: " + reconnectDelay);
        }
    }

    @Override
    public void run() {
        LOGGER.fine(() -> connection.name() + ": reconnect supervisor started");
        while (!token.isCancellationRequested()) {
            if (!wakeRequested.getAndSet(false)) {
                awaitTick();
                if (token.isCancellationRequested()) {
                    break;
                }
                wakeRequested.set(false);
            }
            if (connection.state().needsReconnect()) {
                attemptReconnect();
            }
        }
        LOGGER.fine(() -> connection.name() + ": reconnect supervisor stopped");
    }

    /** Waits one reconnect delay, or less if a failure is reported meanwhile. */
    private void awaitTick() {
        try (CancellationTokenSource wait = CancellationTokenSource.linkedTo(token)) {
            currentWait = wait;
            if (!wakeRequested.get()) {
                wait.token().await(reconnectDelay);
            }
            currentWait = null;
        }
    }

    /**
     * Reports a failure detected by a probe. The connection is torn down now and the supervisor
     * wakes to re-establish it.
     *
     * @param cause the failure
     */
    public void reportFailure(Throwable cause) {
        if (token.isCancellationRequested()) {
            return;
        }
        reportedFailures.incrementAndGet();
        connection.connectionLost(cause);
        wakeRequested.set(true);
        CancellationTokenSource wait = currentWait;
        if (wait != null) {
            wait.cancel();
        }
    }

    private void attemptReconnect() {
        reconnectAttempts.incrementAndGet();
        LOGGER.info(connection.name() + ": attempting reconnect");
        try {
            if (connection.reconnect()) {
                reconnects.incrementAndGet();
                LOGGER.info(connection.name() + ": reconnected");
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, connection.name() + ": reconnect cycle failed", e);
        }
    }

    public long reconnectAttemptCount() {
        return reconnectAttempts.get();
    }

    public long reconnectCount() {
        return reconnects.get();
    }

    public long reportedFailureCount() {
        return reportedFailures.get();
    }
}
