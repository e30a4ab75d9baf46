package express.mvp.tenacity.client.lifecycle;

import express.mvp.tenacity.client.scope.CancellationToken;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic liveness probing of an established connection.
 *
 * <p>Every keepalive interval, and only while the connection is {@link ConnectionState#CONNECTED},
 * the monitor runs one probe. Latency recording is the connection's job; a failed or timed-out
 * probe is handed to the {@link ReconnectSupervisor}, which tears the connection down so that it
 * can be re-established.
 *
 * <p>The loop waits on its cancellation token rather than sleeping and ends as soon as the token
 * is cancelled.
 */
public final class HealthMonitor implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(HealthMonitor.class.getName());

    private final SupervisedConnection connection;
    private final ReconnectSupervisor supervisor;
    private final Duration interval;
    private final Duration probeTimeout;
    private final CancellationToken token;

    private final AtomicLong probes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    /**
     * Creates a monitor.
     *
     * @param connection the connection to probe
     * @param supervisor receives probe failures
     * @param interval time between probes
     * @param probeTimeout how long one probe may take
     * @param token stops the monitor
     */
    public HealthMonitor(
            SupervisedConnection connection,
            ReconnectSupervisor supervisor,
            Duration interval,
            Duration probeTimeout,
            CancellationToken token) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout");
        this.token = Objects.requireNonNull(token, "token");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
    }

    @Override
    public void run() {
        LOGGER.fine(() -> connection.name() + ": health monitor started, interval " + interval);
        while (!token.isCancellationRequested()) {
            if (token.await(interval)) {
                break;
            }
            if (connection.state() != ConnectionState.CONNECTED) {
                continue;
            }
            probeOnce();
        }
        LOGGER.fine(() -> connection.name() + ": health monitor stopped");
    }

    /**
     * Runs a single probe and reports a failure to the supervisor.
     *
     * @return true if the probe succeeded
     */
    public boolean probeOnce() {
        probes.incrementAndGet();
        try {
            connection.probe(probeTimeout);
            return true;
        } catch (IOException | TimeoutException | RuntimeException e) {
            if (token.isCancellationRequested()) {
                return false;
            }
            failures.incrementAndGet();
            LOGGER.log(Level.WARNING, connection.name() + ": health probe failed", e);
            supervisor.reportFailure(e);
            return false;
        }
    }

    public long probeCount() {
        return probes.get();
    }

    public long failureCount() {
        return failures.get();
    }
}
