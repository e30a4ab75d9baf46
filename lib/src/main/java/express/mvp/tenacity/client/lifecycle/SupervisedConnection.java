package express.mvp.tenacity.client.lifecycle;

import java.io.IOException;
import java.time.Duration;
import java.util.OptionalDouble;
import java.util.concurrent.TimeoutException;

/**
 * What {@link HealthMonitor} and {@link ReconnectSupervisor} need from the connection they watch.
 */
public interface SupervisedConnection {

    /**
     * Returns a name for log messages.
     *
     * @return the connection name
     */
    String name();

    ConnectionState state();

    /**
     * Runs one liveness probe.
     *
     * @param timeout how long to wait for the peer
     * @return the measured latency in milliseconds, or empty if the probe does not measure one
     * @throws IOException if the transport failed
     * @throws TimeoutException if the peer did not answer in time
     */
    OptionalDouble probe(Duration timeout) throws IOException, TimeoutException;

    /**
     * Tears the current connection down after a failure detected outside the I/O loops.
     *
     * @param cause what went wrong
     */
    void connectionLost(Throwable cause);

    /**
     * Runs one reconnect cycle, with the connection's own retry policy.
     *
     * @return true if the connection is established again
     */
    boolean reconnect();
}
