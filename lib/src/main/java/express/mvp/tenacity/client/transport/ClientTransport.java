package express.mvp.tenacity.client.transport;

import express.mvp.tenacity.client.codec.Message;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.OptionalDouble;
import java.util.concurrent.TimeoutException;

/**
 * One physical connection to the server, as seen by the connection client.
 *
 * <p>A transport instance is used for exactly one connection: opened once, used by one sender
 * thread and one receiver thread, then closed. A new connection gets a new transport.
 *
 * <h2>Threading Contract</h2>
 *
 * <ul>
 *   <li>{@link #write(Message)} is called from the sender loop and, once, from the disconnect
 *       path for the farewell message
 *   <li>{@link #read(Duration)} is called from the receiver loop only
 *   <li>{@link #close()} may be called from any thread at any time and must unblock the others
 * </ul>
 *
 * @see TransportFactory
 */
public interface ClientTransport extends Closeable {

    /**
     * Establishes the connection.
     *
     * @param timeout connect timeout
     * @throws IOException if the server cannot be reached
     */
    void open(Duration timeout) throws IOException;

    /**
     * Sends one message.
     *
     * @param message the message
     * @throws IOException if the transport failed
     */
    void write(Message message) throws IOException;

    /**
     * Waits up to the poll timeout for the next inbound message.
     *
     * @param pollTimeout maximum wait
     * @return the message, or null if none arrived in time
     * @throws java.io.EOFException if the peer closed the connection
     * @throws IOException if the transport failed
     */
    Message read(Duration pollTimeout) throws IOException;

    /**
     * Checks whether this transport probes liveness on its own. Transports that do not rely on
     * the client's heartbeat messages instead.
     *
     * @return true if {@link #probe(Duration)} is supported
     */
    default boolean hasNativeProbe() {
        return false;
    }

    /**
     * Probes the server and measures the round trip.
     *
     * @param timeout maximum wait
     * @return latency in milliseconds
     * @throws IOException if the probe failed
     * @throws TimeoutException if the server did not answer in time
     */
    default OptionalDouble probe(Duration timeout) throws IOException, TimeoutException {
        throw new UnsupportedOperationException(describe() + " has no native probe");
    }

    boolean isOpen();

    /**
     * Returns a short description for logs.
     *
     * @return e.g. {@code tcp://host:port}
     */
    String describe();

    /** Closes the connection. Idempotent, never throws. */
    @Override
    void close();
}
