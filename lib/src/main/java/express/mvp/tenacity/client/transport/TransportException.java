package express.mvp.tenacity.client.transport;

/**
 * Exception thrown when a transport operation fails.
 *
 * <p>This is an unchecked exception that wraps underlying I/O errors, unexpected peer responses
 * and protocol violations detected while talking to the server.
 */
public class TransportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a transport exception with the specified message.
     *
     * @param message the detail message
     */
    public TransportException(String message) {
        super(message);
    }

    /**
     * Creates a transport exception with the specified message and cause.
     *
     * @param message the detail message
     * @param cause the underlying cause
     */
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
