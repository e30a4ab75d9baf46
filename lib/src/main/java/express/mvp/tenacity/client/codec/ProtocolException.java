package express.mvp.tenacity.client.codec;

import express.mvp.tenacity.client.transport.TransportException;

/**
 * Thrown when bytes received from or destined for the peer violate the wire format.
 *
 * <p>Common causes:
 *
 * <ul>
 *   <li>Length prefix larger than the configured maximum frame size
 *   <li>Negative length prefix
 *   <li>Unknown message type code or truncated message header
 *   <li>Corrupt compressed payload
 * </ul>
 *
 * <p>A protocol error is fatal for the current connection: the byte stream cannot be trusted
 * after it, so the connection is torn down rather than retried.
 */
public class ProtocolException extends TransportException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a protocol exception with the specified message.
     *
     * @param message the detail message
     */
    public ProtocolException(String message) {
        super(message);
    }

    /**
     * Creates a protocol exception with the specified message and cause.
     *
     * @param message the detail message
     * @param cause the underlying cause
     */
    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
