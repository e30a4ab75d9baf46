package express.mvp.tenacity.client.error;

/**
 * Categories of client errors for handling and recovery decisions.
 *
 * <ul>
 *   <li><b>TRANSIENT:</b> timeouts; retry with backoff
 *   <li><b>NETWORK:</b> refused, reset or unreachable; reconnect with backoff
 *   <li><b>PROTOCOL:</b> the byte stream is corrupt; tear the connection down
 *   <li><b>CONFIGURATION:</b> the client cannot work as configured; never retried
 *   <li><b>CANCELLATION:</b> cooperative cancellation; a status, not a failure
 *   <li><b>FATAL:</b> VM or security errors; no recovery
 * </ul>
 *
 * @see ErrorClassifier
 * @see BackoffPolicy
 */
public enum ErrorCategory {

    /** Timeouts and other conditions that may succeed on a later attempt. */
    TRANSIENT(true, "Transient error - may succeed on retry"),

    /** Connectivity errors: refused, reset, closed channel, unknown or unreachable host. */
    NETWORK(true, "Network error - reconnection required"),

    /**
     * Malformed or oversized frames, unknown message types, corrupt compressed data.
     *
     * <p>Fatal for the current connection. Retrying the same byte stream cannot help; a fresh
     * connection can.
     */
    PROTOCOL(false, "Protocol error - invalid communication"),

    /** Invalid address or options. Reported synchronously and never retried. */
    CONFIGURATION(false, "Configuration error - fix settings"),

    /** The operation was cancelled. Never surfaced as an error event. */
    CANCELLATION(false, "Operation cancelled"),

    /** JVM errors, security violations. */
    FATAL(false, "Fatal error - shutdown required"),

    /** Unclassified; treated conservatively as retryable. */
    UNKNOWN(true, "Unknown error - conservative retry");

    private final boolean retryable;
    private final String description;

    ErrorCategory(boolean retryable, String description) {
        this.retryable = retryable;
        this.description = description;
    }

    /**
     * Checks if errors in this category are generally retryable.
     *
     * @return true if retry is generally appropriate
     */
    public boolean isRetryable() {
        return retryable;
    }

    public String description() {
        return description;
    }

    /**
     * Checks if this error ends the current connection.
     *
     * @return true for NETWORK, PROTOCOL and FATAL
     */
    public boolean requiresReconnect() {
        return this == NETWORK || this == PROTOCOL || this == FATAL;
    }

    /**
     * Checks whether the client should enter the faulted state instead of reconnecting.
     *
     * @return true for CONFIGURATION and FATAL
     */
    public boolean isUnrecoverable() {
        return this == CONFIGURATION || this == FATAL;
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
