package express.mvp.tenacity.client;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;

/**
 * Outcome of {@link ConnectionClient#connect()}.
 *
 * @param status what happened
 * @param attempts number of connection attempts made
 * @param failure the last failure, or null
 */
@SuppressFBWarnings(
        value = "EI_EXPOSE_REP",
        justification = "Throwable is exposed for diagnostics and cannot be safely copied.")
public record ConnectResult(Status status, int attempts, Throwable failure) {

    /** Connect outcome kinds. */
    public enum Status {
        /** The connection is established. */
        CONNECTED,
        /** Another connect call is running; this one did nothing. */
        ALREADY_IN_PROGRESS,
        /** The client was already connected. */
        ALREADY_CONNECTED,
        /** The client is disconnecting or faulted and cannot connect now. */
        REJECTED,
        /** Every attempt failed; the client is disconnected. */
        FAILED,
        /** An unrecoverable error stopped the attempts; the client is faulted. */
        FAULTED,
        /** A disconnect or shutdown interrupted the attempts. */
        CANCELLED
    }

    public ConnectResult {
        Objects.requireNonNull(status, "status must not be null");
    }

    static ConnectResult connected(int attempts) {
        return new ConnectResult(Status.CONNECTED, attempts, null);
    }

    static ConnectResult of(Status status) {
        return new ConnectResult(status, 0, null);
    }

    public boolean isConnected() {
        return status == Status.CONNECTED || status == Status.ALREADY_CONNECTED;
    }

    /**
     * Returns a one-line description for logs and error events.
     *
     * @return the description
     */
    public String describe() {
        return switch (status) {
            case CONNECTED -> "connected after " + attempts + " attempt(s)";
            case ALREADY_IN_PROGRESS -> "connection already in progress";
            case ALREADY_CONNECTED -> "already connected";
            case REJECTED -> "connect rejected in current state";
            case FAILED -> "connection failed after " + attempts + " attempt(s)"
                    + (failure != null ? ": " + failure.getMessage() : "");
            case FAULTED -> "connection faulted"
                    + (failure != null ? ": " + failure.getMessage() : "");
            case CANCELLED -> "connect cancelled";
        };
    }
}
