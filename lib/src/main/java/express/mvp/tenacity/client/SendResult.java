package express.mvp.tenacity.client;

/** Outcome of {@link ConnectionClient#send}. */
public enum SendResult {

    /** Queued for the sender loop. */
    ACCEPTED,

    /** The client is not connected; nothing was queued. */
    NOT_CONNECTED,

    /** The send queue is full; nothing was queued. The caller decides whether to retry. */
    BACKPRESSURE;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
