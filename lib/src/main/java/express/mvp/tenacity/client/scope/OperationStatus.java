package express.mvp.tenacity.client.scope;

/**
 * Result classification of a tracked operation.
 *
 * <p>Cancellation is a status like any other and is never reported as an error.
 */
public enum OperationStatus {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
