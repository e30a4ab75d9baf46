package express.mvp.tenacity.client.scope;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Final result of a tracked operation.
 *
 * @param name the operation name
 * @param status COMPLETED, CANCELLED or FAILED
 * @param value the produced value when completed, otherwise null
 * @param failure the cause when failed, otherwise null
 * @param elapsed how long the operation ran
 * @param <T> value type
 */
public record OperationOutcome<T>(
        String name, OperationStatus status, T value, Throwable failure, Duration elapsed) {

    public OperationOutcome {
        Objects.requireNonNull(status, "status must not be null");
        if (status == OperationStatus.RUNNING) {
            throw new IllegalArgumentException("An outcome cannot be RUNNING");
        }
    }

    static <T> OperationOutcome<T> completed(String name, T value, Duration elapsed) {
        return new OperationOutcome<>(name, OperationStatus.COMPLETED, value, null, elapsed);
    }

    static <T> OperationOutcome<T> cancelled(String name, Duration elapsed) {
        return new OperationOutcome<>(name, OperationStatus.CANCELLED, null, null, elapsed);
    }

    static <T> OperationOutcome<T> failed(String name, Throwable failure, Duration elapsed) {
        return new OperationOutcome<>(name, OperationStatus.FAILED, null, failure, elapsed);
    }

    public boolean isCompleted() {
        return status == OperationStatus.COMPLETED;
    }

    public boolean isCancelled() {
        return status == OperationStatus.CANCELLED;
    }

    public boolean isFailed() {
        return status == OperationStatus.FAILED;
    }

    /**
     * Returns the value of a completed operation.
     *
     * @return the value, empty if the operation did not complete or produced null
     */
    public Optional<T> valueIfCompleted() {
        return isCompleted() ? Optional.ofNullable(value) : Optional.empty();
    }
}
