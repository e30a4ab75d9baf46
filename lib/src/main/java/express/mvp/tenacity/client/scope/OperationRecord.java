package express.mvp.tenacity.client.scope;

import java.time.Duration;
import java.time.Instant;

/**
 * Registry entry for one running operation.
 *
 * <p>Created when the operation starts and removed from the registry when it ends, whatever the
 * outcome. The status fields are volatile so snapshots taken from other threads see the latest
 * value.
 */
public final class OperationRecord {

    private final long id;
    private final String name;
    private final OperationScope scope;
    private final Instant startTime;
    private final CancellationTokenSource source;

    private volatile OperationStatus status = OperationStatus.RUNNING;
    private volatile Instant endTime;

    OperationRecord(long id, String name, OperationScope scope, CancellationTokenSource source) {
        this.id = id;
        this.name = name;
        this.scope = scope;
        this.source = source;
        this.startTime = Instant.now();
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public OperationScope scope() {
        return scope;
    }

    public OperationStatus status() {
        return status;
    }

    public Instant startTime() {
        return startTime;
    }

    /**
     * Returns when the operation ended.
     *
     * @return the end time, or null while running
     */
    public Instant endTime() {
        return endTime;
    }

    /**
     * Returns how long the operation ran, or has been running so far.
     *
     * @return elapsed time
     */
    public Duration elapsed() {
        Instant end = endTime;
        return Duration.between(startTime, end != null ? end : Instant.now());
    }

    CancellationTokenSource source() {
        return source;
    }

    void finish(OperationStatus finalStatus) {
        this.endTime = Instant.now();
        this.status = finalStatus;
    }

    @Override
    public String toString() {
        return String.format(
                "OperationRecord[id=%d, name=%s, scope=%s, status=%s, elapsed=%dms]",
                id, name, scope, status, elapsed().toMillis());
    }
}
