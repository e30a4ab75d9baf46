package express.mvp.tenacity.client.error;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bookkeeping for one sequence of connection attempts.
 *
 * <p>The connect loop starts an attempt, records its failure, asks the {@link BackoffPolicy}
 * whether to go on and how long to wait, and records the wait:
 *
 * <pre>{@code
 * RetryContext retry = new RetryContext("client-connect", policy.maxAttempts());
 * while (true) {
 *     retry.startAttempt();
 *     try {
 *         transport.open(timeout);
 *         break;
 *     } catch (IOException e) {
 *         retry.recordFailure(e);
 *         if (!policy.shouldRetry(retry)) {
 *             throw e;
 *         }
 *         Duration delay = policy.nextDelay(retry);
 *         token.await(delay);
 *         retry.recordDelay(delay.toMillis());
 *     }
 * }
 * }</pre>
 *
 * <p>Confined to the connecting thread.
 */
public final class RetryContext {

    private final String label;
    private final int maxAttempts;
    private final List<ErrorCategory> failures = new ArrayList<>();
    private final long startNanos = System.nanoTime();

    private int attempt;
    private Throwable lastError;
    private long nextDelayMillis;
    private long waitedMillis;

    /**
     * Creates a context.
     *
     * @param label name of the sequence for log messages
     * @param maxAttempts attempt budget, first attempt included
     */
    public RetryContext(String label, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.label = label;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Begins the next attempt.
     *
     * @return the attempt number, starting at 1
     */
    public int startAttempt() {
        return ++attempt;
    }

    public int getAttemptCount() {
        return attempt;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean hasAttemptsRemaining() {
        return attempt < maxAttempts;
    }

    /**
     * Records why the current attempt failed.
     *
     * @param error the failure
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "The failure is kept as is for the connect result.")
    public void recordFailure(Throwable error) {
        lastError = error;
        failures.add(ErrorClassifier.classify(error));
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "The failure is handed to the connect result as is.")
    public Throwable getLastError() {
        return lastError;
    }

    /**
     * Returns the category of the most recent failure.
     *
     * @return the category, or null before any failure
     */
    public ErrorCategory getLastErrorCategory() {
        return failures.isEmpty() ? null : failures.get(failures.size() - 1);
    }

    /**
     * Returns the category of every recorded failure, oldest first.
     *
     * @return unmodifiable view
     */
    public List<ErrorCategory> getFailureCategories() {
        return Collections.unmodifiableList(failures);
    }

    void setNextDelay(long delayMillis) {
        nextDelayMillis = delayMillis;
    }

    /**
     * Returns the wait computed by the last {@link BackoffPolicy#nextDelay} call.
     *
     * @return milliseconds, 0 before any call
     */
    public long getNextDelayMillis() {
        return nextDelayMillis;
    }

    public void recordDelay(long delayMillis) {
        waitedMillis += delayMillis;
    }

    public long getTotalDelayMillis() {
        return waitedMillis;
    }

    public long getElapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @Override
    public String toString() {
        return label + "[attempt " + attempt + "/" + maxAttempts
                + ", waited " + waitedMillis + "ms, failures " + failures + "]";
    }
}
