package express.mvp.tenacity.client.scope;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Reusable one-shot completion flag, handed out by {@link CompletionSignalPool}.
 *
 * <p>One party waits with {@link #await(Duration, CancellationToken)}, another calls
 * {@link #complete()}. The wait also ends when the given token is cancelled.
 */
public final class CompletionSignal {

    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(20);

    private volatile CountDownLatch latch = new CountDownLatch(1);
    private volatile long completedAtNanos;

    CompletionSignal() {}

    /** Marks the signal complete and wakes the waiter. */
    public void complete() {
        CountDownLatch current = latch;
        if (current.getCount() > 0) {
            completedAtNanos = System.nanoTime();
            current.countDown();
        }
    }

    public boolean isComplete() {
        return latch.getCount() == 0;
    }

    /**
     * Returns when the signal was completed.
     *
     * @return a {@link System#nanoTime()} value, or 0 if not completed
     */
    public long completedAtNanos() {
        return isComplete() ? completedAtNanos : 0L;
    }

    /**
     * Waits for completion.
     *
     * @param timeout maximum time to wait
     * @param token cancels the wait
     * @return true if completed, false on timeout, cancellation or interrupt
     */
    public boolean await(Duration timeout, CancellationToken token) {
        CountDownLatch current = latch;
        long deadline = System.nanoTime() + Math.max(0, timeout.toNanos());
        try {
            while (!token.isCancellationRequested()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return current.getCount() == 0;
                }
                if (current.await(Math.min(remaining, POLL_NANOS), TimeUnit.NANOSECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return current.getCount() == 0;
    }

    void reset() {
        completedAtNanos = 0L;
        latch = new CountDownLatch(1);
    }
}
