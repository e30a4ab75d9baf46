package express.mvp.tenacity.client.scope;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Bounded pool of {@link CompletionSignal}s.
 *
 * <p>Acquire never blocks: when the pool is empty a fresh signal is created. Released signals
 * are reset and kept while the pool has room, otherwise dropped.
 */
public final class CompletionSignalPool {

    /** Default number of idle signals kept. */
    public static final int DEFAULT_CAPACITY = 20;

    private final BlockingQueue<CompletionSignal> idle;
    private final int capacity;

    public CompletionSignalPool() {
        this(DEFAULT_CAPACITY);
    }

    public CompletionSignalPool(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.idle = new ArrayBlockingQueue<>(capacity);
    }

    public CompletionSignal acquire() {
        CompletionSignal signal = idle.poll();
        return signal != null ? signal : new CompletionSignal();
    }

    /**
     * Returns a signal to the pool.
     *
     * @param signal a signal obtained from {@link #acquire()}
     */
    public void release(CompletionSignal signal) {
        if (signal == null) {
            return;
        }
        signal.reset();
        idle.offer(signal);
    }

    public int idleCount() {
        return idle.size();
    }

    public int capacity() {
        return capacity;
    }
}
