package express.mvp.tenacity.client;

/**
 * Fixed-size ring buffer of latency samples with a rolling average.
 *
 * <p>Holds the most recent {@code capacity} samples; the oldest is evicted when a new one
 * arrives at full capacity. Thread-safe.
 */
public final class LatencyTracker {

    /** Default number of samples kept. */
    public static final int DEFAULT_CAPACITY = 100;

    private final double[] samples;
    private int next;
    private int size;
    private double sum;
    private double last = Double.NaN;

    public LatencyTracker() {
        this(DEFAULT_CAPACITY);
    }

    public LatencyTracker(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.samples = new double[capacity];
    }

    /**
     * Adds a sample.
     *
     * @param latencyMillis latency in milliseconds, must be finite and non-negative
     */
    public synchronized void record(double latencyMillis) {
        if (!(latencyMillis >= 0) || Double.isInfinite(latencyMillis)) {
            throw new IllegalArgumentException("Invalid latency sample: " + latencyMillis);
        }
        if (size == samples.length) {
            sum -= samples[next];
        } else {
            size++;
        }
        samples[next] = latencyMillis;
        sum += latencyMillis;
        next = (next + 1) % samples.length;
        last = latencyMillis;
    }

    /**
     * Returns the average of the retained samples.
     *
     * @return the average, or 0 when empty
     */
    public synchronized double average() {
        return size == 0 ? 0.0 : sum / size;
    }

    /**
     * Returns the most recent sample.
     *
     * @return the last sample, or NaN when empty
     */
    public synchronized double last() {
        return last;
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return samples.length;
    }

    public synchronized void clear() {
        next = 0;
        size = 0;
        sum = 0;
        last = Double.NaN;
    }
}
