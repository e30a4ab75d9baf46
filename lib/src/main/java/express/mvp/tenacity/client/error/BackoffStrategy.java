package express.mvp.tenacity.client.error;

/** How the delay between connection attempts grows. */
public enum BackoffStrategy {

    /** {@code base * attempt}. */
    LINEAR,

    /** {@code base * 2^(attempt - 1)}, capped. */
    EXPONENTIAL
}
