package express.mvp.tenacity.client.error;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes the wait before each connection retry and decides whether to retry at all.
 *
 * <h2>Delay Formulas</h2>
 *
 * <pre>
 * LINEAR:      delay(n) = base * n
 * EXPONENTIAL: delay(n) = base * 2^(n - 1)
 * </pre>
 *
 * <p>{@code n} is the number of the attempt that just failed, starting at 1. Both results are
 * capped at the maximum delay. With jitter enabled the delay is scaled by a uniformly random
 * factor in {@code [0.8, 1.2)}.
 *
 * <p>{@link #computeDelayMillis(int)} is a pure function of the attempt number and the policy's
 * settings. {@link #delayFor(int)} adds jitter from the policy's random source, which tests can
 * replace.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * BackoffPolicy policy = BackoffPolicy.builder()
 *     .strategy(BackoffStrategy.EXPONENTIAL)
 *     .baseDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .maxAttempts(5)
 *     .build();
 *
 * policy.computeDelayMillis(3); // 4000
 * }</pre>
 *
 * @see RetryContext
 * @see ErrorCategory
 */
public final class BackoffPolicy {

    /** Jitter range applied when jitter is enabled: plus or minus 20%. */
    public static final double JITTER_FACTOR = 0.2;

    private final BackoffStrategy strategy;
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final int maxAttempts;
    private final boolean jitterEnabled;
    private final DoubleSupplier randomSource;

    private BackoffPolicy(Builder builder) {
        this.strategy = builder.strategy;
        this.baseDelayMillis = builder.baseDelayMillis;
        this.maxDelayMillis = builder.maxDelayMillis;
        this.maxAttempts = builder.maxAttempts;
        this.jitterEnabled = builder.jitterEnabled;
        this.randomSource = builder.randomSource;
    }

    public BackoffStrategy strategy() {
        return strategy;
    }

    public long baseDelayMillis() {
        return baseDelayMillis;
    }

    public long maxDelayMillis() {
        return maxDelayMillis;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean isJitterEnabled() {
        return jitterEnabled;
    }

    /**
     * Computes the delay after the given failed attempt, without jitter.
     *
     * @param attemptNumber the failed attempt, starting at 1
     * @return delay in milliseconds
     */
    public long computeDelayMillis(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1: " + attemptNumber);
        }
        long delay = switch (strategy) {
            case LINEAR -> baseDelayMillis > maxDelayMillis / attemptNumber
                    ? maxDelayMillis
                    : baseDelayMillis * attemptNumber;
            case EXPONENTIAL -> {
                int shift = attemptNumber - 1;
                yield shift >= 62 || baseDelayMillis > (maxDelayMillis >> shift)
                        ? maxDelayMillis
                        : baseDelayMillis << shift;
            }
        };
        return Math.min(delay, maxDelayMillis);
    }

    /**
     * Returns the delay after the given failed attempt, with jitter if enabled.
     *
     * @param attemptNumber the failed attempt, starting at 1
     * @return the delay, never negative
     */
    public Duration delayFor(int attemptNumber) {
        long delay = computeDelayMillis(attemptNumber);
        if (jitterEnabled && delay > 0) {
            double jitter = (randomSource.getAsDouble() * 2.0 - 1.0) * JITTER_FACTOR;
            delay = Math.max(0, Math.round(delay * (1.0 + jitter)));
        }
        return Duration.ofMillis(delay);
    }

    /**
     * Determines if another attempt should be made.
     *
     * @param context the retry context
     * @return true if attempts remain and the last error is retryable
     */
    public boolean shouldRetry(RetryContext context) {
        if (context.getAttemptCount() >= maxAttempts || !context.hasAttemptsRemaining()) {
            return false;
        }
        ErrorCategory category = context.getLastErrorCategory();
        if (category == null) {
            return true;
        }
        return switch (category) {
            case TRANSIENT, NETWORK, UNKNOWN -> true;
            case PROTOCOL, CONFIGURATION, CANCELLATION, FATAL -> false;
        };
    }

    /**
     * Computes the delay after the context's latest attempt and records it as the next delay.
     *
     * @param context the retry context
     * @return the delay
     */
    public Duration nextDelay(RetryContext context) {
        Duration delay = delayFor(Math.max(1, context.getAttemptCount()));
        context.setNextDelay(delay.toMillis());
        return delay;
    }

    /**
     * Creates a linear policy without jitter.
     *
     * @param baseDelay delay unit
     * @param maxAttempts maximum number of attempts
     * @return the policy
     */
    public static BackoffPolicy linear(Duration baseDelay, int maxAttempts) {
        return builder()
                .strategy(BackoffStrategy.LINEAR)
                .baseDelay(baseDelay)
                .maxAttempts(maxAttempts)
                .build();
    }

    /**
     * Creates an exponential policy without jitter.
     *
     * @param baseDelay delay after the first failure
     * @param maxDelay cap
     * @param maxAttempts maximum number of attempts
     * @return the policy
     */
    public static BackoffPolicy exponential(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        return builder()
                .strategy(BackoffStrategy.EXPONENTIAL)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .maxAttempts(maxAttempts)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format(
                "BackoffPolicy[%s, base=%dms, max=%dms, attempts=%d, jitter=%s]",
                strategy, baseDelayMillis, maxDelayMillis, maxAttempts, jitterEnabled);
    }

    /** Builder for {@link BackoffPolicy}. */
    public static final class Builder {
        private BackoffStrategy strategy = BackoffStrategy.LINEAR;
        private long baseDelayMillis = 1000;
        private long maxDelayMillis = 30_000;
        private int maxAttempts = 3;
        private boolean jitterEnabled;
        private DoubleSupplier randomSource = () -> ThreadLocalRandom.current().nextDouble();

        private Builder() {}

        public Builder strategy(BackoffStrategy strategy) {
            this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
            return this;
        }

        public Builder baseDelay(Duration delay) {
            if (delay.isNegative()) {
                throw new IllegalArgumentException("baseDelay must not be negative");
            }
            this.baseDelayMillis = delay.toMillis();
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative");
            }
            this.maxDelayMillis = maxDelay.toMillis();
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder jitter(boolean enabled) {
            this.jitterEnabled = enabled;
            return this;
        }

        /**
         * Replaces the jitter source.
         *
         * @param randomSource supplier of values in {@code [0, 1)}
         * @return this builder
         */
        public Builder randomSource(DoubleSupplier randomSource) {
            this.randomSource = Objects.requireNonNull(randomSource, "randomSource must not be null");
            return this;
        }

        public BackoffPolicy build() {
            if (maxDelayMillis < baseDelayMillis) {
                maxDelayMillis = baseDelayMillis;
            }
            return new BackoffPolicy(this);
        }
    }
}
