/**
 * Error classification and retry backoff.
 *
 * <p>{@link express.mvp.tenacity.client.error.ErrorClassifier} maps exceptions to
 * {@link express.mvp.tenacity.client.error.ErrorCategory} values, which
 * {@link express.mvp.tenacity.client.error.BackoffPolicy} uses to decide whether a failed
 * connection attempt is worth repeating and how long to wait first.
 */
package express.mvp.tenacity.client.error;
