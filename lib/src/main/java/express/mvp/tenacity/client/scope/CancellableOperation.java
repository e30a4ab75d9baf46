package express.mvp.tenacity.client.scope;

/**
 * Work that observes a cancellation token.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface CancellableOperation<T> {

    /**
     * Runs the operation.
     *
     * @param token cancelled when the operation's scope is cancelled
     * @return the result
     * @throws Exception on failure; an exception thrown after cancellation counts as cancellation
     */
    T run(CancellationToken token) throws Exception;
}
