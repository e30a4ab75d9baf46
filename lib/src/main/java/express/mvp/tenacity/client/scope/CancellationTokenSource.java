package express.mvp.tenacity.client.scope;

import java.util.ArrayList;
import java.util.List;

/**
 * Owner of a {@link CancellationToken}.
 *
 * <p>A source can be linked to parent tokens: cancelling any parent cancels the source too, but
 * cancelling the source never affects its parents. Closing a linked source detaches it from its
 * parents so long-lived parents do not accumulate callbacks.
 *
 * <pre>{@code
 * try (CancellationTokenSource attempt = CancellationTokenSource.linkedTo(sessionToken)) {
 *     runAttempt(attempt.token());
 * }
 * }</pre>
 */
public final class CancellationTokenSource implements AutoCloseable {

    private final CancellationToken token = new CancellationToken();
    private final List<CancellationToken.Registration> parentRegistrations = new ArrayList<>();

    /** Creates an independent source. */
    public CancellationTokenSource() {}

    /**
     * Creates a source cancelled whenever any of the given tokens is cancelled.
     *
     * @param parents the parent tokens
     * @return a new linked source, already cancelled if a parent is
     */
    public static CancellationTokenSource linkedTo(CancellationToken... parents) {
        CancellationTokenSource source = new CancellationTokenSource();
        synchronized (source.parentRegistrations) {
            for (CancellationToken parent : parents) {
                source.parentRegistrations.add(parent.register(source::cancel));
            }
        }
        return source;
    }

    public CancellationToken token() {
        return token;
    }

    /**
     * Requests cancellation. Idempotent.
     *
     * @return true if this call cancelled the token, false if it already was
     */
    public boolean cancel() {
        return token.cancel();
    }

    public boolean isCancellationRequested() {
        return token.isCancellationRequested();
    }

    /** Detaches from parent tokens. The token keeps its current state. */
    @Override
    public void close() {
        synchronized (parentRegistrations) {
            for (CancellationToken.Registration registration : parentRegistrations) {
                registration.close();
            }
            parentRegistrations.clear();
        }
    }

    @Override
    public String toString() {
        return "CancellationTokenSource[cancelled=" + isCancellationRequested() + "]";
    }
}
