package express.mvp.tenacity.client.event;

/**
 * Handle returned by {@link EventNotifier#subscribe(ConnectionListener)}.
 *
 * <p>Closing the handle removes the listener. Closing is idempotent and safe after the notifier
 * itself has been discarded.
 */
public interface Subscription extends AutoCloseable {

    boolean isActive();

    /** Removes the listener. Further calls have no effect. */
    @Override
    void close();
}
