package express.mvp.tenacity.client.scope;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Observable side of a cancellation signal.
 *
 * <p>Background loops check {@link #isCancellationRequested()} on every iteration and wait on
 * {@link #await(Duration)} instead of sleeping, so cancellation wakes them immediately. Code that
 * blocks elsewhere (a socket read, a pending connect) can {@link #register(Runnable)} a callback
 * that unblocks it.
 *
 * <p>Tokens are created and cancelled by a {@link CancellationTokenSource}. Cancellation is
 * one-way and happens at most once.
 */
public final class CancellationToken {

    private static final Logger LOGGER = Logger.getLogger(CancellationToken.class.getName());

    private static final CancellationToken NONE = new CancellationToken();

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    CancellationToken() {}

    /**
     * Returns a token that is never cancelled.
     *
     * @return the shared uncancellable token
     */
    public static CancellationToken none() {
        return NONE;
    }

    public boolean isCancellationRequested() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits until cancellation or until the timeout elapses.
     *
     * <p>An interrupt of the waiting thread is treated as cancellation; the interrupt flag is
     * restored.
     *
     * @param timeout maximum time to wait
     * @return true if cancelled (or interrupted), false if the timeout elapsed first
     */
    public boolean await(Duration timeout) {
        try {
            return cancelled.await(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * Registers a callback run once on cancellation. If the token is already cancelled the
     * callback runs immediately on the calling thread.
     *
     * @param callback the callback
     * @return a handle that removes the callback when closed
     */
    public Registration register(Runnable callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        Registration registration = new Registration(this, callback);
        if (this == NONE) {
            return registration;
        }
        registrations.add(registration);
        if (isCancellationRequested() && registrations.remove(registration)) {
            registration.invoke();
        }
        return registration;
    }

    /** Fires the signal. Called by the owning source only. */
    boolean cancel() {
        if (this == NONE || isCancellationRequested()) {
            return false;
        }
        synchronized (this) {
            if (isCancellationRequested()) {
                return false;
            }
            cancelled.countDown();
        }
        for (Registration registration : registrations) {
            if (registrations.remove(registration)) {
                registration.invoke();
            }
        }
        return true;
    }

    int registrationCount() {
        return registrations.size();
    }

    @Override
    public String toString() {
        return this == NONE
                ? "CancellationToken[none]"
                : "CancellationToken[cancelled=" + isCancellationRequested() + "]";
    }

    /** Handle for a registered cancellation callback. */
    public static final class Registration implements AutoCloseable {
        private final CancellationToken token;
        private final Runnable callback;

        private Registration(CancellationToken token, Runnable callback) {
            this.token = token;
            this.callback = callback;
        }

        private void invoke() {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Cancellation callback failed", e);
            }
        }

        /** Removes the callback. Has no effect once it has run. */
        @Override
        public void close() {
            token.registrations.remove(this);
        }
    }
}
