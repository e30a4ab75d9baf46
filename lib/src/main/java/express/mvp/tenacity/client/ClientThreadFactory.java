package express.mvp.tenacity.client;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for the client's background loops.
 *
 * <p>Threads are named {@code <prefix>-<n>} so that sender, receiver, health and reconnect loops
 * are easy to tell apart in thread dumps. They are daemon threads by default: a client that was
 * never closed must not keep the JVM alive. Uncaught exceptions are logged.
 */
public final class ClientThreadFactory implements ThreadFactory {

    private static final Logger LOGGER = Logger.getLogger(ClientThreadFactory.class.getName());

    private final AtomicLong threadCount = new AtomicLong(0);
    private final String namePrefix;
    private final boolean daemon;

    /**
     * Creates a factory for daemon threads.
     *
     * @param namePrefix prefix for thread names
     */
    public ClientThreadFactory(String namePrefix) {
        this(namePrefix, true);
    }

    public ClientThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, namePrefix + "-" + threadCount.incrementAndGet());
        thread.setDaemon(daemon);
        thread.setUncaughtExceptionHandler((t, e) ->
                LOGGER.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
        return thread;
    }

    public long getThreadCount() {
        return threadCount.get();
    }

    public String getNamePrefix() {
        return namePrefix;
    }

    public boolean isDaemon() {
        return daemon;
    }

    @Override
    public String toString() {
        return "ClientThreadFactory[prefix=" + namePrefix + ", created=" + threadCount.get() + "]";
    }
}
