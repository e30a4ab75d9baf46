package express.mvp.tenacity.client.scope;

import express.mvp.tenacity.client.ClientThreadFactory;
import express.mvp.tenacity.client.error.ErrorClassifier;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the two cancellation scopes that supervise background work and tracks every operation
 * started through it.
 *
 * <h2>Scopes</h2>
 *
 * <ul>
 *   <li><b>Application:</b> created once, cancelled only by {@link #shutdown(Duration)}
 *   <li><b>Session:</b> replaced by {@link #cancelSession()} and {@link #resetSession()}; the
 *       old session token is cancelled, application-scoped work keeps running
 * </ul>
 *
 * <p>Session-scoped operations run under a token linked to both scopes, so shutdown stops
 * them as well.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CancellationScopeManager scopes = new CancellationScopeManager();
 *
 * CompletableFuture<OperationOutcome<String>> login = scopes.runAsync(
 *     "login", OperationScope.SESSION, token -> authenticate(token));
 *
 * scopes.cancelSession();          // login observes its token and ends CANCELLED
 * scopes.shutdown(Duration.ofSeconds(5));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. Instances are constructed explicitly and passed to the
 * components that need them.
 */
public final class CancellationScopeManager implements AutoCloseable {

    private static final Logger LOGGER =
            Logger.getLogger(CancellationScopeManager.class.getName());

    /** Drain timeout used by {@link #close()}. */
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final CancellationTokenSource appSource = new CancellationTokenSource();
    private final Object sessionLock = new Object();
    private CancellationTokenSource sessionSource = new CancellationTokenSource();
    private CancellationTokenSource linkedSource;
    private long sessionGeneration;

    private final Map<Long, OperationRecord> operations = new ConcurrentHashMap<>();
    private final AtomicLong operationIds = new AtomicLong();
    private final Object drainLock = new Object();

    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final CompletionSignalPool signalPool;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile boolean gracefulShutdown = true;

    /** Creates a manager with its own daemon worker pool. */
    public CancellationScopeManager() {
        this(Executors.newCachedThreadPool(new ClientThreadFactory("tenacity-scope")), true);
    }

    /**
     * Creates a manager that runs asynchronous operations on the given executor. The executor is
     * not shut down by this manager.
     *
     * @param executor executor for {@link #runAsync} operations
     */
    public CancellationScopeManager(ExecutorService executor) {
        this(executor, false);
    }

    private CancellationScopeManager(ExecutorService executor, boolean ownsExecutor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.ownsExecutor = ownsExecutor;
        this.signalPool = new CompletionSignalPool();
        this.linkedSource = CancellationTokenSource.linkedTo(appSource.token(), sessionSource.token());
    }

    // ==================== Tokens ====================

    public CancellationToken appToken() {
        return appSource.token();
    }

    /**
     * Returns the token of the current session.
     *
     * @return the session token; replaced on every session cancel or reset
     */
    public CancellationToken sessionToken() {
        synchronized (sessionLock) {
            return sessionSource.token();
        }
    }

    /**
     * Returns a token cancelled when either the application or the current session is cancelled.
     *
     * @return the linked token of the current session
     */
    public CancellationToken linkedToken() {
        synchronized (sessionLock) {
            return linkedSource.token();
        }
    }

    /**
     * Creates a child source of the application scope, the current session and any extra
     * parents. The caller must close it.
     *
     * @param extraParents additional parent tokens
     * @return a new linked source
     */
    public CancellationTokenSource newLinkedSource(CancellationToken... extraParents) {
        CancellationToken[] parents = new CancellationToken[extraParents.length + 1];
        parents[0] = linkedToken();
        System.arraycopy(extraParents, 0, parents, 1, extraParents.length);
        return CancellationTokenSource.linkedTo(parents);
    }

    public long sessionGeneration() {
        synchronized (sessionLock) {
            return sessionGeneration;
        }
    }

    // ==================== Scope control ====================

    /**
     * Cancels every session-scoped operation and starts a fresh session. Application-scoped
     * operations are unaffected.
     */
    public void cancelSession() {
        CancellationTokenSource oldSession;
        CancellationTokenSource oldLinked;
        synchronized (sessionLock) {
            oldSession = sessionSource;
            oldLinked = linkedSource;
            sessionSource = new CancellationTokenSource();
            linkedSource = CancellationTokenSource.linkedTo(appSource.token(), sessionSource.token());
            sessionGeneration++;
        }
        oldSession.cancel();
        oldLinked.close();
        LOGGER.fine(() -> "Session cancelled, generation " + sessionGeneration());
    }

    /**
     * Discards the current session and returns the token of the new one.
     *
     * @return the new session token
     */
    public CancellationToken resetSession() {
        cancelSession();
        LOGGER.info("Session reset");
        return sessionToken();
    }

    /**
     * Cancels every tracked operation and the current session. The application scope stays
     * open.
     */
    public void cancelAll() {
        for (OperationRecord record : operations.values()) {
            record.source().cancel();
        }
        cancelSession();
    }

    /**
     * Cancels running operations with the given name.
     *
     * @param name operation name
     * @return number of operations signalled
     */
    public int cancelOperation(String name) {
        int count = 0;
        for (OperationRecord record : operations.values()) {
            if (record.name().equals(name) && record.source().cancel()) {
                count++;
            }
        }
        return count;
    }

    // ==================== Running operations ====================

    /**
     * Runs an operation on the calling thread, tracked and classified.
     *
     * @param name operation name for the registry and logs
     * @param scope scope that can cancel the operation
     * @param operation the work
     * @param <T> result type
     * @return the outcome; never throws for operation failures
     */
    public <T> OperationOutcome<T> run(
            String name, OperationScope scope, CancellableOperation<T> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        if (shutdown.get()) {
            return OperationOutcome.cancelled(name, Duration.ZERO);
        }
        CancellationTokenSource source = sourceFor(scope);
        return execute(register(name, scope, source), operation);
    }

    /**
     * Runs an operation on the manager's executor.
     *
     * @param name operation name
     * @param scope scope that can cancel the operation
     * @param operation the work
     * @param <T> result type
     * @return future completed with the outcome; never completed exceptionally
     */
    public <T> CompletableFuture<OperationOutcome<T>> runAsync(
            String name, OperationScope scope, CancellableOperation<T> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        if (shutdown.get()) {
            return CompletableFuture.completedFuture(OperationOutcome.cancelled(name, Duration.ZERO));
        }
        CancellationTokenSource source = sourceFor(scope);
        OperationRecord record = register(name, scope, source);
        try {
            return CompletableFuture.supplyAsync(() -> execute(record, operation), executor);
        } catch (RejectedExecutionException e) {
            unregister(record, OperationStatus.CANCELLED);
            return CompletableFuture.completedFuture(OperationOutcome.cancelled(name, Duration.ZERO));
        }
    }

    /**
     * Runs an operation on the manager's executor.
     *
     * @param operation the work
     * @param name operation name
     * @param sessionScoped true to bind the operation to the session scope
     * @param <T> result type
     * @return future completed with the outcome
     */
    public <T> CompletableFuture<OperationOutcome<T>> runAsync(
            CancellableOperation<T> operation, String name, boolean sessionScoped) {
        return runAsync(
                name, sessionScoped ? OperationScope.SESSION : OperationScope.APPLICATION, operation);
    }

    /**
     * Runs an operation that is cancelled when the timeout elapses. A timed-out operation fails
     * with {@link TimeoutException}; one cancelled by its scope ends CANCELLED.
     *
     * @param name operation name
     * @param scope scope that can cancel the operation
     * @param timeout time limit
     * @param operation the work
     * @param <T> result type
     * @return future completed with the outcome
     */
    public <T> CompletableFuture<OperationOutcome<T>> runWithTimeout(
            String name, OperationScope scope, Duration timeout, CancellableOperation<T> operation) {
        AtomicBoolean timedOut = new AtomicBoolean(false);
        return runAsync(name, scope, token -> {
            try (CancellationTokenSource limited = CancellationTokenSource.linkedTo(token)) {
                CompletableFuture<Void> timer = CompletableFuture.runAsync(
                        () -> {
                            if (!limited.isCancellationRequested()) {
                                timedOut.set(true);
                                limited.cancel();
                            }
                        },
                        CompletableFuture.delayedExecutor(
                                timeout.toNanos(), TimeUnit.NANOSECONDS, executor));
                try {
                    T value = operation.run(limited.token());
                    if (timedOut.get()) {
                        throw timeoutException(name, timeout);
                    }
                    return value;
                } catch (Exception e) {
                    if (timedOut.get() && !token.isCancellationRequested()) {
                        throw timeoutException(name, timeout);
                    }
                    throw e;
                } finally {
                    timer.cancel(false);
                }
            }
        });
    }

    /**
     * Starts an operation without waiting for it. Failures go to the handler; cancellation is
     * silent.
     *
     * @param name operation name
     * @param scope scope that can cancel the operation
     * @param operation the work
     * @param onError receives the failure cause, may be null
     */
    public void fireAndForget(
            String name,
            OperationScope scope,
            CancellableOperation<?> operation,
            Consumer<Throwable> onError) {
        runAsync(name, scope, operation).thenAccept(outcome -> {
            if (outcome.isFailed() && onError != null) {
                try {
                    onError.accept(outcome.failure());
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "Error handler for '" + name + "' failed", e);
                }
            }
        });
    }

    /**
     * Waits for the given time unless the token is cancelled first.
     *
     * @param duration time to wait
     * @param token cancels the wait
     * @return true if the full delay elapsed, false if cancelled
     */
    public static boolean delay(Duration duration, CancellationToken token) {
        return !token.await(duration);
    }

    // ==================== Registry ====================

    /**
     * Returns a snapshot of the running operations, oldest first.
     *
     * @return running operation records
     */
    public List<OperationRecord> activeOperations() {
        List<OperationRecord> snapshot = new ArrayList<>(operations.values());
        snapshot.sort(Comparator.comparingLong(OperationRecord::id));
        return snapshot;
    }

    public int activeCount() {
        return operations.size();
    }

    public boolean isRunning(String name) {
        for (OperationRecord record : operations.values()) {
            if (record.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    // ==================== Completion signals ====================

    public CompletionSignal acquireSignal() {
        return signalPool.acquire();
    }

    public void releaseSignal(CompletionSignal signal) {
        signalPool.release(signal);
    }

    public CompletionSignalPool signalPool() {
        return signalPool;
    }

    // ==================== Shutdown ====================

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Cancels both scopes, waits for tracked operations to drain and stops the owned executor.
     * Later calls return the result of the first.
     *
     * @param drainTimeout maximum time to wait for operations to finish
     * @return true if every operation finished in time
     */
    public boolean shutdown(Duration drainTimeout) {
        if (!shutdown.compareAndSet(false, true)) {
            return gracefulShutdown;
        }
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        appSource.cancel();
        synchronized (sessionLock) {
            sessionSource.cancel();
        }

        boolean drained = awaitDrain(deadline);
        if (ownsExecutor) {
            executor.shutdown();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                if (!executor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    executor.shutdownNow();
                    drained = false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
                drained = false;
            }
        }
        gracefulShutdown = drained;
        if (drained) {
            LOGGER.info("Scope manager shut down");
        } else {
            LOGGER.warning("Scope manager shut down with " + operations.size()
                    + " operation(s) still running");
        }
        return drained;
    }

    @Override
    public void close() {
        shutdown(DEFAULT_DRAIN_TIMEOUT);
    }

    // ==================== Internals ====================

    private CancellationTokenSource sourceFor(OperationScope scope) {
        Objects.requireNonNull(scope, "scope must not be null");
        return scope == OperationScope.SESSION
                ? CancellationTokenSource.linkedTo(linkedToken())
                : CancellationTokenSource.linkedTo(appToken());
    }

    private OperationRecord register(
            String name, OperationScope scope, CancellationTokenSource source) {
        OperationRecord record = new OperationRecord(
                operationIds.incrementAndGet(), Objects.requireNonNull(name, "name"), scope, source);
        operations.put(record.id(), record);
        return record;
    }

    private void unregister(OperationRecord record, OperationStatus status) {
        record.finish(status);
        operations.remove(record.id());
        record.source().close();
        if (operations.isEmpty()) {
            synchronized (drainLock) {
                drainLock.notifyAll();
            }
        }
    }

    private <T> OperationOutcome<T> execute(OperationRecord record, CancellableOperation<T> operation) {
        CancellationTokenSource source = record.source();
        OperationStatus status = OperationStatus.FAILED;
        try {
            T value = operation.run(source.token());
            if (source.isCancellationRequested()) {
                status = OperationStatus.CANCELLED;
                LOGGER.fine(() -> "Operation '" + record.name() + "' stopped after cancellation");
                return OperationOutcome.cancelled(record.name(), record.elapsed());
            }
            status = OperationStatus.COMPLETED;
            return OperationOutcome.completed(record.name(), value, record.elapsed());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (source.isCancellationRequested() || ErrorClassifier.isCancellation(e)) {
                status = OperationStatus.CANCELLED;
                LOGGER.fine(() -> "Operation '" + record.name() + "' cancelled");
                return OperationOutcome.cancelled(record.name(), record.elapsed());
            }
            LOGGER.log(Level.WARNING, "Operation '" + record.name() + "' failed", e);
            return OperationOutcome.failed(record.name(), e, record.elapsed());
        } finally {
            unregister(record, status);
        }
    }

    private boolean awaitDrain(long deadlineNanos) {
        synchronized (drainLock) {
            while (!operations.isEmpty()) {
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(drainLock, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return operations.isEmpty();
                }
            }
            return true;
        }
    }

    private static TimeoutException timeoutException(String name, Duration timeout) {
        return new TimeoutException(
                "Operation '" + name + "' timed out after " + timeout.toMillis() + "ms");
    }

    @Override
    public String toString() {
        return String.format(
                "CancellationScopeManager[active=%d, session=%d, shutdown=%s]",
                operations.size(), sessionGeneration(), shutdown.get());
    }
}
