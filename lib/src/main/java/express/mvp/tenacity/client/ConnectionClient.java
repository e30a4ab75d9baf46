package express.mvp.tenacity.client;

import express.mvp.tenacity.client.codec.Message;
import express.mvp.tenacity.client.codec.MessageCodec;
import express.mvp.tenacity.client.codec.MessageType;
import express.mvp.tenacity.client.codec.ProtocolException;
import express.mvp.tenacity.client.error.BackoffPolicy;
import express.mvp.tenacity.client.error.ErrorCategory;
import express.mvp.tenacity.client.error.ErrorClassifier;
import express.mvp.tenacity.client.error.RetryContext;
import express.mvp.tenacity.client.event.ConnectionEvent;
import express.mvp.tenacity.client.event.EventNotifier;
import express.mvp.tenacity.client.lifecycle.ConnectionState;
import express.mvp.tenacity.client.lifecycle.ConnectionStateListener;
import express.mvp.tenacity.client.lifecycle.ConnectionStateMachine;
import express.mvp.tenacity.client.lifecycle.HealthMonitor;
import express.mvp.tenacity.client.lifecycle.ReconnectSupervisor;
import express.mvp.tenacity.client.lifecycle.SupervisedConnection;
import express.mvp.tenacity.client.scope.CancellationScopeManager;
import express.mvp.tenacity.client.scope.CancellationToken;
import express.mvp.tenacity.client.scope.CancellationTokenSource;
import express.mvp.tenacity.client.scope.CompletionSignal;
import express.mvp.tenacity.client.scope.OperationScope;
import express.mvp.tenacity.client.transport.ClientTransport;
import express.mvp.tenacity.client.transport.TransportException;
import express.mvp.tenacity.client.transport.TransportFactory;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resilient client connection to one server.
 *
 * <p>The client owns the connection lifecycle: connecting with bounded retries and backoff,
 * moving outbound messages through a bounded queue, dispatching inbound messages, probing
 * liveness, reconnecting after a loss and tearing everything down on request. The application
 * only calls {@link #connect()}, {@link #send(MessageType, byte[])} and {@link #disconnect()}
 * and listens to {@link #events()}.
 *
 * <h2>Threads</h2>
 *
 * <p>Each connection has a sender loop and a receiver loop. Each session, from the first
 * successful connect until an intentional disconnect, has a {@link HealthMonitor} and a
 * {@link ReconnectSupervisor}. All run on daemon threads named after the client and observe
 * cancellation tokens derived from the {@link CancellationScopeManager}'s session scope:
 *
 * <pre>
 * scope manager session ──▶ client session ──▶ connection
 *                              │                  ├── sender loop
 *                              ├── health monitor └── receiver loop
 *                              ├── reconnect supervisor
 *                              └── connect backoff waits
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ConnectionConfig config = ConnectionConfig.builder()
 *     .serverAddress("tcp://127.0.0.1:4000")
 *     .build();
 *
 * try (ConnectionClient client = new ConnectionClient(config)) {
 *     client.events().onMessage(message -> handle(message));
 *     client.events().onError(error -> log.warning(error));
 *
 *     ConnectResult result = client.connect();
 *     if (result.isConnected()) {
 *         client.send(MessageType.PLAYER_ACTION, payload);
 *     }
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All public methods are thread-safe. State changes go through a compare-and-set state
 * machine, so concurrent connect or disconnect calls resolve to exactly one winner.
 */
public final class ConnectionClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ConnectionClient.class.getName());

    private final ConnectionConfig config;
    private final String name;
    private final MessageCodec codec;
    private final BackoffPolicy backoffPolicy;
    private final CancellationScopeManager scopes;
    private final boolean ownsScopes;
    private final EventNotifier events;
    private final TransportFactory transportFactory;
    private final ResumptionTokenStore tokenStore;
    private final ConnectionStateMachine stateMachine;
    private final ExecutorService workers;
    private final LatencyTracker latency = new LatencyTracker();
    private final SupervisedConnection supervisedView = new SupervisedView();

    private final Object sendLock = new Object();
    private final AtomicInteger sequence = new AtomicInteger();

    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong totalDisconnections = new AtomicLong();
    private final AtomicLong totalErrors = new AtomicLong();
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private volatile Instant lastActivity;
    private volatile Instant connectedSince;
    private volatile String lastErrorMessage;

    private final Object lifecycleLock = new Object();
    private CancellationTokenSource sessionSource;
    private volatile ActiveConnection connection;
    private ReconnectSupervisor supervisor;
    private Future<?> supervisorTask;
    private Future<?> monitorTask;
    private volatile Thread supervisorThread;
    private volatile Thread monitorThread;

    private final Object probeLock = new Object();
    private final AtomicReference<CompletionSignal> pendingHeartbeat = new AtomicReference<>();

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a client with its own scope manager, event notifier and in-memory resumption token
     * store, choosing the transport from the address scheme.
     *
     * @param config the configuration
     */
    public ConnectionClient(ConnectionConfig config) {
        this(builder(config));
    }

    private ConnectionClient(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config must not be null");
        this.name = config.clientName();
        this.codec = config.codec();
        this.backoffPolicy = config.backoffPolicy();
        this.ownsScopes = builder.scopes == null;
        this.scopes = ownsScopes ? new CancellationScopeManager() : builder.scopes;
        this.events = builder.events != null ? builder.events : new EventNotifier();
        this.transportFactory = builder.transportFactory != null
                ? builder.transportFactory
                : TransportFactory.byAddressKind(
                        config.connectTimeout(), config.sendQueueCapacity());
        this.tokenStore = builder.tokenStore != null
                ? builder.tokenStore
                : new InMemoryResumptionTokenStore();
        this.stateMachine = new ConnectionStateMachine(name);
        this.workers = Executors.newCachedThreadPool(new ClientThreadFactory("tenacity-" + name));
    }

    public static Builder builder(ConnectionConfig config) {
        return new Builder(config);
    }

    // ==================== Connect ====================

    /**
     * Connects, retrying with the configured backoff.
     *
     * <p>Blocks until connected, until every attempt failed, or until a disconnect interrupts the
     * attempts. A call made while another connect is running returns
     * {@link ConnectResult.Status#ALREADY_IN_PROGRESS} without side effects.
     *
     * @return the outcome
     */
    public ConnectResult connect() {
        return connect(false);
    }

    /**
     * Runs {@link #connect()} as a tracked session operation on the scope manager.
     *
     * @return future completed with the outcome
     */
    public CompletableFuture<ConnectResult> connectAsync() {
        return scopes.runAsync(name + "-connect", OperationScope.SESSION, token -> connect())
                .thenApply(outcome -> {
                    if (outcome.isFailed()) {
                        return new ConnectResult(ConnectResult.Status.FAILED, 0, outcome.failure());
                    }
                    return outcome.valueIfCompleted()
                            .orElse(ConnectResult.of(ConnectResult.Status.CANCELLED));
                });
    }

    /**
     * Disconnects and connects again.
     *
     * @return the outcome of the new connect
     */
    public ConnectResult reconnect() {
        disconnect();
        return connect();
    }

    private ConnectResult connect(boolean automatic) {
        if (closed.get() || scopes.isShutdown()) {
            return ConnectResult.of(ConnectResult.Status.REJECTED);
        }
        while (!stateMachine.transitionFrom(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING)) {
            ConnectionState current = stateMachine.getState();
            switch (current) {
                case CONNECTING:
                    return ConnectResult.of(ConnectResult.Status.ALREADY_IN_PROGRESS);
                case CONNECTED:
                    return ConnectResult.of(ConnectResult.Status.ALREADY_CONNECTED);
                case DISCONNECTED:
                    continue;
                default:
                    return ConnectResult.of(ConnectResult.Status.REJECTED);
            }
        }
        LOGGER.info(() -> name + ": connecting to " + config.serverAddress()
                + (automatic ? " (automatic)" : ""));
        CancellationToken session = ensureSession();
        try (CancellationTokenSource attempts = CancellationTokenSource.linkedTo(session)) {
            return runAttempts(attempts.token(), session);
        }
    }

    private ConnectResult runAttempts(CancellationToken token, CancellationToken session) {
        RetryContext retry = new RetryContext(name + "-connect", backoffPolicy.maxAttempts());
        while (true) {
            if (token.isCancellationRequested()) {
                return connectCancelled(retry.getAttemptCount());
            }
            int attempt = retry.startAttempt();
            ClientTransport transport = transportFactory.create(config.serverAddress(), codec);
            CancellationToken.Registration closeOnCancel = token.register(transport::close);
            try {
                transport.open(config.connectTimeout());
                closeOnCancel.close();
                if (token.isCancellationRequested()) {
                    transport.close();
                    return connectCancelled(attempt);
                }
                return onTransportOpen(transport, attempt, session);
            } catch (IOException | RuntimeException e) {
                closeOnCancel.close();
                transport.close();
                if (token.isCancellationRequested()) {
                    return connectCancelled(attempt);
                }
                retry.recordFailure(e);
                ErrorCategory category = retry.getLastErrorCategory();
                LOGGER.log(Level.WARNING, name + ": connection attempt " + attempt + "/"
                        + retry.getMaxAttempts() + " failed (" + category.name() + ")", e);
                if (category == ErrorCategory.PROTOCOL || category.isUnrecoverable()) {
                    return connectFaulted(e, attempt);
                }
                if (!backoffPolicy.shouldRetry(retry)) {
                    return connectFailed(retry);
                }
                Duration delay = backoffPolicy.nextDelay(retry);
                LOGGER.fine(() -> name + ": retrying in " + delay.toMillis() + "ms");
                if (token.await(delay)) {
                    return connectCancelled(attempt);
                }
                retry.recordDelay(delay.toMillis());
            }
        }
    }

    private ConnectResult onTransportOpen(
            ClientTransport transport, int attempts, CancellationToken session) {
        ActiveConnection conn = new ActiveConnection(
                transport,
                CancellationTokenSource.linkedTo(session),
                new ArrayBlockingQueue<>(config.sendQueueCapacity()));
        synchronized (lifecycleLock) {
            synchronized (sendLock) {
                sequence.set(0);
                enqueueLocked(conn, Message.of(MessageType.CONNECT, tokenStore.load().orElse(null)));
            }
            if (!stateMachine.transitionFrom(ConnectionState.CONNECTING, ConnectionState.CONNECTED)) {
                conn.source.cancel();
                conn.source.close();
                transport.close();
                return ConnectResult.of(ConnectResult.Status.CANCELLED);
            }
            connection = conn;
            connectedSince = Instant.now();
            totalConnections.incrementAndGet();
            conn.sender = workers.submit(() -> senderLoop(conn));
            conn.receiver = workers.submit(() -> receiverLoop(conn));
            startSupervision(session);
        }
        LOGGER.info(() -> name + ": connected to " + transport.describe()
                + " after " + attempts + " attempt(s)");
        events.publish(new ConnectionEvent.Connected());
        return ConnectResult.connected(attempts);
    }

    private ConnectResult connectCancelled(int attempts) {
        stateMachine.transitionFrom(ConnectionState.CONNECTING, ConnectionState.DISCONNECTED);
        LOGGER.fine(() -> name + ": connect cancelled");
        return new ConnectResult(ConnectResult.Status.CANCELLED, attempts, null);
    }

    private ConnectResult connectFailed(RetryContext retry) {
        Throwable failure = retry.getLastError();
        if (!stateMachine.transitionFrom(
                ConnectionState.CONNECTING, ConnectionState.DISCONNECTED, failure)) {
            return new ConnectResult(ConnectResult.Status.CANCELLED, retry.getAttemptCount(), null);
        }
        ConnectResult result =
                new ConnectResult(ConnectResult.Status.FAILED, retry.getAttemptCount(), failure);
        reportError(result.describe());
        return result;
    }

    private ConnectResult connectFaulted(Throwable failure, int attempts) {
        if (!stateMachine.transitionFrom(
                ConnectionState.CONNECTING, ConnectionState.FAULTED, failure)) {
            return new ConnectResult(ConnectResult.Status.CANCELLED, attempts, null);
        }
        ConnectResult result = new ConnectResult(ConnectResult.Status.FAULTED, attempts, failure);
        reportError(result.describe());
        return result;
    }

    // ==================== Send ====================

    /**
     * Queues a message for sending.
     *
     * @param type message type
     * @param body message body, may be null
     * @return ACCEPTED, NOT_CONNECTED or BACKPRESSURE; never blocks on I/O
     */
    public SendResult send(MessageType type, byte[] body) {
        return send(Message.of(type, body));
    }

    /**
     * Queues a message for sending. The client assigns the sequence number.
     *
     * @param message the message
     * @return ACCEPTED, NOT_CONNECTED or BACKPRESSURE; never blocks on I/O
     */
    public SendResult send(Message message) {
        Objects.requireNonNull(message, "message must not be null");
        ActiveConnection conn = connection;
        if (conn == null || stateMachine.getState() != ConnectionState.CONNECTED) {
            return SendResult.NOT_CONNECTED;
        }
        synchronized (sendLock) {
            return enqueueLocked(conn, message);
        }
    }

    private SendResult enqueueLocked(ActiveConnection conn, Message message) {
        if (conn.queue.remainingCapacity() == 0) {
            return SendResult.BACKPRESSURE;
        }
        Message stamped = message.withSequenceNumber(sequence.incrementAndGet());
        return conn.queue.offer(stamped) ? SendResult.ACCEPTED : SendResult.BACKPRESSURE;
    }

    private void senderLoop(ActiveConnection conn) {
        conn.senderThread = Thread.currentThread();
        CancellationToken token = conn.source.token();
        long pollNanos = config.readPollInterval().toNanos();
        while (!token.isCancellationRequested()) {
            Message message;
            try {
                message = conn.queue.poll(pollNanos, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (message == null) {
                continue;
            }
            try {
                conn.transport.write(message);
                messagesSent.incrementAndGet();
                lastActivity = Instant.now();
            } catch (ProtocolException e) {
                reportError("Dropped outbound " + message.type() + ": " + e.getMessage());
            } catch (IOException | RuntimeException e) {
                if (!token.isCancellationRequested()) {
                    connectionLost(conn, e);
                }
                break;
            }
        }
        LOGGER.fine(() -> name + ": sender loop stopped");
    }

    // ==================== Receive ====================

    private void receiverLoop(ActiveConnection conn) {
        conn.receiverThread = Thread.currentThread();
        CancellationToken token = conn.source.token();
        while (!token.isCancellationRequested()) {
            Message message;
            try {
                message = conn.transport.read(config.readPollInterval());
            } catch (IOException | RuntimeException e) {
                if (!token.isCancellationRequested()) {
                    connectionLost(conn, e);
                }
                break;
            }
            if (message == null) {
                continue;
            }
            messagesReceived.incrementAndGet();
            lastActivity = Instant.now();
            dispatchInbound(conn, message);
        }
        LOGGER.fine(() -> name + ": receiver loop stopped");
    }

    private void dispatchInbound(ActiveConnection conn, Message message) {
        switch (message.type()) {
            case HEARTBEAT -> {
                CompletionSignal signal = pendingHeartbeat.getAndSet(null);
                if (signal != null) {
                    signal.complete();
                }
            }
            case CONNECT_ACK -> {
                if (message.bodyLength() > 0) {
                    tokenStore.save(message.body());
                    LOGGER.fine(() -> name + ": resumption token updated");
                }
            }
            case DISCONNECT -> {
                LOGGER.info(() -> name + ": server closed the session");
                connectionLost(conn, null);
            }
            case CONNECT -> LOGGER.fine(() -> name + ": ignoring CONNECT from server");
            default -> events.publish(new ConnectionEvent.MessageReceived(message));
        }
    }

    // ==================== Liveness ====================

    /**
     * Runs one liveness probe with the configured probe timeout.
     *
     * @return the measured latency, or empty if the probe only sent a heartbeat
     * @throws IOException if the client is not connected or the transport failed
     * @throws TimeoutException if the server did not answer in time
     */
    public OptionalDouble probe() throws IOException, TimeoutException {
        return probe(config.probeTimeout());
    }

    private OptionalDouble probe(Duration timeout) throws IOException, TimeoutException {
        ActiveConnection conn = currentConnection();
        if (conn == null || stateMachine.getState() != ConnectionState.CONNECTED) {
            throw new IOException(name + " is not connected");
        }
        if (conn.transport.hasNativeProbe()) {
            OptionalDouble measured = conn.transport.probe(timeout);
            measured.ifPresent(this::recordLatency);
            return measured;
        }
        if (!config.heartbeatAckRequired()) {
            SendResult result = send(Message.of(MessageType.HEARTBEAT, null));
            if (result == SendResult.NOT_CONNECTED) {
                throw new IOException(name + " is not connected");
            }
            return OptionalDouble.empty();
        }
        synchronized (probeLock) {
            CompletionSignal signal = scopes.acquireSignal();
            long start = System.nanoTime();
            pendingHeartbeat.set(signal);
            try {
                SendResult result = send(Message.of(MessageType.HEARTBEAT, null));
                if (result != SendResult.ACCEPTED) {
                    throw new IOException("Heartbeat not sent: " + result);
                }
                if (!signal.await(timeout, conn.source.token())) {
                    if (conn.source.isCancellationRequested()) {
                        throw new IOException("Connection closed during probe");
                    }
                    throw new TimeoutException(
                            "No heartbeat echo within " + timeout.toMillis() + "ms");
                }
                double millis = (signal.completedAtNanos() - start) / 1_000_000.0;
                recordLatency(millis);
                return OptionalDouble.of(millis);
            } finally {
                // A lost race means the receiver still holds the signal; leave it out of the pool.
                if (pendingHeartbeat.compareAndSet(signal, null) || signal.isComplete()) {
                    scopes.releaseSignal(signal);
                }
            }
        }
    }

    private void recordLatency(double millis) {
        latency.record(millis);
        events.publish(new ConnectionEvent.LatencyMeasured(millis));
    }

    private void startSupervision(CancellationToken session) {
        if (supervisor == null || !isRunning(supervisorTask)) {
            supervisor = new ReconnectSupervisor(supervisedView, config.reconnectDelay(), session);
            if (config.enableAutoReconnect()) {
                ReconnectSupervisor started = supervisor;
                supervisorTask = workers.submit(() -> {
                    supervisorThread = Thread.currentThread();
                    started.run();
                });
            }
        }
        if (config.enableKeepalive() && !isRunning(monitorTask)) {
            HealthMonitor monitor = new HealthMonitor(
                    supervisedView,
                    supervisor,
                    config.keepaliveInterval(),
                    config.probeTimeout(),
                    session);
            monitorTask = workers.submit(() -> {
                monitorThread = Thread.currentThread();
                monitor.run();
            });
        }
    }

    private static boolean isRunning(Future<?> task) {
        return task != null && !task.isDone();
    }

    // ==================== Teardown ====================

    private void connectionLost(ActiveConnection conn, Throwable cause) {
        ErrorCategory category =
                cause == null ? ErrorCategory.NETWORK : ErrorClassifier.classify(cause);
        ConnectionState target = category.isUnrecoverable()
                ? ConnectionState.FAULTED
                : ConnectionState.DISCONNECTING;
        synchronized (lifecycleLock) {
            if (connection != conn) {
                return;
            }
            if (!stateMachine.transitionFrom(ConnectionState.CONNECTED, target, cause)) {
                return;
            }
            connection = null;
        }
        conn.source.cancel();
        conn.transport.close();
        conn.source.close();
        connectedSince = null;
        totalDisconnections.incrementAndGet();
        if (cause != null) {
            LOGGER.log(Level.WARNING, name + ": connection lost (" + category.name() + ")", cause);
            reportError(describeLoss(category, cause));
        }
        if (target == ConnectionState.DISCONNECTING) {
            stateMachine.transitionFrom(ConnectionState.DISCONNECTING, ConnectionState.DISCONNECTED);
        }
        events.publish(new ConnectionEvent.Disconnected());
    }

    private static String describeLoss(ErrorCategory category, Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return switch (category) {
            case PROTOCOL -> "Protocol error: " + detail;
            case TRANSIENT -> "Connection timed out: " + detail;
            case FATAL, CONFIGURATION -> "Unrecoverable error: " + detail;
            default -> "Connection lost: " + detail;
        };
    }

    /**
     * Disconnects. Idempotent.
     *
     * <p>Stops the reconnect supervisor and health monitor, interrupts a running connect, sends a
     * best-effort disconnect message, stops the I/O loops and closes the transport. Waits for the
     * loops at most the configured disconnect timeout.
     *
     * @return true if every background loop stopped in time
     */
    public boolean disconnect() {
        long deadline = System.nanoTime() + config.disconnectTimeout().toNanos();
        ConnectionState previous = null;
        while (previous == null) {
            ConnectionState current = stateMachine.getState();
            if (current == ConnectionState.DISCONNECTED) {
                return stopSession(deadline);
            }
            if (current == ConnectionState.DISCONNECTING) {
                return awaitDisconnected(deadline);
            }
            if (stateMachine.transitionFrom(current, ConnectionState.DISCONNECTING)) {
                previous = current;
            }
        }
        final ConnectionState left = previous;
        LOGGER.info(() -> name + ": disconnecting from " + left);

        CancellationTokenSource session = detachSession();
        if (session != null) {
            session.cancel();
            session.close();
        }
        ActiveConnection conn;
        synchronized (lifecycleLock) {
            conn = connection;
            connection = null;
        }

        boolean graceful = true;
        if (conn != null) {
            sendFarewell(conn);
            conn.source.cancel();
            graceful &= join(conn.sender, conn.senderThread, deadline);
            graceful &= join(conn.receiver, conn.receiverThread, deadline);
            conn.transport.close();
            conn.source.close();
            totalDisconnections.incrementAndGet();
        }
        graceful &= joinSupervision(deadline);
        if (conn != null) {
            conn.queue.clear();
        }
        connectedSince = null;
        stateMachine.transitionFrom(ConnectionState.DISCONNECTING, ConnectionState.DISCONNECTED);
        if (conn != null) {
            events.publish(new ConnectionEvent.Disconnected());
        }
        if (!graceful) {
            LOGGER.warning(name + ": background loops did not stop within "
                    + config.disconnectTimeout().toMillis() + "ms, transport closed forcibly");
        }
        LOGGER.info(() -> name + ": disconnected");
        return graceful;
    }

    private boolean stopSession(long deadline) {
        CancellationTokenSource session = detachSession();
        if (session == null) {
            return true;
        }
        session.cancel();
        session.close();
        return joinSupervision(deadline);
    }

    private boolean awaitDisconnected(long deadline) {
        while (stateMachine.getState() == ConnectionState.DISCONNECTING) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    private void sendFarewell(ActiveConnection conn) {
        Duration timeout = config.gracefulCloseTimeout();
        if (timeout.isZero() || !conn.transport.isOpen()) {
            return;
        }
        Message farewell = new Message(
                MessageType.DISCONNECT, sequence.incrementAndGet(), System.currentTimeMillis(), null);
        Future<?> write;
        try {
            write = workers.submit(() -> {
                conn.transport.write(farewell);
                return null;
            });
        } catch (RejectedExecutionException e) {
            return;
        }
        try {
            write.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            messagesSent.incrementAndGet();
        } catch (TimeoutException e) {
            write.cancel(true);
            LOGGER.fine(() -> name + ": disconnect message not sent within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            LOGGER.log(Level.FINE, name + ": disconnect message failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean joinSupervision(long deadline) {
        Future<?> reconnecting;
        Future<?> monitor;
        synchronized (lifecycleLock) {
            reconnecting = supervisorTask;
            monitor = monitorTask;
        }
        boolean stopped = join(reconnecting, supervisorThread, deadline);
        return join(monitor, monitorThread, deadline) && stopped;
    }

    private static boolean join(Future<?> task, Thread owner, long deadline) {
        if (task == null || task.isDone() || owner == Thread.currentThread()) {
            return true;
        }
        try {
            task.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            task.cancel(true);
            return false;
        } catch (ExecutionException e) {
            LOGGER.log(Level.WARNING, "Background loop failed", e.getCause());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== Session ====================

    private CancellationToken ensureSession() {
        synchronized (lifecycleLock) {
            if (sessionSource == null || sessionSource.isCancellationRequested()) {
                if (sessionSource != null) {
                    sessionSource.close();
                }
                CancellationTokenSource created = scopes.newLinkedSource();
                sessionSource = created;
                created.token().register(() -> onSessionCancelled(created));
            }
            return sessionSource.token();
        }
    }

    private CancellationTokenSource detachSession() {
        synchronized (lifecycleLock) {
            CancellationTokenSource session = sessionSource;
            sessionSource = null;
            return session;
        }
    }

    /** The scope manager cancelled the session behind the client's back. */
    private void onSessionCancelled(CancellationTokenSource cancelled) {
        synchronized (lifecycleLock) {
            if (sessionSource != cancelled) {
                return;
            }
        }
        LOGGER.info(() -> name + ": session scope cancelled, disconnecting");
        try {
            workers.execute(this::disconnect);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.FINE, name + ": client already closed", e);
        }
    }

    // ==================== Resumption token ====================

    /**
     * Stores a resumption token to present on the next connect.
     *
     * @param token opaque token bytes
     */
    public void saveResumptionToken(byte[] token) {
        tokenStore.save(token);
    }

    /**
     * Returns the stored resumption token.
     *
     * @return the token, or empty if none was stored
     */
    public Optional<byte[]> loadResumptionToken() {
        return tokenStore.load();
    }

    // ==================== Accessors ====================

    public ConnectionState state() {
        return stateMachine.getState();
    }

    public boolean isConnected() {
        return stateMachine.getState() == ConnectionState.CONNECTED;
    }

    public EventNotifier events() {
        return events;
    }

    public ConnectionConfig config() {
        return config;
    }

    public String name() {
        return name;
    }

    /**
     * Registers a listener for raw state transitions.
     *
     * @param listener the listener
     */
    public void addStateListener(ConnectionStateListener listener) {
        stateMachine.addListener(listener);
    }

    /**
     * Takes a snapshot of the counters.
     *
     * @return the metrics
     */
    public ClientMetrics metrics() {
        return ClientMetrics.builder()
                .state(stateMachine.getState())
                .totalConnections(totalConnections.get())
                .totalDisconnections(totalDisconnections.get())
                .totalErrors(totalErrors.get())
                .messagesSent(messagesSent.get())
                .messagesReceived(messagesReceived.get())
                .latency(latency.average(), latency.size())
                .queuedMessages(queuedMessages())
                .lastActivity(lastActivity)
                .connectedSince(connectedSince)
                .lastErrorMessage(lastErrorMessage)
                .build();
    }

    // ==================== Close ====================

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Disconnects and releases the client's threads. Safe to call from any state and more than
     * once; only the first call does anything.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        disconnect();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.disconnectTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        if (ownsScopes) {
            scopes.shutdown(config.disconnectTimeout());
        }
        LOGGER.fine(() -> name + ": closed");
    }

    // ==================== Internals ====================

    private ActiveConnection currentConnection() {
        return connection;
    }

    private int queuedMessages() {
        ActiveConnection conn = connection;
        return conn == null ? 0 : conn.queue.size();
    }

    private void reportError(String message) {
        totalErrors.incrementAndGet();
        lastErrorMessage = message;
        events.publish(new ConnectionEvent.Error(message));
    }

    @Override
    public String toString() {
        return "ConnectionClient[" + name + " -> " + config.serverAddress() + ", " + state() + "]";
    }

    /** One established connection: its transport, token, send queue and I/O loops. */
    private static final class ActiveConnection {
        final ClientTransport transport;
        final CancellationTokenSource source;
        final BlockingQueue<Message> queue;
        Future<?> sender;
        Future<?> receiver;
        volatile Thread senderThread;
        volatile Thread receiverThread;

        ActiveConnection(
                ClientTransport transport,
                CancellationTokenSource source,
                BlockingQueue<Message> queue) {
            this.transport = transport;
            this.source = source;
            this.queue = queue;
        }
    }

    /** The view handed to the health monitor and reconnect supervisor. */
    private final class SupervisedView implements SupervisedConnection {
        @Override
        public String name() {
            return name;
        }

        @Override
        public ConnectionState state() {
            return stateMachine.getState();
        }

        @Override
        public OptionalDouble probe(Duration timeout) throws IOException, TimeoutException {
            return ConnectionClient.this.probe(timeout);
        }

        @Override
        public void connectionLost(Throwable cause) {
            ActiveConnection conn = currentConnection();
            if (conn != null) {
                ConnectionClient.this.connectionLost(
                        conn, cause != null ? cause : new TransportException("Connection lost"));
            }
        }

        @Override
        public boolean reconnect() {
            return connect(true).isConnected();
        }
    }

    /** Builder for {@link ConnectionClient} with explicit collaborators. */
    public static final class Builder {
        private final ConnectionConfig config;
        private CancellationScopeManager scopes;
        private EventNotifier events;
        private TransportFactory transportFactory;
        private ResumptionTokenStore tokenStore;

        private Builder(ConnectionConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
        }

        /**
         * Uses a shared scope manager. The client does not shut it down.
         *
         * @param scopes the scope manager
         * @return this builder
         */
        public Builder scopeManager(CancellationScopeManager scopes) {
            this.scopes = Objects.requireNonNull(scopes, "scopes");
            return this;
        }

        public Builder eventNotifier(EventNotifier events) {
            this.events = Objects.requireNonNull(events, "events");
            return this;
        }

        public Builder transportFactory(TransportFactory factory) {
            this.transportFactory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        public Builder resumptionTokenStore(ResumptionTokenStore store) {
            this.tokenStore = Objects.requireNonNull(store, "store");
            return this;
        }

        public ConnectionClient build() {
            return new ConnectionClient(this);
        }
    }
}
