package express.mvp.tenacity.client;

import express.mvp.tenacity.client.event.ConnectionListener;
import express.mvp.tenacity.client.event.Subscription;
import express.mvp.tenacity.client.lifecycle.ConnectionState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one {@link ConnectionClient} per transport kind side by side.
 *
 * <p>An application that talks to a framed stream server for real-time traffic and to an RPC
 * server for request/response calls registers a client for each and drives them together:
 *
 * <pre>{@code
 * try (ConnectionManager manager = new ConnectionManager()) {
 *     manager.register(new ConnectionClient(streamConfig));
 *     manager.register(new ConnectionClient(rpcConfig));
 *     manager.addListener(new ConnectionManager.Listener() {
 *         @Override
 *         public void onError(ServerAddress.Kind kind, String message) {
 *             log.warning(kind + ": " + message);
 *         }
 *     });
 *
 *     Map<ServerAddress.Kind, ConnectResult> results = manager.connectAll();
 *     ...
 *     manager.disconnectAll();
 * }
 * }</pre>
 *
 * <p>The kind of a client is the kind of its configured server address. Registration, lookup
 * and the bulk operations are thread-safe. Each client keeps its own reconnect and keepalive
 * behaviour; the manager only aggregates.
 */
public final class ConnectionManager implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ConnectionManager.class.getName());

    /** Receives the events of every registered client, tagged with the client's kind. */
    public interface Listener {

        default void onConnected(ServerAddress.Kind kind) {}

        default void onDisconnected(ServerAddress.Kind kind) {}

        default void onError(ServerAddress.Kind kind, String message) {}
    }

    private final Map<ServerAddress.Kind, Registration> registrations =
            new EnumMap<>(ServerAddress.Kind.class);
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong totalConnections = new AtomicLong();

    /**
     * Registers a client under the kind of its server address. A client already registered for
     * that kind is replaced; it is neither disconnected nor closed.
     *
     * @param client the client
     * @return the replaced client, if any
     */
    public Optional<ConnectionClient> register(ConnectionClient client) {
        Objects.requireNonNull(client, "client must not be null");
        ServerAddress.Kind kind = client.config().serverAddress().kind();
        Subscription subscription = client.events().subscribe(new Forwarder(kind));
        Registration previous;
        synchronized (registrations) {
            previous = registrations.put(kind, new Registration(client, subscription));
        }
        if (previous == null) {
            LOGGER.info(() -> "Registered " + client.name() + " for " + kind);
            return Optional.empty();
        }
        previous.subscription.close();
        LOGGER.warning("Replaced " + previous.client.name() + " with " + client.name()
                + " for " + kind);
        return Optional.of(previous.client);
    }

    /**
     * Removes the client registered for a kind without disconnecting it.
     *
     * @param kind the transport kind
     * @return the removed client, if any
     */
    public Optional<ConnectionClient> unregister(ServerAddress.Kind kind) {
        Registration removed;
        synchronized (registrations) {
            removed = registrations.remove(kind);
        }
        if (removed == null) {
            return Optional.empty();
        }
        removed.subscription.close();
        return Optional.of(removed.client);
    }

    public Optional<ConnectionClient> client(ServerAddress.Kind kind) {
        Registration registration = lookup(kind);
        return registration == null ? Optional.empty() : Optional.of(registration.client);
    }

    public Set<ServerAddress.Kind> registeredKinds() {
        Set<ServerAddress.Kind> kinds = EnumSet.noneOf(ServerAddress.Kind.class);
        synchronized (registrations) {
            kinds.addAll(registrations.keySet());
        }
        return Collections.unmodifiableSet(kinds);
    }

    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    // ==================== Connect ====================

    /**
     * Connects the client registered for a kind.
     *
     * @param kind the transport kind
     * @return the client's outcome, or {@link ConnectResult.Status#REJECTED} if no client is
     *     registered for the kind
     */
    public ConnectResult connect(ServerAddress.Kind kind) {
        Registration registration = lookup(kind);
        if (registration == null) {
            LOGGER.severe("No client registered for " + kind);
            return ConnectResult.of(ConnectResult.Status.REJECTED);
        }
        LOGGER.info(() -> "Connecting " + kind + "...");
        return record(kind, registration.client.connect());
    }

    /**
     * Connects every registered client concurrently and waits for all of them.
     *
     * @return each kind's outcome
     */
    public Map<ServerAddress.Kind, ConnectResult> connectAll() {
        Map<ServerAddress.Kind, CompletableFuture<ConnectResult>> pending =
                new EnumMap<>(ServerAddress.Kind.class);
        for (Map.Entry<ServerAddress.Kind, Registration> entry : snapshot().entrySet()) {
            pending.put(entry.getKey(), entry.getValue().client.connectAsync());
        }
        Map<ServerAddress.Kind, ConnectResult> results = new EnumMap<>(ServerAddress.Kind.class);
        pending.forEach((kind, future) -> results.put(kind, record(kind, future.join())));
        return results;
    }

    private ConnectResult record(ServerAddress.Kind kind, ConnectResult result) {
        if (result.status() == ConnectResult.Status.CONNECTED) {
            totalConnections.incrementAndGet();
            LOGGER.info(() -> "Connected " + kind);
        } else if (!result.isConnected()) {
            LOGGER.warning("Failed to connect " + kind + ": " + result.describe());
        }
        return result;
    }

    // ==================== Disconnect ====================

    /**
     * Disconnects the client registered for a kind.
     *
     * @param kind the transport kind
     * @return true if the client stopped in time or none is registered
     */
    public boolean disconnect(ServerAddress.Kind kind) {
        Registration registration = lookup(kind);
        if (registration == null) {
            return true;
        }
        LOGGER.info(() -> "Disconnecting " + kind + "...");
        return registration.client.disconnect();
    }

    /**
     * Disconnects every registered client concurrently and waits for all of them.
     *
     * @return true if every client stopped in time
     */
    public boolean disconnectAll() {
        LOGGER.info("Disconnecting all connections...");
        List<CompletableFuture<Boolean>> pending = new ArrayList<>();
        for (Registration registration : snapshot().values()) {
            pending.add(CompletableFuture.supplyAsync(registration.client::disconnect));
        }
        boolean graceful = true;
        for (CompletableFuture<Boolean> future : pending) {
            graceful &= future.join();
        }
        LOGGER.info("All connections disconnected");
        return graceful;
    }

    // ==================== State ====================

    public boolean isConnected(ServerAddress.Kind kind) {
        Registration registration = lookup(kind);
        return registration != null && registration.client.isConnected();
    }

    /**
     * Returns the state of the client registered for a kind.
     *
     * @param kind the transport kind
     * @return the state, {@link ConnectionState#DISCONNECTED} if none is registered
     */
    public ConnectionState state(ServerAddress.Kind kind) {
        Registration registration = lookup(kind);
        return registration == null ? ConnectionState.DISCONNECTED : registration.client.state();
    }

    /**
     * Counts the registered clients that are connected now.
     *
     * @return the count
     */
    public int activeConnections() {
        int count = 0;
        for (Registration registration : snapshot().values()) {
            if (registration.client.isConnected()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Counts the connects made through this manager that established a connection.
     *
     * @return the count
     */
    public long totalConnections() {
        return totalConnections.get();
    }

    /** Closes every registered client and forgets them. */
    @Override
    public void close() {
        Map<ServerAddress.Kind, Registration> all;
        synchronized (registrations) {
            all = new EnumMap<>(registrations);
            registrations.clear();
        }
        for (Registration registration : all.values()) {
            registration.subscription.close();
            registration.client.close();
        }
        listeners.clear();
    }

    private Registration lookup(ServerAddress.Kind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        synchronized (registrations) {
            return registrations.get(kind);
        }
    }

    private Map<ServerAddress.Kind, Registration> snapshot() {
        synchronized (registrations) {
            return new EnumMap<>(registrations);
        }
    }

    @Override
    public String toString() {
        return "ConnectionManager[" + registeredKinds() + ", active=" + activeConnections() + "]";
    }

    private static final class Registration {
        final ConnectionClient client;
        final Subscription subscription;

        Registration(ConnectionClient client, Subscription subscription) {
            this.client = client;
            this.subscription = subscription;
        }
    }

    /** Tags one client's events with its kind and hands them to the manager's listeners. */
    private final class Forwarder implements ConnectionListener {
        private final ServerAddress.Kind kind;

        Forwarder(ServerAddress.Kind kind) {
            this.kind = kind;
        }

        @Override
        public void onConnected() {
            LOGGER.fine(() -> kind + " connected");
            for (Listener listener : listeners) {
                deliver(listener, () -> listener.onConnected(kind));
            }
        }

        @Override
        public void onDisconnected() {
            LOGGER.fine(() -> kind + " disconnected");
            for (Listener listener : listeners) {
                deliver(listener, () -> listener.onDisconnected(kind));
            }
        }

        @Override
        public void onError(String message) {
            LOGGER.fine(() -> kind + " error: " + message);
            for (Listener listener : listeners) {
                deliver(listener, () -> listener.onError(kind, message));
            }
        }

        private void deliver(Listener listener, Runnable call) {
            try {
                call.run();
            } catch (VirtualMachineError e) {
                throw e;
            } catch (RuntimeException | Error e) {
                LOGGER.log(Level.WARNING, "Manager listener " + listener + " failed", e);
            }
        }
    }
}
