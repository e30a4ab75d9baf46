package express.mvp.tenacity.client.event;

import express.mvp.tenacity.client.codec.Message;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous publish/subscribe hub for {@link ConnectionEvent}s.
 *
 * <p>Events are delivered on the publishing thread, in subscription order, to the listeners
 * subscribed when publishing starts. A listener that throws is logged and skipped; the remaining
 * listeners still receive the event.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EventNotifier events = new EventNotifier();
 * try (Subscription sub = events.onError(message -> log.warning(message))) {
 *     client.connect();
 * }
 * }</pre>
 */
public final class EventNotifier {

    private static final Logger LOGGER = Logger.getLogger(EventNotifier.class.getName());

    private final List<ListenerSubscription> subscriptions = new CopyOnWriteArrayList<>();

    /**
     * Subscribes a listener.
     *
     * @param listener the listener
     * @return the handle that unsubscribes it
     */
    public Subscription subscribe(ConnectionListener listener) {
        ListenerSubscription subscription =
                new ListenerSubscription(this, Objects.requireNonNull(listener, "listener"));
        subscriptions.add(subscription);
        return subscription;
    }

    public Subscription onConnected(Runnable handler) {
        Objects.requireNonNull(handler, "handler");
        return subscribe(new ConnectionListener() {
            @Override
            public void onConnected() {
                handler.run();
            }
        });
    }

    public Subscription onDisconnected(Runnable handler) {
        Objects.requireNonNull(handler, "handler");
        return subscribe(new ConnectionListener() {
            @Override
            public void onDisconnected() {
                handler.run();
            }
        });
    }

    public Subscription onError(Consumer<String> handler) {
        Objects.requireNonNull(handler, "handler");
        return subscribe(new ConnectionListener() {
            @Override
            public void onError(String message) {
                handler.accept(message);
            }
        });
    }

    public Subscription onLatencyMeasured(DoubleConsumer handler) {
        Objects.requireNonNull(handler, "handler");
        return subscribe(new ConnectionListener() {
            @Override
            public void onLatencyMeasured(double latencyMillis) {
                handler.accept(latencyMillis);
            }
        });
    }

    public Subscription onMessage(Consumer<Message> handler) {
        Objects.requireNonNull(handler, "handler");
        return subscribe(new ConnectionListener() {
            @Override
            public void onMessageReceived(Message message) {
                handler.accept(message);
            }
        });
    }

    /**
     * Delivers an event to every current listener. A listener that throws is logged and skipped;
     * only a {@link VirtualMachineError} stops delivery.
     *
     * @param event the event
     */
    public void publish(ConnectionEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        for (ListenerSubscription subscription : subscriptions) {
            if (!subscription.isActive()) {
                continue;
            }
            try {
                event.dispatchTo(subscription.listener);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (RuntimeException | Error e) {
                LOGGER.log(Level.WARNING, "Listener failed handling " + event, e);
            }
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    /** Removes every listener. */
    public void clear() {
        for (ListenerSubscription subscription : subscriptions) {
            subscription.close();
        }
    }

    private static final class ListenerSubscription implements Subscription {
        private final ConnectionListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private EventNotifier owner;

        ListenerSubscription(EventNotifier owner, ConnectionListener listener) {
            this.owner = owner;
            this.listener = listener;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                EventNotifier notifier = owner;
                owner = null;
                if (notifier != null) {
                    notifier.subscriptions.remove(this);
                }
            }
        }
    }
}
