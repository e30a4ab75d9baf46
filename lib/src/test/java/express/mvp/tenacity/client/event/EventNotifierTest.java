package express.mvp.tenacity.client.event;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.tenacity.client.codec.Message;
import express.mvp.tenacity.client.codec.MessageType;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link EventNotifier}. */
@DisplayName("EventNotifier")
class EventNotifierTest {

    private EventNotifier notifier;

    @BeforeEach
    void setUp() {
        notifier = new EventNotifier();
    }

    @Test
    @DisplayName("Each event reaches the matching callback")
    void dispatchesByType() {
        List<String> seen = new ArrayList<>();
        notifier.subscribe(new ConnectionListener() {
            @Override
            public void onConnected() {
                seen.add("connected");
            }

            @Override
            public void onDisconnected() {
                seen.add("disconnected");
            }

            @Override
            public void onError(String message) {
                seen.add("error:" + message);
            }

            @Override
            public void onLatencyMeasured(double latencyMillis) {
                seen.add("latency:" + latencyMillis);
            }
        });

        notifier.publish(new ConnectionEvent.Connected());
        notifier.publish(new ConnectionEvent.Error("Connection timed out"));
        notifier.publish(new ConnectionEvent.LatencyMeasured(12.5));
        notifier.publish(new ConnectionEvent.Disconnected());

        assertEquals(
                List.of("connected", "error:Connection timed out", "latency:12.5", "disconnected"),
                seen);
    }

    @Test
    @DisplayName("Typed helpers only see their own event")
    void typedHelpers() {
        AtomicInteger connected = new AtomicInteger();
        AtomicReference<Message> received = new AtomicReference<>();
        notifier.onConnected(connected::incrementAndGet);
        notifier.onMessage(received::set);

        Message message = Message.of(MessageType.GAME_DATA, new byte[] {1});
        notifier.publish(new ConnectionEvent.MessageReceived(message));
        notifier.publish(new ConnectionEvent.Disconnected());

        assertEquals(0, connected.get());
        assertSame(message, received.get());
    }

    @Test
    @DisplayName("Throwing subscriber does not stop delivery to the others")
    void throwingSubscriberIsolated() {
        AtomicInteger calls = new AtomicInteger();
        notifier.onError(message -> {
            throw new IllegalStateException("subscriber bug");
        });
        notifier.onError(message -> calls.incrementAndGet());

        notifier.publish(new ConnectionEvent.Error("boom"));

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Subscriber throwing an Error does not stop delivery to the others")
    void throwingErrorIsolated() {
        List<Double> seen = new ArrayList<>();
        notifier.onLatencyMeasured(latency -> {
            throw new AssertionError("subscriber assertion");
        });
        notifier.onLatencyMeasured(seen::add);

        notifier.publish(new ConnectionEvent.LatencyMeasured(4.5));

        assertEquals(List.of(4.5), seen);
    }

    @Test
    @DisplayName("Virtual machine errors are not swallowed")
    void vmErrorPropagates() {
        AtomicInteger calls = new AtomicInteger();
        notifier.onConnected(() -> {
            throw new OutOfMemoryError("simulated");
        });
        notifier.onConnected(calls::incrementAndGet);

        assertThrows(OutOfMemoryError.class, () -> notifier.publish(new ConnectionEvent.Connected()));
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("Closed subscription receives nothing")
    void unsubscribe() {
        AtomicInteger calls = new AtomicInteger();
        Subscription subscription = notifier.onDisconnected(calls::incrementAndGet);
        assertTrue(subscription.isActive());

        subscription.close();
        subscription.close();
        notifier.publish(new ConnectionEvent.Disconnected());

        assertFalse(subscription.isActive());
        assertEquals(0, calls.get());
        assertEquals(0, notifier.subscriberCount());
    }

    @Test
    @DisplayName("Publishing without subscribers is a no-op")
    void noSubscribers() {
        assertDoesNotThrow(() -> notifier.publish(new ConnectionEvent.LatencyMeasured(1.0)));
    }

    @Test
    @DisplayName("Clear removes every subscription")
    void clear() {
        notifier.onConnected(() -> {});
        notifier.onLatencyMeasured(latency -> {});

        notifier.clear();

        assertEquals(0, notifier.subscriberCount());
    }

    @Test
    @DisplayName("Error event requires a message")
    void errorRequiresMessage() {
        assertThrows(NullPointerException.class, () -> new ConnectionEvent.Error(null));
    }
}
