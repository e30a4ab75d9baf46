package express.mvp.tenacity.client.lifecycle;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Unit tests for {@link ConnectionStateMachine}. */
@DisplayName("ConnectionStateMachine")
class ConnectionStateMachineTest {

    private ConnectionStateMachine machine;

    @BeforeEach
    void setUp() {
        machine = new ConnectionStateMachine("test-conn");
    }

    @Nested
    @DisplayName("Initial state")
    class InitialStateTests {

        @Test
        @DisplayName("Starts DISCONNECTED")
        void startsDisconnected() {
            assertEquals(ConnectionState.DISCONNECTED, machine.getState());
            assertFalse(machine.isActive());
            assertEquals("test-conn", machine.getConnectionId());
        }

        @Test
        @DisplayName("Default connection ID")
        void defaultConnectionId() {
            assertEquals("client", new ConnectionStateMachine().getConnectionId());
        }
    }

    @Nested
    @DisplayName("Transition table")
    class TransitionTableTests {

        @ParameterizedTest
        @CsvSource({
            "DISCONNECTED, CONNECTING, true",
            "DISCONNECTED, CONNECTED, false",
            "DISCONNECTED, DISCONNECTING, false",
            "CONNECTING, CONNECTED, true",
            "CONNECTING, DISCONNECTED, true",
            "CONNECTING, DISCONNECTING, true",
            "CONNECTING, FAULTED, true",
            "CONNECTED, DISCONNECTING, true",
            "CONNECTED, FAULTED, true",
            "CONNECTED, CONNECTING, false",
            "CONNECTED, DISCONNECTED, false",
            "DISCONNECTING, DISCONNECTED, true",
            "DISCONNECTING, CONNECTING, false",
            "FAULTED, DISCONNECTING, true",
            "FAULTED, CONNECTING, false",
            "FAULTED, DISCONNECTED, false",
        })
        @DisplayName("Only listed transitions are valid")
        void validity(ConnectionState from, ConnectionState to, boolean valid) {
            assertEquals(valid, ConnectionStateMachine.isValidTransition(from, to));
        }

        @Test
        @DisplayName("Self transitions are invalid")
        void selfTransition() {
            for (ConnectionState state : ConnectionState.values()) {
                assertFalse(ConnectionStateMachine.isValidTransition(state, state));
            }
        }

        @Test
        @DisplayName("Returned target sets are copies")
        void targetSetIsCopy() {
            Set<ConnectionState> targets =
                    ConnectionStateMachine.getValidTransitions(ConnectionState.DISCONNECTED);
            targets.clear();
            assertTrue(ConnectionStateMachine.isValidTransition(
                    ConnectionState.DISCONNECTED, ConnectionState.CONNECTING));
        }
    }

    @Nested
    @DisplayName("Transitions")
    class TransitionTests {

        @Test
        @DisplayName("Full lifecycle")
        void fullLifecycle() {
            assertTrue(machine.transitionFrom(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING));
            assertTrue(machine.transitionFrom(ConnectionState.CONNECTING, ConnectionState.CONNECTED));
            assertTrue(machine.isActive());
            assertTrue(machine.transitionFrom(ConnectionState.CONNECTED, ConnectionState.DISCONNECTING));
            assertTrue(machine.transitionFrom(ConnectionState.DISCONNECTING, ConnectionState.DISCONNECTED));
        }

        @Test
        @DisplayName("Wrong expected state fails")
        void wrongExpectedState() {
            assertFalse(machine.transitionFrom(ConnectionState.CONNECTING, ConnectionState.CONNECTED));
            assertEquals(ConnectionState.DISCONNECTED, machine.getState());
        }

        @Test
        @DisplayName("FAULTED is left only through DISCONNECTING")
        void faultedExit() {
            machine.transitionFrom(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING);
            machine.transitionFrom(ConnectionState.CONNECTING, ConnectionState.FAULTED);

            assertNull(machine.transitionTo(ConnectionState.CONNECTING, null));
            assertEquals(ConnectionState.FAULTED, machine.transitionTo(ConnectionState.DISCONNECTING, null));
            assertEquals(ConnectionState.DISCONNECTING, machine.getState());
        }

        @Test
        @DisplayName("Exactly one of many racing connects wins")
        void racingConnects() throws Exception {
            int threads = 16;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger winners = new AtomicInteger();
            try {
                for (int i = 0; i < threads; i++) {
                    executor.submit(() -> {
                        start.await();
                        if (machine.transitionFrom(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING)) {
                            winners.incrementAndGet();
                        }
                        return null;
                    });
                }
                start.countDown();
                executor.shutdown();
                assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }
            assertEquals(1, winners.get());
        }
    }

    @Nested
    @DisplayName("Listeners")
    class ListenerTests {

        @Test
        @DisplayName("Listeners see previous state, new state and cause")
        void listenerArguments() {
            AtomicReference<ConnectionState> previous = new AtomicReference<>();
            AtomicReference<ConnectionState> current = new AtomicReference<>();
            AtomicReference<Throwable> cause = new AtomicReference<>();
            machine.addListener((p, c, t) -> {
                previous.set(p);
                current.set(c);
                cause.set(t);
            });
            IOException failure = new IOException("refused");

            machine.transitionFrom(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING);
            machine.transitionFrom(ConnectionState.CONNECTING, ConnectionState.DISCONNECTED, failure);

            assertEquals(ConnectionState.CONNECTING, previous.get());
            assertEquals(ConnectionState.DISCONNECTED, current.get());
            assertSame(failure, cause.get());
        }

        @Test
        @DisplayName("Failing listener does not block the transition")
        void failingListener() {
            List<ConnectionState> seen = Collections.synchronizedList(new ArrayList<>());
            machine.addListener((p, c, t) -> {
                throw new IllegalStateException("listener bug");
            });
            machine.addListener((p, c, t) -> seen.add(c));

            assertTrue(machine.transitionFrom(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING));

            assertEquals(List.of(ConnectionState.CONNECTING), seen);
        }

        @Test
        @DisplayName("Removed listener is not called")
        void removedListener() {
            AtomicInteger calls = new AtomicInteger();
            ConnectionStateListener listener = (p, c, t) -> calls.incrementAndGet();
            machine.addListener(listener);

            assertTrue(machine.removeListener(listener));
            machine.transitionFrom(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING);

            assertEquals(0, calls.get());
        }
    }
}
