package express.mvp.tenacity.client.scope;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Unit tests for {@link CompletionSignalPool} and {@link CompletionSignal}. */
@DisplayName("CompletionSignalPool")
class CompletionSignalPoolTest {

    @Test
    @DisplayName("Released signals are reused in a reset state")
    void reuse() {
        CompletionSignalPool pool = new CompletionSignalPool();
        CompletionSignal signal = pool.acquire();
        signal.complete();
        assertTrue(signal.isComplete());

        pool.release(signal);
        CompletionSignal again = pool.acquire();

        assertSame(signal, again);
        assertFalse(again.isComplete());
        assertEquals(0L, again.completedAtNanos());
    }

    @Test
    @DisplayName("Pool retains at most its capacity")
    void boundedRetention() {
        CompletionSignalPool pool = new CompletionSignalPool();
        List<CompletionSignal> signals = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            signals.add(pool.acquire());
        }
        signals.forEach(pool::release);

        assertEquals(CompletionSignalPool.DEFAULT_CAPACITY, pool.idleCount());
        assertEquals(20, pool.capacity());
    }

    @Test
    @DisplayName("Releasing null is ignored")
    void releaseNull() {
        CompletionSignalPool pool = new CompletionSignalPool(2);
        pool.release(null);
        assertEquals(0, pool.idleCount());
    }

    @Test
    @Timeout(5)
    @DisplayName("Await wakes on completion from another thread")
    void awaitWakes() {
        CompletionSignal signal = new CompletionSignalPool().acquire();
        new Thread(() -> {
            CancellationScopeManager.delay(Duration.ofMillis(20), CancellationToken.none());
            signal.complete();
        }).start();

        assertTrue(signal.await(Duration.ofSeconds(4), CancellationToken.none()));
        assertTrue(signal.completedAtNanos() > 0);
    }

    @Test
    @DisplayName("Await gives up on timeout and on cancellation")
    void awaitGivesUp() {
        CompletionSignal signal = new CompletionSignalPool().acquire();
        assertFalse(signal.await(Duration.ofMillis(30), CancellationToken.none()));

        CancellationTokenSource source = new CancellationTokenSource();
        source.cancel();
        assertFalse(signal.await(Duration.ofSeconds(10), source.token()));
    }
}
