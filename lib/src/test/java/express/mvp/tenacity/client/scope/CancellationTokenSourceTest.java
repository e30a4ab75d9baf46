package express.mvp.tenacity.client.scope;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link CancellationTokenSource} and {@link CancellationToken}. */
@DisplayName("CancellationTokenSource")
class CancellationTokenSourceTest {

    @Test
    @DisplayName("Cancel runs callbacks once")
    void cancelRunsCallbacksOnce() {
        CancellationTokenSource source = new CancellationTokenSource();
        AtomicInteger calls = new AtomicInteger();
        source.token().register(calls::incrementAndGet);

        assertTrue(source.cancel());
        assertFalse(source.cancel());

        assertEquals(1, calls.get());
        assertTrue(source.isCancellationRequested());
    }

    @Test
    @DisplayName("Callback registered after cancel runs immediately")
    void lateRegistration() {
        CancellationTokenSource source = new CancellationTokenSource();
        source.cancel();
        AtomicInteger calls = new AtomicInteger();

        source.token().register(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Closed registration is not invoked")
    void closedRegistration() {
        CancellationTokenSource source = new CancellationTokenSource();
        AtomicInteger calls = new AtomicInteger();
        CancellationToken.Registration registration = source.token().register(calls::incrementAndGet);

        registration.close();
        source.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("Failing callback does not stop the others")
    void failingCallback() {
        CancellationTokenSource source = new CancellationTokenSource();
        AtomicInteger calls = new AtomicInteger();
        source.token().register(() -> {
            throw new IllegalStateException("listener bug");
        });
        source.token().register(calls::incrementAndGet);

        source.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Linked source follows any parent")
    void linkedFollowsParent() {
        CancellationTokenSource first = new CancellationTokenSource();
        CancellationTokenSource second = new CancellationTokenSource();
        CancellationTokenSource linked =
                CancellationTokenSource.linkedTo(first.token(), second.token());

        second.cancel();

        assertTrue(linked.isCancellationRequested());
        assertFalse(first.isCancellationRequested());
    }

    @Test
    @DisplayName("Cancelling a child leaves the parent alone")
    void childDoesNotCancelParent() {
        CancellationTokenSource parent = new CancellationTokenSource();
        CancellationTokenSource child = CancellationTokenSource.linkedTo(parent.token());

        child.cancel();

        assertFalse(parent.isCancellationRequested());
    }

    @Test
    @DisplayName("Closing a linked source detaches it from its parents")
    void closeDetaches() {
        CancellationTokenSource parent = new CancellationTokenSource();
        CancellationTokenSource child = CancellationTokenSource.linkedTo(parent.token());
        assertEquals(1, parent.token().registrationCount());

        child.close();
        parent.cancel();

        assertEquals(0, parent.token().registrationCount());
        assertFalse(child.isCancellationRequested());
    }

    @Test
    @DisplayName("Await returns true on cancel and false on timeout")
    void await() {
        CancellationTokenSource source = new CancellationTokenSource();
        assertFalse(source.token().await(Duration.ofMillis(10)));

        source.cancel();

        assertTrue(source.token().await(Duration.ofSeconds(10)));
    }

    @Test
    @DisplayName("None token is never cancelled")
    void noneToken() {
        AtomicInteger calls = new AtomicInteger();
        CancellationToken.none().register(calls::incrementAndGet);

        assertFalse(CancellationToken.none().isCancellationRequested());
        assertFalse(CancellationToken.none().cancel());
        assertEquals(0, calls.get());
    }
}
