package express.mvp.tenacity.client.lifecycle;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/** Scriptable connection for monitor and supervisor tests. */
final class FakeSupervisedConnection implements SupervisedConnection {

    final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTED);
    final AtomicInteger probes = new AtomicInteger();
    final AtomicInteger reconnects = new AtomicInteger();
    final List<Throwable> losses = Collections.synchronizedList(new ArrayList<>());
    volatile Exception probeFailure;
    volatile boolean reconnectSucceeds = true;

    @Override
    public String name() {
        return "fake";
    }

    @Override
    public ConnectionState state() {
        return state.get();
    }

    @Override
    public OptionalDouble probe(Duration timeout) throws IOException, TimeoutException {
        probes.incrementAndGet();
        Exception failure = probeFailure;
        if (failure instanceof IOException) {
            throw (IOException) failure;
        }
        if (failure instanceof TimeoutException) {
            throw (TimeoutException) failure;
        }
        return OptionalDouble.of(1.0);
    }

    @Override
    public void connectionLost(Throwable cause) {
        losses.add(cause);
        state.set(ConnectionState.DISCONNECTED);
    }

    @Override
    public boolean reconnect() {
        reconnects.incrementAndGet();
        if (reconnectSucceeds) {
            state.set(ConnectionState.CONNECTED);
        }
        return reconnectSucceeds;
    }
}
