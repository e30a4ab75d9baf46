package express.mvp.tenacity.client.support;

import express.mvp.tenacity.client.ServerAddress;
import express.mvp.tenacity.client.codec.MessageCodec;
import express.mvp.tenacity.client.transport.ClientTransport;
import express.mvp.tenacity.client.transport.TransportFactory;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/** Creates {@link ScriptedTransport}s and scripts how their opens and writes behave. */
public final class ScriptedTransportFactory implements TransportFactory {

    private final List<ScriptedTransport> created = new CopyOnWriteArrayList<>();
    private final AtomicInteger openAttempts = new AtomicInteger();
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private volatile Supplier<IOException> openFailure;
    private volatile CountDownLatch openGate;
    private volatile CountDownLatch writeGate;
    volatile RuntimeException openRuntimeFailure;
    volatile boolean echoHeartbeats;

    @Override
    public ClientTransport create(ServerAddress address, MessageCodec codec) {
        ScriptedTransport transport = new ScriptedTransport(this, codec);
        created.add(transport);
        return transport;
    }

    /** Fails the next {@code count} opens with the supplied exception. */
    public ScriptedTransportFactory failOpens(int count, Supplier<IOException> failure) {
        this.openFailure = failure;
        this.failuresRemaining.set(count);
        return this;
    }

    /** Fails every open with the supplied exception. */
    public ScriptedTransportFactory failAllOpens(Supplier<IOException> failure) {
        return failOpens(Integer.MAX_VALUE, failure);
    }

    public ScriptedTransportFactory failOpensWith(RuntimeException failure) {
        this.openRuntimeFailure = failure;
        return this;
    }

    /** Makes opens block until {@link #releaseOpens()}. */
    public ScriptedTransportFactory holdOpens() {
        this.openGate = new CountDownLatch(1);
        return this;
    }

    public void releaseOpens() {
        CountDownLatch gate = openGate;
        if (gate != null) {
            gate.countDown();
        }
    }

    /** Makes writes block until {@link #releaseWrites()}. */
    public ScriptedTransportFactory holdWrites() {
        this.writeGate = new CountDownLatch(1);
        return this;
    }

    public void releaseWrites() {
        CountDownLatch gate = writeGate;
        if (gate != null) {
            gate.countDown();
        }
    }

    public ScriptedTransportFactory echoHeartbeats(boolean echo) {
        this.echoHeartbeats = echo;
        return this;
    }

    public int openAttempts() {
        return openAttempts.get();
    }

    public List<ScriptedTransport> created() {
        return created;
    }

    public ScriptedTransport last() {
        return created.get(created.size() - 1);
    }

    void awaitOpenRelease(ScriptedTransport transport) throws IOException {
        openAttempts.incrementAndGet();
        awaitGate(openGate, transport);
    }

    void awaitWriteRelease(ScriptedTransport transport) throws IOException {
        awaitGate(writeGate, transport);
    }

    IOException nextOpenFailure() {
        Supplier<IOException> failure = openFailure;
        if (failure != null && failuresRemaining.getAndDecrement() > 0) {
            return failure.get();
        }
        return null;
    }

    private static void awaitGate(CountDownLatch gate, ScriptedTransport transport)
            throws IOException {
        if (gate == null) {
            return;
        }
        try {
            while (!gate.await(5, TimeUnit.MILLISECONDS)) {
                if (transport.isClosed()) {
                    throw new SocketException("Socket closed");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted");
        }
    }

    /** Polls a condition until it holds. */
    public static boolean eventually(BooleanSupplier condition, Duration timeout)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(5);
        }
        return condition.getAsBoolean();
    }
}
