package express.mvp.tenacity.client.transport;

import express.mvp.tenacity.client.ServerAddress;
import express.mvp.tenacity.client.codec.Message;
import express.mvp.tenacity.client.codec.MessageCodec;
import express.mvp.tenacity.client.codec.ProtocolException;
import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unary request/response calls over HTTP.
 *
 * <h2>Endpoints</h2>
 *
 * <ul>
 *   <li>{@code GET {base}/health}: a 2xx answer means the server is alive. Used to open the
 *       connection and for liveness probes, whose round trip is the measured latency.
 *   <li>{@code POST {base}/rpc}: the body is one encoded frame. A non-empty 2xx answer is one
 *       encoded frame and becomes the next inbound message; an undecodable answer fails the
 *       call with a {@link TransportException}.
 * </ul>
 *
 * <p>There is no persistent stream: "connected" means the last health check succeeded and the
 * transport has not been closed.
 *
 * <p>Responses wait in a bounded inbound queue until the receiver reads them. A response that
 * finds the queue full fails its call with an {@link IOException}, which drops the connection.
 * Transports made by one {@link TransportFactory} share a single {@link HttpClient}.
 */
public final class RpcTransport implements ClientTransport {

    static final String HEALTH_PATH = "/health";
    static final String RPC_PATH = "/rpc";

    /** Inbound queue size when none is given. */
    public static final int DEFAULT_INBOUND_CAPACITY = 1024;

    private static final String CONTENT_TYPE = "application/octet-stream";

    private final ServerAddress address;
    private final MessageCodec codec;
    private final HttpClient sharedClient;
    private final int inboundCapacity;
    private final BlockingQueue<Message> inbound;

    private volatile HttpClient httpClient;
    private volatile Duration requestTimeout = Duration.ofSeconds(5);
    private volatile boolean closed;

    /**
     * Creates an unopened transport with its own HTTP client and the default inbound capacity.
     *
     * @param address an RPC address
     * @param codec codec for request and response frames
     */
    public RpcTransport(ServerAddress address, MessageCodec codec) {
        this(address, codec, null, DEFAULT_INBOUND_CAPACITY);
    }

    /**
     * Creates an unopened transport.
     *
     * @param address an RPC address
     * @param codec codec for request and response frames
     * @param sharedClient HTTP client to use, or null to build one on open
     * @param inboundCapacity maximum number of unread responses
     */
    public RpcTransport(
            ServerAddress address, MessageCodec codec, HttpClient sharedClient, int inboundCapacity) {
        if (inboundCapacity < 1) {
            throw new IllegalArgumentException("inboundCapacity must be >= 1: " + inboundCapacity);
        }
        this.address = Objects.requireNonNull(address, "address");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sharedClient = sharedClient;
        this.inboundCapacity = inboundCapacity;
        this.inbound = new LinkedBlockingQueue<>(inboundCapacity);
    }

    /**
     * Builds an HTTP client configured the way this transport expects.
     *
     * @param connectTimeout TCP connect timeout
     * @return a new client
     */
    static HttpClient newHttpClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public void open(Duration timeout) throws IOException {
        if (closed) {
            throw new ClosedChannelException();
        }
        this.requestTimeout = timeout;
        this.httpClient = sharedClient != null ? sharedClient : newHttpClient(timeout);
        checkHealth(timeout);
    }

    @Override
    public void write(Message message) throws IOException {
        HttpClient client = ensureNotClosed();
        HttpRequest request = HttpRequest.newBuilder(address.endpoint(RPC_PATH))
                .timeout(requestTimeout)
                .header("Content-Type", CONTENT_TYPE)
                .POST(HttpRequest.BodyPublishers.ofByteArray(codec.encodeFrame(message)))
                .build();
        HttpResponse<byte[]> response = send(client, request);
        if (!isSuccess(response.statusCode())) {
            throw new IOException("RPC call to " + request.uri() + " returned HTTP "
                    + response.statusCode());
        }
        byte[] body = response.body();
        if (body != null && body.length > 0) {
            Message reply;
            try {
                reply = codec.decodeFrame(body);
            } catch (ProtocolException e) {
                throw new TransportException("Malformed response from " + request.uri(), e);
            }
            if (!inbound.offer(reply)) {
                throw new IOException("Inbound queue full (" + inboundCapacity
                        + " unread responses), dropping " + reply.type() + " from " + request.uri());
            }
        }
    }

    @Override
    public Message read(Duration pollTimeout) throws IOException {
        Message next = inbound.poll();
        if (next != null) {
            return next;
        }
        if (closed) {
            throw new EOFException(describe() + " is closed");
        }
        try {
            return inbound.poll(pollTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for a response");
        }
    }

    @Override
    public boolean hasNativeProbe() {
        return true;
    }

    @Override
    public OptionalDouble probe(Duration timeout) throws IOException {
        ensureNotClosed();
        long start = System.nanoTime();
        checkHealth(timeout);
        return OptionalDouble.of((System.nanoTime() - start) / 1_000_000.0);
    }

    @Override
    public boolean isOpen() {
        return !closed && httpClient != null;
    }

    HttpClient httpClient() {
        return httpClient;
    }

    int pendingResponses() {
        return inbound.size();
    }

    @Override
    public String describe() {
        return address.baseUri().toString();
    }

    @Override
    public void close() {
        closed = true;
        httpClient = null;
    }

    private void checkHealth(Duration timeout) throws IOException {
        HttpClient client = ensureNotClosed();
        URI uri = address.endpoint(HEALTH_PATH);
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
        HttpResponse<byte[]> response = send(client, request);
        if (!isSuccess(response.statusCode())) {
            throw new IOException("Health check " + uri + " returned HTTP " + response.statusCode());
        }
    }

    private HttpResponse<byte[]> send(HttpClient client, HttpRequest request) throws IOException {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during call to " + request.uri());
        }
    }

    private HttpClient ensureNotClosed() throws IOException {
        HttpClient client = httpClient;
        if (closed) {
            throw new ClosedChannelException();
        }
        if (client == null) {
            throw new IOException(describe() + " is not open");
        }
        return client;
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    @Override
    public String toString() {
        return "RpcTransport[" + describe() + ", open=" + isOpen() + "]";
    }
}
