package express.mvp.tenacity.client.transport;

import express.mvp.tenacity.client.ServerAddress;
import express.mvp.tenacity.client.codec.FrameDecoder;
import express.mvp.tenacity.client.codec.Message;
import express.mvp.tenacity.client.codec.MessageCodec;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Length-prefixed binary frames over a TCP socket.
 *
 * <p>Reads use a socket timeout equal to the poll timeout, so the receiver loop wakes up
 * regularly to check its cancellation token. Bytes read before a timeout stay in the
 * {@link FrameDecoder}; a frame split across reads is reassembled. A length prefix above the
 * frame limit fails the read with a protocol error as soon as the header arrives.
 *
 * <p>Socket options: {@code TCP_NODELAY} and {@code SO_KEEPALIVE} are enabled.
 */
public final class FramedStreamTransport implements ClientTransport {

    private static final Logger LOGGER = Logger.getLogger(FramedStreamTransport.class.getName());

    private static final int READ_CHUNK_SIZE = 8192;

    private final ServerAddress address;
    private final MessageCodec codec;
    private final FrameDecoder decoder;
    private final byte[] readChunk = new byte[READ_CHUNK_SIZE];
    private final Object writeLock = new Object();

    private volatile Socket socket;
    private volatile boolean closed;
    private InputStream in;
    private OutputStream out;
    private int currentSoTimeout = -1;

    /**
     * Creates an unopened transport.
     *
     * @param address a framed-stream address
     * @param codec codec for outgoing and incoming frames
     */
    public FramedStreamTransport(ServerAddress address, MessageCodec codec) {
        this.address = Objects.requireNonNull(address, "address");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.decoder = codec.newDecoder();
    }

    @Override
    public void open(Duration timeout) throws IOException {
        if (closed) {
            throw new ClosedChannelException();
        }
        Socket s = new Socket();
        socket = s;
        try {
            s.setTcpNoDelay(true);
            s.setKeepAlive(true);
            s.connect(
                    new InetSocketAddress(address.host(), address.port()),
                    (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis())));
            in = s.getInputStream();
            out = s.getOutputStream();
        } catch (IOException e) {
            closeQuietly(s);
            throw e;
        }
        if (closed) {
            closeQuietly(s);
            throw new ClosedChannelException();
        }
        LOGGER.fine(() -> "Connected to " + describe());
    }

    @Override
    public void write(Message message) throws IOException {
        byte[] frame = codec.encodeFrame(message);
        synchronized (writeLock) {
            OutputStream stream = out;
            if (closed || stream == null) {
                throw new ClosedChannelException();
            }
            stream.write(frame);
            stream.flush();
        }
    }

    @Override
    public Message read(Duration pollTimeout) throws IOException {
        Socket s = socket;
        if (closed || s == null || in == null) {
            throw new ClosedChannelException();
        }
        while (true) {
            byte[] payload = decoder.nextFrame();
            if (payload != null) {
                return codec.decodePayload(payload);
            }
            int timeoutMillis = (int) Math.max(1, Math.min(Integer.MAX_VALUE, pollTimeout.toMillis()));
            if (timeoutMillis != currentSoTimeout) {
                s.setSoTimeout(timeoutMillis);
                currentSoTimeout = timeoutMillis;
            }
            int read;
            try {
                read = in.read(readChunk);
            } catch (SocketTimeoutException e) {
                return null;
            }
            if (read < 0) {
                throw new EOFException("Connection closed by " + describe());
            }
            decoder.feed(readChunk, 0, read);
        }
    }

    @Override
    public boolean isOpen() {
        Socket s = socket;
        return !closed && s != null && s.isConnected() && !s.isClosed();
    }

    @Override
    public String describe() {
        return "tcp://" + address.host() + ":" + address.port();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        Socket s = socket;
        if (s != null) {
            closeQuietly(s);
        }
    }

    private static void closeQuietly(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Error closing socket", e);
        }
    }

    @Override
    public String toString() {
        return "FramedStreamTransport[" + describe() + ", open=" + isOpen() + "]";
    }
}
