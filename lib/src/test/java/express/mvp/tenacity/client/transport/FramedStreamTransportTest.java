package express.mvp.tenacity.client.transport;

import static express.mvp.tenacity.client.support.ScriptedTransportFactory.eventually;
import static org.junit.jupiter.api.Assertions.*;

import express.mvp.tenacity.client.ConnectResult;
import express.mvp.tenacity.client.ConnectionClient;
import express.mvp.tenacity.client.ConnectionConfig;
import express.mvp.tenacity.client.ServerAddress;
import express.mvp.tenacity.client.codec.Message;
import express.mvp.tenacity.client.codec.MessageCodec;
import express.mvp.tenacity.client.codec.MessageType;
import express.mvp.tenacity.client.codec.ProtocolException;
import express.mvp.tenacity.client.lifecycle.ConnectionState;
import express.mvp.tenacity.client.support.FramedEchoServer;
import java.io.EOFException;
import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Tests for {@link FramedStreamTransport} against a loopback Netty server. */
@DisplayName("FramedStreamTransport")
@Timeout(30)
class FramedStreamTransportTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final Duration POLL = Duration.ofMillis(20);
    private static final byte[] TOKEN = "resume-1".getBytes(StandardCharsets.UTF_8);

    private FramedEchoServer server;

    @BeforeEach
    void startServer() throws InterruptedException {
        server = new FramedEchoServer(TOKEN).start();
    }

    @AfterEach
    void stopServer() throws InterruptedException {
        server.close();
    }

    private static Message readNext(ClientTransport transport) throws IOException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (System.nanoTime() < deadline) {
            Message message = transport.read(POLL);
            if (message != null) {
                return message;
            }
        }
        fail("No message within " + WAIT);
        return null;
    }

    // ==================== Transport ====================

    @Nested
    @DisplayName("Raw transport")
    class RawTransport {

        private FramedStreamTransport transport;

        @AfterEach
        void closeTransport() {
            if (transport != null) {
                transport.close();
            }
        }

        private FramedStreamTransport open(MessageCodec codec) throws IOException {
            transport = new FramedStreamTransport(ServerAddress.parse(server.address()), codec);
            transport.open(WAIT);
            return transport;
        }

        @Test
        @DisplayName("Echoes a data message")
        void echoesDataMessage() throws IOException {
            open(new MessageCodec());
            byte[] body = "hello".getBytes(StandardCharsets.UTF_8);

            transport.write(new Message(MessageType.GAME_DATA, 7, 1234L, body));
            Message echo = readNext(transport);

            assertEquals(MessageType.GAME_DATA, echo.type());
            assertEquals(7, echo.sequenceNumber());
            assertEquals(1234L, echo.timestamp());
            assertArrayEquals(body, echo.body());
            assertTrue(transport.isOpen());
        }

        @Test
        @DisplayName("Reassembles a compressed message larger than one read chunk")
        void largeCompressedMessage() throws IOException {
            open(new MessageCodec());
            byte[] body = new byte[64 * 1024];
            Arrays.fill(body, (byte) 'x');

            transport.write(Message.of(MessageType.STATE_SYNC, body));
            Message echo = readNext(transport);

            assertEquals(MessageType.STATE_SYNC, echo.type());
            assertArrayEquals(body, echo.body());
        }

        @Test
        @DisplayName("Returns null when nothing arrives within the poll timeout")
        void pollTimeoutReturnsNull() throws IOException {
            open(new MessageCodec());

            assertNull(transport.read(POLL));
            assertTrue(transport.isOpen());
        }

        @Test
        @DisplayName("Rejects an oversized length prefix before the body arrives")
        void rejectsOversizedPrefix() throws Exception {
            open(new MessageCodec(512, true, 65536));
            assertTrue(eventually(() -> server.acceptedConnections() == 1, WAIT));

            // 70000 as a little-endian prefix, no body follows
            server.sendRaw(new byte[] {(byte) 0x70, (byte) 0x11, (byte) 0x01, (byte) 0x00});

            ProtocolException e = assertThrows(ProtocolException.class, () -> readNext(transport));
            assertTrue(e.getMessage().contains("70000"), e.getMessage());
        }

        @Test
        @DisplayName("Reports end of stream when the server closes")
        void serverCloseIsEof() throws Exception {
            open(new MessageCodec());
            assertTrue(eventually(() -> server.acceptedConnections() == 1, WAIT));

            server.dropClients();

            assertThrows(EOFException.class, () -> readNext(transport));
        }

        @Test
        @DisplayName("Fails to open when nothing listens")
        void openRefused() throws IOException {
            int port;
            try (ServerSocket probe = new ServerSocket(0)) {
                port = probe.getLocalPort();
            }
            transport = new FramedStreamTransport(
                    ServerAddress.parse("127.0.0.1:" + port), new MessageCodec());

            assertThrows(IOException.class, () -> transport.open(Duration.ofSeconds(1)));
            assertFalse(transport.isOpen());
        }

        @Test
        @DisplayName("Rejects use after close")
        void closedTransport() throws IOException {
            open(new MessageCodec());
            transport.close();

            assertFalse(transport.isOpen());
            assertThrows(IOException.class,
                    () -> transport.write(Message.of(MessageType.GAME_DATA, new byte[1])));
            assertThrows(IOException.class, () -> transport.read(POLL));
            assertThrows(IOException.class, () -> transport.open(WAIT));
        }
    }

    // ==================== Client ====================

    @Nested
    @DisplayName("Through ConnectionClient")
    class ThroughClient {

        private ConnectionClient client;
        private final List<String> errors = new CopyOnWriteArrayList<>();
        private final List<Message> messages = new CopyOnWriteArrayList<>();
        private final AtomicInteger disconnects = new AtomicInteger();

        @AfterEach
        void closeClient() {
            if (client != null) {
                client.close();
            }
        }

        private ConnectionConfig.Builder config() {
            return ConnectionConfig.builder()
                    .clientName("framed")
                    .serverAddress(server.address())
                    .connectTimeout(Duration.ofSeconds(2))
                    .retryBaseDelay(Duration.ofMillis(20))
                    .enableKeepalive(false)
                    .enableAutoReconnect(false)
                    .reconnectDelay(Duration.ofMillis(50))
                    .readPollInterval(POLL)
                    .disconnectTimeout(Duration.ofSeconds(2));
        }

        private ConnectionClient start(ConnectionConfig config) {
            client = new ConnectionClient(config);
            client.events().onError(errors::add);
            client.events().onMessage(messages::add);
            client.events().onDisconnected(disconnects::incrementAndGet);
            ConnectResult result = client.connect();
            assertTrue(result.isConnected(), result.describe());
            return client;
        }

        @Test
        @DisplayName("Handshake stores the server's resumption token")
        void handshakeStoresToken() throws InterruptedException {
            start(config().build());

            assertTrue(server.awaitReceived(MessageType.CONNECT, 1, WAIT));
            assertEquals(0, server.received().get(0).bodyLength());
            assertTrue(eventually(() -> client.loadResumptionToken().isPresent(), WAIT));
            assertArrayEquals(TOKEN, client.loadResumptionToken().get());
        }

        @Test
        @DisplayName("Delivers echoed data messages to subscribers")
        void echoedDataReachesSubscribers() throws InterruptedException {
            start(config().build());

            assertTrue(client.send(MessageType.PLAYER_ACTION, "jump".getBytes(StandardCharsets.UTF_8))
                    .isAccepted());

            assertTrue(eventually(() -> !messages.isEmpty(), WAIT));
            Message echo = messages.get(0);
            assertEquals(MessageType.PLAYER_ACTION, echo.type());
            assertEquals("jump", new String(echo.body(), StandardCharsets.UTF_8));
            assertTrue(eventually(() -> client.metrics().getMessagesReceived() >= 2, WAIT));
        }

        @Test
        @DisplayName("Measures latency from the heartbeat echo")
        void heartbeatProbeMeasuresLatency() throws Exception {
            start(config().heartbeatAckRequired(true).probeTimeout(WAIT).build());
            List<Double> samples = Collections.synchronizedList(new ArrayList<>());
            client.events().onLatencyMeasured(samples::add);

            OptionalDouble latency = client.probe();

            assertTrue(latency.isPresent());
            assertTrue(latency.getAsDouble() >= 0.0);
            assertEquals(1, samples.size());
            assertEquals(1, client.metrics().getLatencySamples());
        }

        @Test
        @DisplayName("Oversized inbound frame disconnects with a protocol error")
        void oversizedFrameIsProtocolError() throws Exception {
            start(config().maxFrameSize(65536).build());
            assertTrue(server.awaitReceived(MessageType.CONNECT, 1, WAIT));

            server.sendRaw(new byte[] {(byte) 0x70, (byte) 0x11, (byte) 0x01, (byte) 0x00});

            assertTrue(eventually(() -> client.state() == ConnectionState.DISCONNECTED, WAIT));
            assertEquals(1, disconnects.get());
            assertTrue(errors.stream().anyMatch(e -> e.startsWith("Protocol error: ")), errors.toString());
        }

        @Test
        @DisplayName("Reconnects after the server drops the connection and resumes the session")
        void reconnectsWithToken() throws Exception {
            start(config().enableAutoReconnect(true).build());
            assertTrue(eventually(() -> client.loadResumptionToken().isPresent(), WAIT));

            server.dropClients();

            assertTrue(server.awaitReceived(MessageType.CONNECT, 2, WAIT));
            assertTrue(eventually(() -> client.isConnected(), WAIT));
            Message resumed = server.received().stream()
                    .filter(m -> m.type() == MessageType.CONNECT)
                    .skip(1)
                    .findFirst()
                    .orElseThrow();
            assertArrayEquals(TOKEN, resumed.body());
            assertTrue(disconnects.get() >= 1);
            assertEquals(2, client.metrics().getTotalConnections());
        }

        @Test
        @DisplayName("Graceful disconnect says goodbye to the server")
        void gracefulDisconnect() throws Exception {
            start(config().build());

            assertTrue(client.disconnect());

            assertTrue(server.awaitReceived(MessageType.DISCONNECT, 1, WAIT));
            assertEquals(ConnectionState.DISCONNECTED, client.state());
            assertEquals(1, disconnects.get());
        }
    }
}
