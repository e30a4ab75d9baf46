package express.mvp.tenacity.benchmark;

import express.mvp.tenacity.client.ConnectResult;
import express.mvp.tenacity.client.ConnectionClient;
import express.mvp.tenacity.client.ConnectionConfig;
import express.mvp.tenacity.client.ServerAddress;
import express.mvp.tenacity.client.codec.Message;
import express.mvp.tenacity.client.codec.MessageCodec;
import express.mvp.tenacity.client.codec.MessageType;
import express.mvp.tenacity.client.transport.FramedStreamTransport;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteOrder;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.*;

/**
 * JMH benchmark measuring one framed message round trip against a Netty echo server.
 *
 * <p>{@code NETTY} is a plain Netty client as the baseline, {@code FRAMED_STREAM} drives the
 * blocking transport directly and {@code CLIENT} goes through the full client with its send
 * queue and receiver loop.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(1)
@Warmup(iterations = 1, time = 10)
@Measurement(iterations = 1, time = 30)
public class RoundTripBenchmark {

    private static final Duration POLL = Duration.ofMillis(100);

    @Param({ "NETTY", "FRAMED_STREAM", "CLIENT" })
    private String implementation;

    @Param({ "32", "4096" })
    private int bodySize;

    private EchoServer server;
    private BenchmarkDriver driver;

    @Setup
    public void setup() throws Exception {
        server = new EchoServer();
        server.start();
        byte[] body = new byte[bodySize];
        switch (implementation) {
            case "NETTY" -> driver = new NettyDriver(body);
            case "FRAMED_STREAM" -> driver = new FramedStreamDriver(body);
            case "CLIENT" -> driver = new ClientDriver(body);
            default -> throw new IllegalArgumentException("Unknown implementation: " + implementation);
        }
        driver.setup(server.port());
    }

    @TearDown
    public void tearDown() {
        if (driver != null) {
            driver.tearDown();
        }
        if (server != null) {
            server.stop();
        }
    }

    @Benchmark
    public void roundTrip() throws Exception {
        driver.roundTrip();
    }

    interface BenchmarkDriver {
        void setup(int port) throws Exception;

        void roundTrip() throws Exception;

        void tearDown();
    }

    /** Echoes every received byte back to the sender. */
    static class EchoServer {
        private EventLoopGroup bossGroup;
        private EventLoopGroup workerGroup;
        private Channel serverChannel;

        void start() throws InterruptedException {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup(1);

            ServerBootstrap sb = new ServerBootstrap();
            sb.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(new ChannelInboundHandlerAdapter() {
                                @Override
                                public void channelRead(ChannelHandlerContext ctx, Object msg) {
                                    ctx.writeAndFlush(msg);
                                }
                            });
                        }
                    });

            serverChannel = sb.bind(new InetSocketAddress("127.0.0.1", 0)).sync().channel();
        }

        int port() {
            return ((InetSocketAddress) serverChannel.localAddress()).getPort();
        }

        void stop() {
            try {
                if (serverChannel != null) {
                    serverChannel.close().sync();
                }
                workerGroup.shutdownGracefully().sync();
                bossGroup.shutdownGracefully().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ==========================================
    // Netty client baseline
    // ==========================================
    static class NettyDriver implements BenchmarkDriver {
        private final ByteBuf frame;
        private EventLoopGroup clientGroup;
        private Channel clientChannel;
        private volatile CountDownLatch latch;

        NettyDriver(byte[] body) {
            MessageCodec codec = new MessageCodec();
            this.frame = Unpooled.directBuffer()
                    .writeBytes(codec.encodeFrame(Message.of(MessageType.GAME_DATA, body)));
        }

        @Override
        public void setup(int port) throws Exception {
            clientGroup = new NioEventLoopGroup(1);
            Bootstrap cb = new Bootstrap();
            cb.group(clientGroup)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(new LengthFieldBasedFrameDecoder(
                                    ByteOrder.LITTLE_ENDIAN, MessageCodec.DEFAULT_MAX_FRAME_SIZE,
                                    0, MessageCodec.LENGTH_PREFIX_SIZE, 0, 0, true));
                            ch.pipeline().addLast(new ChannelInboundHandlerAdapter() {
                                @Override
                                public void channelRead(ChannelHandlerContext ctx, Object msg) {
                                    if (msg instanceof ByteBuf) {
                                        ((ByteBuf) msg).release();
                                    }
                                    CountDownLatch current = latch;
                                    if (current != null) {
                                        current.countDown();
                                    }
                                }
                            });
                        }
                    });

            clientChannel = cb.connect("127.0.0.1", port).sync().channel();
        }

        @Override
        public void roundTrip() throws Exception {
            latch = new CountDownLatch(1);
            clientChannel.writeAndFlush(frame.retainedDuplicate());
            latch.await();
        }

        @Override
        public void tearDown() {
            try {
                if (clientChannel != null) {
                    clientChannel.close().sync();
                }
                if (clientGroup != null) {
                    clientGroup.shutdownGracefully().sync();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                frame.release();
            }
        }
    }

    // ==========================================
    // Blocking framed-stream transport
    // ==========================================
    static class FramedStreamDriver implements BenchmarkDriver {
        private final Message message;
        private FramedStreamTransport transport;

        FramedStreamDriver(byte[] body) {
            this.message = Message.of(MessageType.GAME_DATA, body);
        }

        @Override
        public void setup(int port) throws IOException {
            transport = new FramedStreamTransport(
                    ServerAddress.parse("127.0.0.1:" + port), new MessageCodec());
            transport.open(Duration.ofSeconds(5));
        }

        @Override
        public void roundTrip() throws IOException {
            transport.write(message);
            while (transport.read(POLL) == null) {
                // poll until the echo arrives
            }
        }

        @Override
        public void tearDown() {
            if (transport != null) {
                transport.close();
            }
        }
    }

    // ==========================================
    // Full client: send queue, sender and receiver loops
    // ==========================================
    static class ClientDriver implements BenchmarkDriver {
        private final byte[] body;
        private final Semaphore echoes = new Semaphore(0);
        private ConnectionClient client;

        ClientDriver(byte[] body) {
            this.body = body;
        }

        @Override
        public void setup(int port) {
            client = new ConnectionClient(ConnectionConfig.builder()
                    .clientName("bench")
                    .serverAddress("tcp://127.0.0.1:" + port)
                    .enableKeepalive(false)
                    .enableAutoReconnect(false)
                    .readPollInterval(POLL)
                    .build());
            client.events().onMessage(m -> echoes.release());
            ConnectResult result = client.connect();
            if (!result.isConnected()) {
                throw new IllegalStateException(result.describe());
            }
        }

        @Override
        public void roundTrip() throws InterruptedException {
            while (!client.send(MessageType.GAME_DATA, body).isAccepted()) {
                Thread.onSpinWait();
            }
            echoes.acquire();
        }

        @Override
        public void tearDown() {
            if (client != null) {
                client.close();
            }
        }
    }
}
