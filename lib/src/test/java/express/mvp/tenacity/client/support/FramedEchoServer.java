package express.mvp.tenacity.client.support;

import express.mvp.tenacity.client.codec.Message;
import express.mvp.tenacity.client.codec.MessageCodec;
import express.mvp.tenacity.client.codec.MessageType;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.util.concurrent.GlobalEventExecutor;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteOrder;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loopback server speaking the length-prefixed frame protocol.
 *
 * <p>Answers CONNECT with a CONNECT_ACK carrying a resumption token, echoes heartbeats and data
 * messages, and closes the channel on DISCONNECT. Every decoded message is recorded.
 */
public final class FramedEchoServer implements AutoCloseable {

    private final EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final EventLoopGroup workerGroup = new NioEventLoopGroup(1);
    private final ChannelGroup clients = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final MessageCodec codec = new MessageCodec();
    private final List<Message> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger accepted = new AtomicInteger();
    private final byte[] resumptionToken;

    private volatile boolean echoHeartbeats = true;
    private Channel serverChannel;

    public FramedEchoServer(byte[] resumptionToken) {
        this.resumptionToken = resumptionToken;
    }

    public FramedEchoServer start() throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        clients.add(ch);
                        accepted.incrementAndGet();
                        ch.pipeline().addLast(new LengthFieldBasedFrameDecoder(
                                ByteOrder.LITTLE_ENDIAN,
                                MessageCodec.DEFAULT_MAX_FRAME_SIZE,
                                0,
                                MessageCodec.LENGTH_PREFIX_SIZE,
                                0,
                                MessageCodec.LENGTH_PREFIX_SIZE,
                                true));
                        ch.pipeline().addLast(new FrameHandler());
                    }
                });
        serverChannel = bootstrap
                .bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0))
                .sync()
                .channel();
        return this;
    }

    public int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public String address() {
        return "tcp://127.0.0.1:" + port();
    }

    public void echoHeartbeats(boolean enabled) {
        this.echoHeartbeats = enabled;
    }

    public List<Message> received() {
        return received;
    }

    public int acceptedConnections() {
        return accepted.get();
    }

    public boolean awaitReceived(MessageType type, int count, Duration timeout)
            throws InterruptedException {
        return ScriptedTransportFactory.eventually(
                () -> received.stream().filter(m -> m.type() == type).count() >= count, timeout);
    }

    /** Writes raw bytes to every connected client. */
    public void sendRaw(byte[] bytes) throws InterruptedException {
        clients.writeAndFlush(Unpooled.wrappedBuffer(bytes)).sync();
    }

    public void send(Message message) throws InterruptedException {
        sendRaw(codec.encodeFrame(message));
    }

    /** Drops every client connection while the listener keeps running. */
    public void dropClients() throws InterruptedException {
        clients.close().sync();
    }

    @Override
    public void close() throws InterruptedException {
        clients.close().sync();
        if (serverChannel != null) {
            serverChannel.close().sync();
        }
        bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
        workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
    }

    private final class FrameHandler extends SimpleChannelInboundHandler<ByteBuf> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
            Message message = codec.decodePayload(ByteBufUtil.getBytes(frame));
            received.add(message);
            switch (message.type()) {
                case CONNECT -> reply(ctx, Message.of(MessageType.CONNECT_ACK, resumptionToken));
                case HEARTBEAT -> {
                    if (echoHeartbeats) {
                        reply(ctx, message);
                    }
                }
                case DISCONNECT -> ctx.close();
                default -> reply(ctx, message);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            ctx.close();
        }

        private void reply(ChannelHandlerContext ctx, Message message) {
            ctx.writeAndFlush(Unpooled.wrappedBuffer(codec.encodeFrame(message)));
        }
    }
}
