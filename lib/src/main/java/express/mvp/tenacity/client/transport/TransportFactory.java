package express.mvp.tenacity.client.transport;

import express.mvp.tenacity.client.ServerAddress;
import express.mvp.tenacity.client.codec.MessageCodec;
import java.time.Duration;

/**
 * Creates a fresh transport for each connection attempt.
 */
@FunctionalInterface
public interface TransportFactory {

    /**
     * Creates an unopened transport.
     *
     * @param address the server address
     * @param codec the codec for the connection's frames
     * @return a new transport
     */
    ClientTransport create(ServerAddress address, MessageCodec codec);

    /**
     * Returns the factory that picks the transport by address kind, with default RPC settings.
     *
     * @return framed stream for {@code tcp://}, RPC for {@code http(s)://}
     */
    static TransportFactory byAddressKind() {
        return byAddressKind(Duration.ofSeconds(10), RpcTransport.DEFAULT_INBOUND_CAPACITY);
    }

    /**
     * Returns the factory that picks the transport by address kind. RPC transports from the
     * returned factory share one HTTP client, built on first use.
     *
     * @param connectTimeout TCP connect timeout of the shared HTTP client
     * @param rpcInboundCapacity maximum unread responses per RPC transport
     * @return framed stream for {@code tcp://}, RPC for {@code http(s)://}
     */
    static TransportFactory byAddressKind(Duration connectTimeout, int rpcInboundCapacity) {
        return new AddressKindTransportFactory(connectTimeout, rpcInboundCapacity);
    }
}
