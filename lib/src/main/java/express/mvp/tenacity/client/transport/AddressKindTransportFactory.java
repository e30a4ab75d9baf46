package express.mvp.tenacity.client.transport;

import express.mvp.tenacity.client.ServerAddress;
import express.mvp.tenacity.client.codec.MessageCodec;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/** Picks the transport from the address kind and shares one HTTP client across RPC transports. */
final class AddressKindTransportFactory implements TransportFactory {

    private final Duration connectTimeout;
    private final int rpcInboundCapacity;
    private volatile HttpClient httpClient;

    AddressKindTransportFactory(Duration connectTimeout, int rpcInboundCapacity) {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (rpcInboundCapacity < 1) {
            throw new IllegalArgumentException(
                    "rpcInboundCapacity must be >= 1: " + rpcInboundCapacity);
        }
        this.rpcInboundCapacity = rpcInboundCapacity;
    }

    @Override
    public ClientTransport create(ServerAddress address, MessageCodec codec) {
        return switch (address.kind()) {
            case FRAMED_STREAM -> new FramedStreamTransport(address, codec);
            case RPC -> new RpcTransport(address, codec, sharedHttpClient(), rpcInboundCapacity);
        };
    }

    HttpClient sharedHttpClient() {
        HttpClient client = httpClient;
        if (client == null) {
            synchronized (this) {
                client = httpClient;
                if (client == null) {
                    client = RpcTransport.newHttpClient(connectTimeout);
                    httpClient = client;
                }
            }
        }
        return client;
    }
}
