package express.mvp.tenacity.client;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * Parsed server address. The scheme selects the transport.
 *
 * <ul>
 *   <li>{@code tcp://host:port} or {@code host:port}: framed stream over TCP
 *   <li>{@code http://host[:port][/base]} or {@code https://...}: RPC over HTTP
 * </ul>
 */
public final class ServerAddress {

    /** Transport selected by an address. */
    public enum Kind {
        FRAMED_STREAM,
        RPC
    }

    private final String raw;
    private final Kind kind;
    private final String host;
    private final int port;
    private final URI baseUri;

    private ServerAddress(String raw, Kind kind, String host, int port, URI baseUri) {
        this.raw = raw;
        this.kind = kind;
        this.host = host;
        this.port = port;
        this.baseUri = baseUri;
    }

    /**
     * Parses an address.
     *
     * @param address the address text
     * @return the parsed address
     * @throws ConfigurationException if the address is blank, malformed or uses an unknown scheme
     */
    public static ServerAddress parse(String address) {
        if (address == null || address.isBlank()) {
            throw new ConfigurationException("Server address must not be empty");
        }
        String trimmed = address.trim();
        String candidate = trimmed.contains("://") ? trimmed : "tcp://" + trimmed;
        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Malformed server address: " + address, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new ConfigurationException("Server address has no host: " + address);
        }
        return switch (scheme) {
            case "tcp" -> {
                if (uri.getPort() == -1) {
                    throw new ConfigurationException("TCP server address needs a port: " + address);
                }
                yield new ServerAddress(trimmed, Kind.FRAMED_STREAM, host, checkPort(uri.getPort(), address), null);
            }
            case "http", "https" -> {
                int port = uri.getPort() != -1
                        ? checkPort(uri.getPort(), address)
                        : ("https".equals(scheme) ? 443 : 80);
                String path = uri.getRawPath() == null ? "" : uri.getRawPath();
                while (path.endsWith("/")) {
                    path = path.substring(0, path.length() - 1);
                }
                URI base = URI.create(scheme + "://" + uri.getRawAuthority() + path);
                yield new ServerAddress(trimmed, Kind.RPC, host, port, base);
            }
            default -> throw new ConfigurationException(
                    "Unsupported scheme '" + scheme + "' in server address: " + address);
        };
    }

    private static int checkPort(int port, String address) {
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Port out of range in server address: " + address);
        }
        return port;
    }

    public Kind kind() {
        return kind;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    /**
     * Returns the base URI for RPC calls.
     *
     * @return the base URI without trailing slash
     * @throws IllegalStateException for a framed-stream address
     */
    public URI baseUri() {
        if (baseUri == null) {
            throw new IllegalStateException("Not an RPC address: " + raw);
        }
        return baseUri;
    }

    /**
     * Resolves a path against the RPC base URI.
     *
     * @param path path starting with '/'
     * @return the endpoint URI
     */
    public URI endpoint(String path) {
        return URI.create(baseUri() + path);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ServerAddress other && raw.equals(other.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(raw);
    }

    @Override
    public String toString() {
        return raw;
    }
}
