/**
 * Resilient client connections with retries, liveness probing and automatic reconnection.
 *
 * <p>This package holds the client facade, its configuration and the values it reports back to
 * the application.
 *
 * <h2>Key Types</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.tenacity.client.ConnectionClient} - Connects, sends, receives, reconnects
 *   <li>{@link express.mvp.tenacity.client.ConnectionConfig} - Immutable client settings
 *   <li>{@link express.mvp.tenacity.client.ConnectionConfigLoader} - JSON configuration files
 *   <li>{@link express.mvp.tenacity.client.ClientMetrics} - Counter snapshot
 *   <li>{@link express.mvp.tenacity.client.ResumptionTokenStore} - Session resumption hook
 * </ul>
 *
 * @see express.mvp.tenacity.client.transport.FramedStreamTransport
 * @see express.mvp.tenacity.client.transport.RpcTransport
 */
package express.mvp.tenacity.client;
