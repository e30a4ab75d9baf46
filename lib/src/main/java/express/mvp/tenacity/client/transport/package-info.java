/**
 * Transports behind the connection client: length-prefixed frames over TCP and unary calls over
 * HTTP. Both implement {@link express.mvp.tenacity.client.transport.ClientTransport}.
 */
package express.mvp.tenacity.client.transport;
