/**
 * Connection lifecycle: the state machine, liveness probing and automatic reconnection.
 *
 * <p>{@link express.mvp.tenacity.client.lifecycle.HealthMonitor} and
 * {@link express.mvp.tenacity.client.lifecycle.ReconnectSupervisor} work against the narrow
 * {@link express.mvp.tenacity.client.lifecycle.SupervisedConnection} interface, so they can be
 * tested without a network.
 */
package express.mvp.tenacity.client.lifecycle;
