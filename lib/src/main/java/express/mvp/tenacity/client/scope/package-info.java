/**
 * Cooperative cancellation and tracked background operations.
 *
 * <p>{@link express.mvp.tenacity.client.scope.CancellationScopeManager} owns an application
 * scope and a replaceable session scope. Operations run through it are registered while they
 * run and end with an {@link express.mvp.tenacity.client.scope.OperationOutcome} whose status is
 * completed, cancelled or failed.
 */
package express.mvp.tenacity.client.scope;
