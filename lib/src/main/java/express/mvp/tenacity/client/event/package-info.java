/** Connection lifecycle events and their subscription handles. */
package express.mvp.tenacity.client.event;
