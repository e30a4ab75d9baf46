package express.mvp.tenacity.client.scope;

/** Lifetime a tracked operation is bound to. */
public enum OperationScope {

    /** Lives until the scope manager shuts down. */
    APPLICATION,

    /** Cancelled whenever the session is cancelled or reset. */
    SESSION
}
