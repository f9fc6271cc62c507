package lichess.client.http;

/**
 * Verdict of the {@link TransientFaultClassifier}.
 */
public enum FaultKind {
    /** A temporary network condition; the call may be retried. */
    TRANSIENT,
    /** Anything else; the failure propagates on first occurrence. */
    FATAL
}
