package lichess.client;

/**
 * Thrown when a network failure that is normally worth retrying (DNS, refused connection, timeout) persisted
 * beyond the configured number of retries, or could not be retried at all.
 */
public class TransientNetworkException extends LichessServiceException {
    private static final long serialVersionUID = 1L;

    private final int attempts;

    public TransientNetworkException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * Number of network sends made before giving up.
     */
    public int getAttempts() {
        return attempts;
    }
}
