package lichess.client;

import java.time.Duration;

/**
 * Thrown when Lichess answers 429 and the client will not (or may no longer) retry.
 */
public class RateLimitExceededException extends LichessServiceException {
    private static final long serialVersionUID = 1L;

    private final Duration retryAfter;

    public RateLimitExceededException(String message, Duration retryAfter) {
        super(message, 429, null);
        this.retryAfter = retryAfter;
    }

    /**
     * How long the server asked us to wait, or the fallback wait when it didn't say.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
