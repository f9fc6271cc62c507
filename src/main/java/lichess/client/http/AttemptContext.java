package lichess.client.http;

import java.time.Duration;
import java.time.Instant;

/**
 * Retry bookkeeping for a single call. Each call gets its own instance; counters only go up.
 */
public final class AttemptContext {
    private final Instant startedAt;
    private int sends;
    private int transientAttempts;
    private int rateLimitAttempts;
    private Duration lastRateLimitWait;

    AttemptContext(Instant startedAt) {
        this.startedAt = startedAt;
    }

    void recordSend() {
        sends++;
    }

    int nextTransientAttempt() {
        return ++transientAttempts;
    }

    int nextRateLimitAttempt() {
        return ++rateLimitAttempts;
    }

    void recordRateLimitWait(Duration wait) {
        this.lastRateLimitWait = wait;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /** Network sends made so far, the first one included. */
    public int getSends() {
        return sends;
    }

    public int getTransientAttempts() {
        return transientAttempts;
    }

    public int getRateLimitAttempts() {
        return rateLimitAttempts;
    }

    /** The wait announced by the most recent 429, or null if there was none. */
    public Duration getLastRateLimitWait() {
        return lastRateLimitWait;
    }

    @Override
    public String toString() {
        return "AttemptContext{sends=" + sends + ", transientAttempts=" + transientAttempts
                + ", rateLimitAttempts=" + rateLimitAttempts + "}";
    }
}
