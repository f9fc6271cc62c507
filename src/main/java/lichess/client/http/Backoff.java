package lichess.client.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff for transient network failures: {@code min(base * 2^(attempt-1), max)}.
 * <p>
 * Rate-limit waits do not go through here; they use the server's Retry-After verbatim.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * @param attempt 1 for the first retry, 2 for the second, ...
     */
    public static Duration delay(int attempt, Duration base, Duration max) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(max, "max");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, was " + attempt);
        }
        if (attempt > 62) {
            return max;
        }
        Duration delay;
        try {
            delay = base.multipliedBy(1L << (attempt - 1));
        } catch (ArithmeticException overflow) {
            return max;
        }
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
