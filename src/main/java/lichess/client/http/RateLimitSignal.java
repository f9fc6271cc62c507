package lichess.client.http;

import java.time.Duration;
import java.util.Objects;

/**
 * How long to wait after a 429 response.
 */
public final class RateLimitSignal {
    private final Duration waitDuration;
    private final boolean fromServer;

    RateLimitSignal(Duration waitDuration, boolean fromServer) {
        this.waitDuration = Objects.requireNonNull(waitDuration, "waitDuration");
        this.fromServer = fromServer;
    }

    public Duration getWaitDuration() {
        return waitDuration;
    }

    /**
     * False when the response had no usable Retry-After and the fallback wait was used.
     */
    public boolean isFromServer() {
        return fromServer;
    }

    @Override
    public String toString() {
        return "RateLimitSignal{wait=" + waitDuration + (fromServer ? "" : ", fallback") + "}";
    }
}
