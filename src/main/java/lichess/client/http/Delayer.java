package lichess.client.http;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Schedules the waits between attempts without holding a thread.
 */
@FunctionalInterface
public interface Delayer {

    /**
     * Returns a future that completes after the given duration, or fails with
     * {@link lichess.client.RequestCancelledException} as soon as the token fires.
     */
    CompletableFuture<Void> delay(Duration duration, CancellationToken token);
}
