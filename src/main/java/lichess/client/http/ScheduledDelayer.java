package lichess.client.http;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import lichess.client.RequestCancelledException;

/**
 * {@link Delayer} backed by a single scheduler thread. Waiting calls only occupy a slot in the scheduler's queue.
 */
public final class ScheduledDelayer implements Delayer {
    private static final ScheduledDelayer SHARED = new ScheduledDelayer(newScheduler());

    private final ScheduledThreadPoolExecutor scheduler;

    ScheduledDelayer(ScheduledThreadPoolExecutor scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * The process-wide delayer used by clients that don't supply their own.
     */
    public static Delayer shared() {
        return SHARED;
    }

    @Override
    public CompletableFuture<Void> delay(Duration duration, CancellationToken token) {
        if (token.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new RequestCancelledException("Request was cancelled"));
        }
        if (duration.isZero() || duration.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        ScheduledFuture<?> timer = scheduler.schedule(() -> result.complete(null), toNanos(duration),
                TimeUnit.NANOSECONDS);
        CancellationToken.Registration registration = token.register(() -> {
            timer.cancel(false);
            result.completeExceptionally(new RequestCancelledException("Request was cancelled while waiting to retry"));
        });
        result.whenComplete((ignored, failure) -> registration.close());
        return result;
    }

    private static long toNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    private static ScheduledThreadPoolExecutor newScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "lichess-client-delayer");
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
