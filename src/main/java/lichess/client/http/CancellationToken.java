package lichess.client.http;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lichess.client.RequestCancelledException;

/**
 * A cooperative cancellation signal passed from the caller down to every point where a call can wait: the network
 * send, the retry delays and the stream reads.
 * <p>
 * A token is created by the caller, handed to any number of calls and fired at most once with {@link #cancel()}.
 */
public final class CancellationToken {
    private static final Logger LOG = LoggerFactory.getLogger(CancellationToken.class);

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken(false);

    private static final Registration NO_REGISTRATION = () -> { };

    private final boolean cancellable;
    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Fires the token. Registered callbacks run on the calling thread.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LOG.warn("Cancellation callback failed", e);
            }
        }
        return true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new RequestCancelledException("Request was cancelled");
        }
    }

    /**
     * Registers an action to run when the token fires. If it has already fired the action runs immediately.
     * Closing the returned registration removes the action.
     */
    public Registration register(Runnable action) {
        if (!cancellable) {
            return NO_REGISTRATION;
        }
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(action);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(action);
                    }
                };
            }
        }
        action.run();
        return NO_REGISTRATION;
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
