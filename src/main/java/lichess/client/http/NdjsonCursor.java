package lichess.client.http;

import java.net.URI;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Flow;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lichess.client.JsonDecodingException;
import lichess.client.RequestCancelledException;

/**
 * A forward-only cursor over a newline-delimited JSON response. Each non-blank line is one record; blank lines are
 * keep-alive heartbeats and are skipped.
 * <p>
 * The cursor owns the HTTP connection. Bytes are only pulled from the network when {@link #next()} is waiting for a
 * record, and {@link #close()} releases the connection. Close it on every exit path, typically with
 * try-with-resources; reaching the end of the stream or cancelling the token closes it too.
 * <p>
 * Lines that are not valid JSON for the record type are logged and skipped.
 */
public final class NdjsonCursor<T> implements Flow.Subscriber<List<ByteBuffer>>, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(NdjsonCursor.class);
    private static final int MAX_LOGGED_LINE = 200;

    private final Class<T> type;
    private final JsonCodec codec;
    private final URI source;
    private final Object lock = new Object();
    private final LineSplitter splitter = new LineSplitter();
    private final Deque<String> lines = new ArrayDeque<>();
    private final CancellationToken.Registration cancellation;

    private Flow.Subscription subscription;
    private CompletableFuture<Optional<T>> waiter;
    private boolean demanded;
    private boolean upstreamComplete;
    private Throwable failure;
    private boolean closed;
    private long delivered;
    private long skipped;

    NdjsonCursor(Class<T> type, JsonCodec codec, URI source, CancellationToken token) {
        this.type = type;
        this.codec = codec;
        this.source = source;
        this.cancellation = token.register(this::cancel);
    }

    /**
     * Returns the next record, or an empty optional once the stream has ended or the cursor was closed. The future
     * fails with {@link RequestCancelledException} if the token fires while waiting.
     *
     * @throws IllegalStateException if the previous {@code next()} has not completed yet
     */
    public CompletableFuture<Optional<T>> next() {
        CompletableFuture<Optional<T>> result;
        Flow.Subscription toRequest = null;
        synchronized (lock) {
            if (waiter != null) {
                throw new IllegalStateException("next() called before the previous record arrived");
            }
            if (failure != null) {
                return CompletableFuture.failedFuture(failure);
            }
            if (closed) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            T ready = pollRecord();
            if (ready != null) {
                return CompletableFuture.completedFuture(Optional.of(ready));
            }
            if (upstreamComplete) {
                markClosed();
                return CompletableFuture.completedFuture(Optional.empty());
            }
            result = new CompletableFuture<>();
            waiter = result;
            if (!demanded && subscription != null) {
                demanded = true;
                toRequest = subscription;
            }
        }
        if (toRequest != null) {
            toRequest.request(1);
        }
        return result;
    }

    /**
     * Blocks until the stream ends, handing each record to the action, and closes the cursor whatever happens.
     */
    public void forEachRemaining(Consumer<? super T> action) {
        try {
            Optional<T> record;
            while ((record = await(next())).isPresent()) {
                action.accept(record.get());
            }
        } finally {
            close();
        }
    }

    /**
     * A blocking, sequential view of the remaining records. Closing the stream closes the cursor.
     */
    public Stream<T> stream() {
        Spliterator<T> spliterator = new Spliterators.AbstractSpliterator<T>(Long.MAX_VALUE,
                Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super T> action) {
                Optional<T> record = await(next());
                record.ifPresent(action);
                return record.isPresent();
            }
        };
        return StreamSupport.stream(spliterator, false).onClose(this::close);
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /** Records handed out so far. */
    public long getDeliveredCount() {
        synchronized (lock) {
            return delivered;
        }
    }

    /** Lines dropped because they could not be decoded. */
    public long getSkippedCount() {
        synchronized (lock) {
            return skipped;
        }
    }

    /**
     * Stops reading and releases the connection. Safe to call more than once; a pending {@link #next()} completes
     * empty.
     */
    @Override
    public void close() {
        Flow.Subscription toCancel;
        CompletableFuture<Optional<T>> pending;
        synchronized (lock) {
            if (closed) {
                return;
            }
            toCancel = upstreamComplete ? null : subscription;
            pending = waiter;
            waiter = null;
            markClosed();
        }
        if (toCancel != null) {
            toCancel.cancel();
        }
        if (pending != null) {
            pending.complete(Optional.empty());
        }
        LOG.debug("Closed stream {} after {} records", source, delivered);
    }

    @Override
    public void onSubscribe(Flow.Subscription s) {
        boolean cancelNow;
        boolean requestNow = false;
        synchronized (lock) {
            if (subscription != null) {
                cancelNow = true;
            } else {
                subscription = s;
                cancelNow = closed;
                if (!closed && waiter != null && !demanded) {
                    demanded = true;
                    requestNow = true;
                }
            }
        }
        if (cancelNow) {
            s.cancel();
        } else if (requestNow) {
            s.request(1);
        }
    }

    @Override
    public void onNext(List<ByteBuffer> items) {
        CompletableFuture<Optional<T>> toComplete = null;
        T value = null;
        Flow.Subscription toRequest = null;
        synchronized (lock) {
            demanded = false;
            if (closed) {
                return;
            }
            for (ByteBuffer buffer : items) {
                splitter.feed(buffer, lines::add);
            }
            if (waiter != null) {
                value = pollRecord();
                if (value != null) {
                    toComplete = waiter;
                    waiter = null;
                } else {
                    demanded = true;
                    toRequest = subscription;
                }
            }
        }
        if (toComplete != null) {
            toComplete.complete(Optional.of(value));
        } else if (toRequest != null) {
            toRequest.request(1);
        }
    }

    @Override
    public void onError(Throwable throwable) {
        CompletableFuture<Optional<T>> toFail;
        synchronized (lock) {
            if (closed) {
                return;
            }
            failure = throwable;
            toFail = waiter;
            waiter = null;
            markClosed();
        }
        LOG.debug("Stream {} failed after {} records", source, delivered, throwable);
        if (toFail != null) {
            toFail.completeExceptionally(throwable);
        }
    }

    @Override
    public void onComplete() {
        CompletableFuture<Optional<T>> toComplete = null;
        T value = null;
        synchronized (lock) {
            if (closed) {
                return;
            }
            upstreamComplete = true;
            String last = splitter.finish();
            if (last != null) {
                lines.add(last);
            }
            if (waiter != null) {
                value = pollRecord();
                toComplete = waiter;
                waiter = null;
                if (value == null) {
                    markClosed();
                }
            }
        }
        if (toComplete != null) {
            toComplete.complete(Optional.ofNullable(value));
        }
    }

    private void cancel() {
        Flow.Subscription toCancel;
        CompletableFuture<Optional<T>> pending;
        RequestCancelledException cancelled = new RequestCancelledException("Stream " + source + " was cancelled");
        synchronized (lock) {
            if (closed) {
                return;
            }
            failure = cancelled;
            toCancel = upstreamComplete ? null : subscription;
            pending = waiter;
            waiter = null;
            markClosed();
        }
        if (toCancel != null) {
            toCancel.cancel();
        }
        if (pending != null) {
            pending.completeExceptionally(cancelled);
        }
    }

    // Caller holds the lock.
    private void markClosed() {
        closed = true;
        lines.clear();
        if (cancellation != null) {
            cancellation.close();
        }
    }

    // Caller holds the lock.
    private T pollRecord() {
        String line;
        while ((line = lines.poll()) != null) {
            if (line.isBlank()) {
                continue;
            }
            try {
                T value = codec.decode(line, type);
                if (value != null) {
                    delivered++;
                    return value;
                }
            } catch (JsonDecodingException e) {
                skipped++;
                LOG.warn("Skipping undecodable line from {}: {}", source, abbreviate(line), e);
            }
        }
        return null;
    }

    private static String abbreviate(String line) {
        return line.length() > MAX_LOGGED_LINE ? line.substring(0, MAX_LOGGED_LINE) + "..." : line;
    }

    private static <V> V await(CompletableFuture<V> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw e;
        }
    }
}
