package lichess.client.http;

import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

import lichess.client.RequestCancelledException;

/**
 * Reads a whole response body into a string, stopping and releasing the connection if the token fires first.
 */
final class BodyReader implements Flow.Subscriber<List<ByteBuffer>> {
    private final HttpResponse.BodySubscriber<String> delegate = HttpResponse.BodySubscribers.ofString(StandardCharsets.UTF_8);
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private final Object lock = new Object();
    private Flow.Subscription subscription;
    private boolean cancelled;

    private BodyReader() {
    }

    static CompletableFuture<String> read(Flow.Publisher<List<ByteBuffer>> body, CancellationToken token) {
        BodyReader reader = new BodyReader();
        CancellationToken.Registration registration = token.register(reader::cancel);
        reader.result.whenComplete((ignored, failure) -> registration.close());
        body.subscribe(reader);
        return reader.result;
    }

    /**
     * Consumes and drops the body so the connection can go back to the pool.
     */
    static void discard(Flow.Publisher<List<ByteBuffer>> body) {
        body.subscribe(HttpResponse.BodySubscribers.discarding());
    }

    @Override
    public void onSubscribe(Flow.Subscription s) {
        boolean cancelNow;
        synchronized (lock) {
            subscription = s;
            cancelNow = cancelled;
        }
        if (cancelNow) {
            s.cancel();
            return;
        }
        delegate.onSubscribe(s);
        delegate.getBody().whenComplete((body, failure) -> {
            if (failure != null) {
                result.completeExceptionally(failure);
            } else {
                result.complete(body);
            }
        });
    }

    @Override
    public void onNext(List<ByteBuffer> item) {
        delegate.onNext(item);
    }

    @Override
    public void onError(Throwable throwable) {
        delegate.onError(throwable);
    }

    @Override
    public void onComplete() {
        delegate.onComplete();
    }

    private void cancel() {
        Flow.Subscription toCancel;
        synchronized (lock) {
            cancelled = true;
            toCancel = subscription;
        }
        if (toCancel != null) {
            toCancel.cancel();
        }
        result.completeExceptionally(new RequestCancelledException("Request was cancelled while reading the response"));
    }
}
