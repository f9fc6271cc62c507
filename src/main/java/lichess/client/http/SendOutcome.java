package lichess.client.http;

import java.time.Duration;

/**
 * What the retry loop does after one send: hand the response back, wait and send again, or fail the call.
 */
final class SendOutcome<R> {

    enum Kind {
        COMPLETED,
        RETRY,
        FAILED
    }

    private final Kind kind;
    private final R response;
    private final Duration delay;
    private final Throwable failure;

    private SendOutcome(Kind kind, R response, Duration delay, Throwable failure) {
        this.kind = kind;
        this.response = response;
        this.delay = delay;
        this.failure = failure;
    }

    static <R> SendOutcome<R> completed(R response) {
        return new SendOutcome<>(Kind.COMPLETED, response, null, null);
    }

    static <R> SendOutcome<R> retryAfter(Duration delay) {
        return new SendOutcome<>(Kind.RETRY, null, delay, null);
    }

    static <R> SendOutcome<R> failed(Throwable failure) {
        return new SendOutcome<>(Kind.FAILED, null, null, failure);
    }

    Kind kind() {
        return kind;
    }

    R response() {
        return response;
    }

    Duration delay() {
        return delay;
    }

    Throwable failure() {
        return failure;
    }
}
