package lichess.client.http;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lichess.client.ErrorMapper;
import lichess.client.RateLimitExceededException;
import lichess.client.RequestCancelledException;
import lichess.client.TransientNetworkException;

/**
 * Sends every Lichess request. Transient network failures are retried with exponential backoff and 429 responses
 * are retried after the server's Retry-After, both within the limits of the {@link ClientPolicy}.
 * <p>
 * Calls never block a thread: waits are scheduled on the {@link Delayer} and sends use the asynchronous HTTP client.
 * Attempts of one call run strictly one after another. Every wait and send observes the caller's
 * {@link CancellationToken}.
 */
public final class LichessTransport {
    private static final Logger LOG = LoggerFactory.getLogger(LichessTransport.class);

    static final int TOO_MANY_REQUESTS = 429;
    static final String DEFAULT_USER_AGENT = "lichess-client-java";

    private final ClientPolicy policy;
    private final HttpSender sender;
    private final Delayer delayer;
    private final TransientFaultClassifier classifier = new TransientFaultClassifier();
    private final RateLimitSignalExtractor rateLimitSignals;
    private final JsonCodec codec;
    private final ErrorMapper errorMapper;
    private final Supplier<String> accessToken;
    private final String userAgent;
    private final Clock clock;

    private LichessTransport(Builder builder) {
        this.policy = builder.policy;
        this.sender = builder.sender;
        this.delayer = builder.delayer;
        this.codec = builder.codec;
        this.accessToken = builder.accessToken;
        this.userAgent = builder.userAgent;
        this.clock = builder.clock;
        this.rateLimitSignals = new RateLimitSignalExtractor(policy.getRateLimitFallbackDelay(), clock);
        this.errorMapper = new ErrorMapper(codec, rateLimitSignals);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ClientPolicy getPolicy() {
        return policy;
    }

    public JsonCodec getCodec() {
        return codec;
    }

    public ErrorMapper getErrorMapper() {
        return errorMapper;
    }

    /**
     * Runs a request to completion and reads the whole body. Any status except 429 is returned as is.
     */
    public CompletableFuture<TransportResponse> execute(RequestDescriptor request, CancellationToken token) {
        AttemptContext context = new AttemptContext(clock.instant());
        return send(request, request.getAccept(), policy.getDefaultTimeout(), context, token)
                .thenCompose(response -> BodyReader.read(response.body(), token)
                        .thenApply(body -> toTransportResponse(response, body, context)));
    }

    /**
     * Opens an NDJSON stream. The returned cursor owns the connection and must be closed by the caller; an
     * unsuccessful status fails the future with the mapped {@link lichess.client.LichessServiceException}.
     */
    public <T> CompletableFuture<NdjsonCursor<T>> executeStreaming(RequestDescriptor request, Class<T> type,
            CancellationToken token) {
        AttemptContext context = new AttemptContext(clock.instant());
        return send(request, RequestDescriptor.MediaType.NDJSON, policy.getStreamingTimeout(), context, token)
                .thenCompose(response -> {
                    if (isSuccess(response.statusCode())) {
                        NdjsonCursor<T> cursor = new NdjsonCursor<>(type, codec, request.getUri(), token);
                        response.body().subscribe(cursor);
                        return CompletableFuture.completedFuture(cursor);
                    }
                    return BodyReader.read(response.body(), token)
                            .thenCompose(body -> CompletableFuture.<NdjsonCursor<T>>failedFuture(
                                    errorMapper.map(toTransportResponse(response, body, context))));
                });
    }

    private CompletableFuture<HttpResponse<Flow.Publisher<List<ByteBuffer>>>> send(RequestDescriptor request,
            RequestDescriptor.MediaType accept, Duration timeout, AttemptContext context, CancellationToken token) {
        if (token.isCancellationRequested()) {
            return CompletableFuture.failedFuture(cancelled(request));
        }
        HttpRequest httpRequest = toHttpRequest(request, accept, timeout);
        context.recordSend();
        LOG.debug("Sending {} (attempt {})", request, context.getSends());

        CompletableFuture<HttpResponse<Flow.Publisher<List<ByteBuffer>>>> inFlight = dispatch(httpRequest);
        CancellationToken.Registration registration = token.register(() -> inFlight.cancel(true));
        return inFlight
                .handle((response, failure) -> {
                    registration.close();
                    return decide(request, response, failure, context, token);
                })
                .thenCompose(outcome -> proceed(outcome, request, accept, timeout, context, token));
    }

    private CompletableFuture<HttpResponse<Flow.Publisher<List<ByteBuffer>>>> dispatch(HttpRequest httpRequest) {
        try {
            return sender.send(httpRequest);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<HttpResponse<Flow.Publisher<List<ByteBuffer>>>> proceed(
            SendOutcome<HttpResponse<Flow.Publisher<List<ByteBuffer>>>> outcome, RequestDescriptor request,
            RequestDescriptor.MediaType accept, Duration timeout, AttemptContext context, CancellationToken token) {
        switch (outcome.kind()) {
        case COMPLETED:
            return CompletableFuture.completedFuture(outcome.response());
        case RETRY:
            return delayer.delay(outcome.delay(), token)
                    .thenCompose(ignored -> send(request, accept, timeout, context, token));
        default:
            return CompletableFuture.failedFuture(outcome.failure());
        }
    }

    private SendOutcome<HttpResponse<Flow.Publisher<List<ByteBuffer>>>> decide(RequestDescriptor request,
            HttpResponse<Flow.Publisher<List<ByteBuffer>>> response, Throwable failure, AttemptContext context,
            CancellationToken token) {
        if (token.isCancellationRequested()) {
            if (response != null) {
                BodyReader.discard(response.body());
            }
            return SendOutcome.failed(cancelled(request));
        }
        if (failure != null) {
            return onFailure(request, TransientFaultClassifier.unwrap(failure), context);
        }
        if (response.statusCode() == TOO_MANY_REQUESTS) {
            return onRateLimited(request, response, context);
        }
        return SendOutcome.completed(response);
    }

    private <R> SendOutcome<R> onFailure(RequestDescriptor request, Throwable cause, AttemptContext context) {
        if (cause instanceof RequestCancelledException) {
            return SendOutcome.failed(cause);
        }
        if (cause instanceof CancellationException) {
            return SendOutcome.failed(cancelled(request));
        }
        if (classifier.classify(cause) == FaultKind.FATAL) {
            return SendOutcome.failed(cause);
        }

        boolean replayable = request.isReplayable() || classifier.isConnectFailure(cause);
        if (policy.isEnableTransientRetry() && replayable
                && context.getTransientAttempts() < policy.getMaxTransientRetries()) {
            int attempt = context.nextTransientAttempt();
            Duration delay = Backoff.delay(attempt, policy.getTransientRetryBaseDelay(),
                    policy.getTransientRetryMaxDelay());
            LOG.warn("Network failure on {}: {}. Retry {}/{} in {} ms", request, cause, attempt,
                    policy.getMaxTransientRetries(), delay.toMillis());
            return SendOutcome.retryAfter(delay);
        }
        return SendOutcome.failed(new TransientNetworkException(
                "Network failure on " + request + " after " + context.getSends() + " attempt(s) in "
                        + elapsedMillis(context) + " ms: " + cause.getMessage(),
                context.getSends(), cause));
    }

    private <R> SendOutcome<R> onRateLimited(RequestDescriptor request,
            HttpResponse<Flow.Publisher<List<ByteBuffer>>> response, AttemptContext context) {
        RateLimitSignal signal = rateLimitSignals.extract(response.headers());
        context.recordRateLimitWait(signal.getWaitDuration());
        BodyReader.discard(response.body());

        if (!policy.isAutoRetryOnRateLimit()) {
            return SendOutcome.failed(rateLimited(request, context, "automatic retry is disabled"));
        }
        if (!request.isReplayable()) {
            return SendOutcome.failed(rateLimited(request, context, request.getMethod() + " is not safe to resend"));
        }
        if (policy.isUnlimitedRateLimitRetries()
                || context.getRateLimitAttempts() < policy.getMaxRateLimitRetries()) {
            int attempt = context.nextRateLimitAttempt();
            LOG.warn("Rate limited on {}. Waiting {} ms before retry {}/{}", request,
                    signal.getWaitDuration().toMillis(), attempt,
                    policy.isUnlimitedRateLimitRetries() ? "unlimited" : policy.getMaxRateLimitRetries());
            return SendOutcome.retryAfter(signal.getWaitDuration());
        }
        return SendOutcome.failed(rateLimited(request, context,
                "gave up after " + context.getRateLimitAttempts() + " retries"));
    }

    private HttpRequest toHttpRequest(RequestDescriptor request, RequestDescriptor.MediaType accept, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.getUri())
                .header("Accept", accept.value())
                .header("User-Agent", userAgent);
        if (!ClientPolicy.isInfinite(timeout)) {
            builder.timeout(timeout);
        }
        String token = accessToken.get();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        request.getHeaders().forEach(builder::setHeader);
        if (request.hasBody()) {
            if (request.getContentType() != null) {
                builder.setHeader("Content-Type", request.getContentType());
            }
            builder.method(request.getMethod(), HttpRequest.BodyPublishers.ofByteArray(request.getBody()));
        } else {
            builder.method(request.getMethod(), HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    private static TransportResponse toTransportResponse(HttpResponse<?> response, String body, AttemptContext context) {
        return new TransportResponse(response.uri(), response.statusCode(), response.headers(), body,
                context.getTransientAttempts(), context.getRateLimitAttempts());
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private static RequestCancelledException cancelled(RequestDescriptor request) {
        return new RequestCancelledException("Request " + request + " was cancelled");
    }

    private RateLimitExceededException rateLimited(RequestDescriptor request, AttemptContext context, String reason) {
        Duration wait = context.getLastRateLimitWait();
        return new RateLimitExceededException("API rate limit exceeded on " + request + " (" + reason + ", "
                + elapsedMillis(context) + " ms spent); retry after " + wait.toMillis() + " ms", wait);
    }

    private long elapsedMillis(AttemptContext context) {
        return Duration.between(context.getStartedAt(), clock.instant()).toMillis();
    }

    public static final class Builder {
        private ClientPolicy policy = ClientPolicy.defaults();
        private HttpSender sender;
        private Delayer delayer = ScheduledDelayer.shared();
        private JsonCodec codec = JsonCodec.lenient();
        private Supplier<String> accessToken = () -> null;
        private String userAgent = DEFAULT_USER_AGENT;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder policy(ClientPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            return sender(HttpSender.of(Objects.requireNonNull(httpClient, "httpClient")));
        }

        public Builder sender(HttpSender sender) {
            this.sender = Objects.requireNonNull(sender, "sender");
            return this;
        }

        public Builder delayer(Delayer delayer) {
            this.delayer = Objects.requireNonNull(delayer, "delayer");
            return this;
        }

        public Builder codec(JsonCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        /**
         * A fixed personal access token, or null for anonymous calls.
         */
        public Builder accessToken(String accessToken) {
            return accessToken(() -> accessToken);
        }

        /**
         * Asked for the current token before every send, so tokens can be rotated without rebuilding the client.
         */
        public Builder accessToken(Supplier<String> accessToken) {
            this.accessToken = Objects.requireNonNull(accessToken, "accessToken");
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public LichessTransport build() {
            if (sender == null) {
                sender = HttpSender.of(HttpClient.newBuilder()
                        .connectTimeout(policy.getDefaultTimeout())
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build());
            }
            return new LichessTransport(this);
        }
    }
}
