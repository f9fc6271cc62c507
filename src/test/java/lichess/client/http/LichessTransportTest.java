package lichess.client.http;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import lichess.client.AuthenticationException;
import lichess.client.RateLimitExceededException;
import lichess.client.RequestCancelledException;
import lichess.client.TransientNetworkException;

class LichessTransportTest {
    private static final URI ACCOUNT = URI.create("https://lichess.org/api/account");
    private static final URI EVENTS = URI.create("https://lichess.org/api/stream/event");
    private static final RequestDescriptor GET_ACCOUNT = RequestDescriptor.get(ACCOUNT).build();
    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private final ScriptedSender sender = new ScriptedSender();
    private final RecordingDelayer delayer = new RecordingDelayer();

    public static class Item {
        public int n;
    }

    @Test
    void successfulResponseIsReturnedAsIs() {
        sender.respond(200, "{\"id\":\"bobby\"}");

        TransportResponse response = transport(ClientPolicy.defaults()).execute(GET_ACCOUNT, CancellationToken.NONE)
                .join();

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getBody()).isEqualTo("{\"id\":\"bobby\"}");
        assertThat(response.getTransientRetries()).isZero();
        assertThat(sender.sends()).isEqualTo(1);
        assertThat(delayer.delays()).isEmpty();

        HttpRequest sent = sender.requests().get(0);
        assertThat(sent.headers().firstValue("Authorization")).hasValue("Bearer lip_test");
        assertThat(sent.headers().firstValue("Accept")).hasValue("application/json");
        assertThat(sent.headers().firstValue("User-Agent")).hasValue("lichess-client-java");
        assertThat(sent.timeout()).hasValue(Duration.ofSeconds(30));
    }

    @Test
    void errorStatusesOtherThan429AreNotRetried() {
        sender.respond(500, "oops");

        TransportResponse response = transport(ClientPolicy.defaults()).execute(GET_ACCOUNT, CancellationToken.NONE)
                .join();

        assertThat(response.getStatusCode()).isEqualTo(500);
        assertThat(response.isSuccessful()).isFalse();
        assertThat(sender.sends()).isEqualTo(1);
    }

    @Test
    void transientFailuresAreRetriedWithBackoff() {
        sender.failTimes(2, new ConnectException("Connection refused")).respond(200, "{}");

        TransportResponse response = transport(ClientPolicy.defaults()).execute(GET_ACCOUNT, CancellationToken.NONE)
                .join();

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getTransientRetries()).isEqualTo(2);
        assertThat(sender.sends()).isEqualTo(3);
        assertThat(delayer.delays()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void givesUpAfterMaxTransientRetries() {
        sender.fail(new HttpTimeoutException("request timed out"));

        Throwable failure = failureOf(transport(ClientPolicy.defaults()).execute(GET_ACCOUNT, CancellationToken.NONE));

        assertThat(failure).isInstanceOf(TransientNetworkException.class)
                .hasCauseInstanceOf(HttpTimeoutException.class)
                .hasMessageContaining("after 4 attempt(s) in 0 ms");
        assertThat(((TransientNetworkException) failure).getAttempts()).isEqualTo(4);
        assertThat(sender.sends()).isEqualTo(4);
        assertThat(delayer.delays())
                .containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void transientRetryCanBeDisabled() {
        sender.fail(new ConnectException("Connection refused"));
        ClientPolicy policy = ClientPolicy.builder().enableTransientRetry(false).build();

        Throwable failure = failureOf(transport(policy).execute(GET_ACCOUNT, CancellationToken.NONE));

        assertThat(failure).isInstanceOf(TransientNetworkException.class);
        assertThat(((TransientNetworkException) failure).getAttempts()).isEqualTo(1);
        assertThat(sender.sends()).isEqualTo(1);
    }

    @Test
    void fatalFailuresPropagateUnchanged() {
        IOException protocolError = new IOException("malformed response");
        sender.fail(protocolError);

        Throwable failure = failureOf(transport(ClientPolicy.defaults()).execute(GET_ACCOUNT, CancellationToken.NONE));

        assertThat(failure).isSameAs(protocolError);
        assertThat(sender.sends()).isEqualTo(1);
    }

    @Test
    void requestWithBodyIsOnlyRetriedWhenItNeverLeft() {
        RequestDescriptor post = RequestDescriptor.post(ACCOUNT).form(Map.of("text", "hi")).build();

        sender.fail(new HttpTimeoutException("request timed out"));
        assertThat(failureOf(transport(ClientPolicy.defaults()).execute(post, CancellationToken.NONE)))
                .isInstanceOf(TransientNetworkException.class);
        assertThat(sender.sends()).isEqualTo(1);

        ScriptedSender connectFailures = new ScriptedSender()
                .fail(new ConnectException("Connection refused"))
                .respond(200, "{\"ok\":true}");
        TransportResponse response = LichessTransport.builder().sender(connectFailures).delayer(delayer).build()
                .execute(post, CancellationToken.NONE).join();
        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(connectFailures.sends()).isEqualTo(2);
    }

    @Test
    void rateLimitWaitsForRetryAfter() {
        sender.rateLimited("2").respond(200, "{}");

        TransportResponse response = transport(ClientPolicy.defaults()).execute(GET_ACCOUNT, CancellationToken.NONE)
                .join();

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getRateLimitRetries()).isEqualTo(1);
        assertThat(delayer.delays()).containsExactly(Duration.ofSeconds(2));
        assertThat(sender.bodies().get(0).subscriptions()).isEqualTo(1);
    }

    @Test
    void rateLimitWithoutRetryAfterWaitsTheFallback() {
        sender.rateLimited(null).respond(200, "{}");

        transport(ClientPolicy.defaults()).execute(GET_ACCOUNT, CancellationToken.NONE).join();

        assertThat(delayer.delays()).containsExactly(Duration.ofSeconds(60));
    }

    @Test
    void rateLimitGivesUpAfterMaxRetries() {
        sender.rateLimited("1");
        ClientPolicy policy = ClientPolicy.builder().maxRateLimitRetries(2).build();

        Throwable failure = failureOf(transport(policy).execute(GET_ACCOUNT, CancellationToken.NONE));

        assertThat(failure).isInstanceOf(RateLimitExceededException.class).hasMessageContaining("gave up");
        assertThat(((RateLimitExceededException) failure).getRetryAfter()).isEqualTo(Duration.ofSeconds(1));
        assertThat(((RateLimitExceededException) failure).getStatusCode()).hasValue(429);
        assertThat(sender.sends()).isEqualTo(3);
    }

    @Test
    void unlimitedRateLimitRetriesIgnoreTheCap() {
        for (int i = 0; i < 10; i++) {
            sender.rateLimited("1");
        }
        sender.respond(200, "{}");
        ClientPolicy policy = ClientPolicy.builder().maxRateLimitRetries(0).unlimitedRateLimitRetries(true).build();

        TransportResponse response = transport(policy).execute(GET_ACCOUNT, CancellationToken.NONE).join();

        assertThat(response.getRateLimitRetries()).isEqualTo(10);
        assertThat(sender.sends()).isEqualTo(11);
    }

    @Test
    void rateLimitFailsAtOnceWhenAutoRetryIsOff() {
        sender.rateLimited("42");
        ClientPolicy policy = ClientPolicy.builder().autoRetryOnRateLimit(false).build();

        Throwable failure = failureOf(transport(policy).execute(GET_ACCOUNT, CancellationToken.NONE));

        assertThat(failure).isInstanceOf(RateLimitExceededException.class);
        assertThat(((RateLimitExceededException) failure).getRetryAfter()).isEqualTo(Duration.ofSeconds(42));
        assertThat(sender.sends()).isEqualTo(1);
        assertThat(delayer.delays()).isEmpty();
    }

    @Test
    void rateLimitedRequestWithBodyIsNotResent() {
        sender.rateLimited("1");
        RequestDescriptor post = RequestDescriptor.post(ACCOUNT).text("e2e4").build();

        assertThat(failureOf(transport(ClientPolicy.defaults()).execute(post, CancellationToken.NONE)))
                .isInstanceOf(RateLimitExceededException.class);
        assertThat(sender.sends()).isEqualTo(1);
    }

    @Test
    void rateLimitedBodylessPostIsNotResent() {
        sender.rateLimited("1").respond(200, "{\"ok\":true}");
        RequestDescriptor move = RequestDescriptor.post(URI.create("https://lichess.org/api/bot/game/abc/move/e2e4"))
                .build();

        Throwable failure = failureOf(transport(ClientPolicy.defaults()).execute(move, CancellationToken.NONE));

        assertThat(failure).isInstanceOf(RateLimitExceededException.class).hasMessageContaining("POST");
        assertThat(((RateLimitExceededException) failure).getRetryAfter()).isEqualTo(Duration.ofSeconds(1));
        assertThat(sender.sends()).isEqualTo(1);
        assertThat(delayer.delays()).isEmpty();
    }

    @Test
    void bodylessPostIsNotResentAfterAReadTimeout() {
        sender.fail(new HttpTimeoutException("request timed out")).respond(200, "{\"ok\":true}");
        RequestDescriptor resign = RequestDescriptor.post(URI.create("https://lichess.org/api/bot/game/abc/resign"))
                .build();

        assertThat(failureOf(transport(ClientPolicy.defaults()).execute(resign, CancellationToken.NONE)))
                .isInstanceOf(TransientNetworkException.class);
        assertThat(sender.sends()).isEqualTo(1);
    }

    @Test
    void giveUpReportsTheLastAnnouncedWaitAndTimeSpent() {
        sender.rateLimited("1").rateLimited("2").rateLimited("5");
        ClientPolicy policy = ClientPolicy.builder().maxRateLimitRetries(2).build();

        Throwable failure = failureOf(transport(policy).execute(GET_ACCOUNT, CancellationToken.NONE));

        assertThat(((RateLimitExceededException) failure).getRetryAfter()).isEqualTo(Duration.ofSeconds(5));
        assertThat(failure).hasMessageContaining("0 ms spent").hasMessageContaining("retry after 5000 ms");
        assertThat(delayer.delays()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void overlongRetryAfterIsWaitedNotRejected() {
        sender.rateLimited("10000000000").respond(200, "{}");

        TransportResponse response = transport(ClientPolicy.defaults()).execute(GET_ACCOUNT, CancellationToken.NONE)
                .join();

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(delayer.delays()).containsExactly(RateLimitSignalExtractor.MAX_WAIT);
    }

    @Test
    void transientAndRateLimitBudgetsAreCountedSeparately() {
        sender.fail(new ConnectException("refused"))
                .rateLimited("3")
                .fail(new ConnectException("refused"))
                .rateLimited("3")
                .respond(200, "{}");
        ClientPolicy policy = ClientPolicy.builder().maxTransientRetries(2).maxRateLimitRetries(2).build();

        TransportResponse response = transport(policy).execute(GET_ACCOUNT, CancellationToken.NONE).join();

        assertThat(response.getTransientRetries()).isEqualTo(2);
        assertThat(response.getRateLimitRetries()).isEqualTo(2);
        assertThat(sender.sends()).isEqualTo(5);
        assertThat(delayer.delays()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(3),
                Duration.ofSeconds(2), Duration.ofSeconds(3));
    }

    @Test
    void cancellingDuringBackoffStopsRetrying() {
        sender.fail(new ConnectException("refused"));
        CancellationToken token = CancellationToken.create();
        delayer.onDelay(t -> token.cancel());

        Throwable failure = failureOf(transport(ClientPolicy.defaults()).execute(GET_ACCOUNT, token));

        assertThat(failure).isInstanceOf(RequestCancelledException.class);
        assertThat(sender.sends()).isEqualTo(1);
    }

    @Test
    void cancellingAbortsTheRequestInFlight() {
        sender.hang();
        CancellationToken token = CancellationToken.create();
        CompletableFuture<TransportResponse> call = transport(ClientPolicy.defaults()).execute(GET_ACCOUNT, token);
        assertThat(call).isNotDone();

        token.cancel();

        assertThat(failureOf(call)).isInstanceOf(RequestCancelledException.class);
        assertThat(sender.sends()).isEqualTo(1);
    }

    @Test
    void alreadyCancelledTokenSendsNothing() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThat(failureOf(transport(ClientPolicy.defaults()).execute(GET_ACCOUNT, token)))
                .isInstanceOf(RequestCancelledException.class);
        assertThat(sender.sends()).isZero();
    }

    @Test
    void tokenIsReadBeforeEverySend() {
        AtomicInteger generation = new AtomicInteger();
        sender.fail(new ConnectException("refused")).respond(200, "{}");
        LichessTransport transport = LichessTransport.builder()
                .sender(sender)
                .delayer(delayer)
                .accessToken(() -> "lip_" + generation.incrementAndGet())
                .build();

        transport.execute(GET_ACCOUNT, CancellationToken.NONE).join();

        assertThat(sender.requests()).extracting(r -> r.headers().firstValue("Authorization").orElse(null))
                .containsExactly("Bearer lip_1", "Bearer lip_2");
    }

    @Test
    void anonymousRequestsCarryNoAuthorization() {
        sender.respond(200, "{}");
        LichessTransport transport = LichessTransport.builder().sender(sender).delayer(delayer)
                .accessToken((String) null).build();

        transport.execute(GET_ACCOUNT, CancellationToken.NONE).join();

        assertThat(sender.requests().get(0).headers().firstValue("Authorization")).isEmpty();
    }

    @Test
    void streamingYieldsRecordsAndHasNoTimeout() {
        BytesPublisher body = BytesPublisher.open("{\"n\":1}\n\n", "{\"n\":2}\n");
        sender.rateLimited("1").respondWith(200, Map.of(), body);

        NdjsonCursor<Item> cursor = transport(ClientPolicy.defaults())
                .executeStreaming(RequestDescriptor.get(EVENTS).build(), Item.class, CancellationToken.NONE).join();

        assertThat(cursor.next().join().orElseThrow().n).isEqualTo(1);
        assertThat(cursor.next().join().orElseThrow().n).isEqualTo(2);
        cursor.close();

        assertThat(body.isCancelled()).isTrue();
        assertThat(sender.sends()).isEqualTo(2);
        HttpRequest sent = sender.requests().get(1);
        assertThat(sent.headers().firstValue("Accept")).hasValue("application/x-ndjson");
        assertThat(sent.timeout()).isEmpty();
    }

    @Test
    void streamingFailsWithMappedErrorOnUnsuccessfulStatus() {
        sender.respond(401, "{\"error\":\"No such token\"}");

        Throwable failure = failureOf(transport(ClientPolicy.defaults())
                .executeStreaming(RequestDescriptor.get(EVENTS).build(), Item.class, CancellationToken.NONE));

        assertThat(failure).isInstanceOf(AuthenticationException.class);
        assertThat(((AuthenticationException) failure).getLichessError()).isEqualTo("No such token");
    }

    @Test
    void streamingRetriesTransientFailuresBeforeTheFirstByte() {
        sender.fail(new ConnectException("refused")).respondWith(200, Map.of(), BytesPublisher.of("{\"n\":7}\n"));

        NdjsonCursor<Item> cursor = transport(ClientPolicy.defaults())
                .executeStreaming(RequestDescriptor.get(EVENTS).build(), Item.class, CancellationToken.NONE).join();

        assertThat(cursor.stream()).extracting(item -> item.n).containsExactly(7);
        assertThat(sender.sends()).isEqualTo(2);
    }

    private LichessTransport transport(ClientPolicy policy) {
        return LichessTransport.builder()
                .policy(policy)
                .sender(sender)
                .delayer(delayer)
                .accessToken("lip_test")
                .clock(FIXED)
                .build();
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        try {
            future.join();
        } catch (CompletionException | CancellationException e) {
            return TransientFaultClassifier.unwrap(e);
        }
        throw new AssertionError("Expected the call to fail");
    }
}
