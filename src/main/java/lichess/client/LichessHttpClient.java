package lichess.client;

import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import lichess.client.http.CancellationToken;
import lichess.client.http.Host;
import lichess.client.http.LichessTransport;
import lichess.client.http.NdjsonCursor;
import lichess.client.http.RequestDescriptor;
import lichess.client.http.RequestDescriptor.MediaType;
import lichess.client.http.TransportResponse;

/**
 * JSON-level access to a Lichess endpoint: builds requests against the right host, runs them through the
 * {@link LichessTransport}, maps error statuses to exceptions and response bodies to the given class type.
 */
public class LichessHttpClient {
    private final LichessTransport transport;

    public LichessHttpClient(LichessTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public LichessTransport getTransport() {
        return transport;
    }

    /**
     * Performs a GET request on the given path and maps the response to the given class type.
     */
    public <T> CompletableFuture<T> get(Host host, String path, Class<T> type, CancellationToken token) {
        RequestDescriptor request = RequestDescriptor.get(resolve(host, path)).build();
        return execute(request, token).thenApply(response -> decode(response, type));
    }

    /**
     * Performs a GET request and returns the raw body, e.g. for PGN exports.
     */
    public CompletableFuture<String> getString(Host host, String path, MediaType accept, CancellationToken token) {
        RequestDescriptor request = RequestDescriptor.get(resolve(host, path)).accept(accept).build();
        return execute(request, token).thenApply(TransportResponse::getBody);
    }

    /**
     * Performs a POST request on the given path with form data and maps the response to the given class type.
     */
    public <T> CompletableFuture<T> post(String path, Map<String, String> formData, Class<T> type,
            CancellationToken token) {
        RequestDescriptor request = RequestDescriptor.post(resolve(Host.MAIN, path)).form(formData).build();
        return execute(request, token).thenApply(response -> decode(response, type));
    }

    /**
     * Performs a POST request on an endpoint that answers {@code {"ok": true}}.
     */
    public CompletableFuture<Void> postForOk(String path, Map<String, String> formData, CancellationToken token) {
        return post(path, formData, OkErrorResponse.class, token).thenAccept(response -> {
            if (!response.ok) {
                throw new LichessServiceException(response.error == null ? "Lichess refused the request" : response.error,
                        200, response.error);
            }
        });
    }

    public CompletableFuture<Void> postForOk(String path, CancellationToken token) {
        return postForOk(path, Collections.emptyMap(), token);
    }

    public <T> CompletableFuture<T> delete(String path, Class<T> type, CancellationToken token) {
        RequestDescriptor request = RequestDescriptor.delete(resolve(Host.MAIN, path)).build();
        return execute(request, token).thenApply(response -> decode(response, type));
    }

    /**
     * Performs a streaming GET request on the given path. Each line of the response is mapped to the given class
     * type as the caller pulls it from the cursor.
     */
    public <T> CompletableFuture<NdjsonCursor<T>> stream(Host host, String path, Class<T> valueType,
            CancellationToken token) {
        RequestDescriptor request = RequestDescriptor.get(resolve(host, path)).accept(MediaType.NDJSON).build();
        return transport.executeStreaming(request, valueType, token);
    }

    /**
     * Performs a streaming POST request, for endpoints that take their input as a body (e.g. users by id).
     */
    public <T> CompletableFuture<NdjsonCursor<T>> streamPost(String path, String textBody, Class<T> valueType,
            CancellationToken token) {
        RequestDescriptor request = RequestDescriptor.post(resolve(Host.MAIN, path))
                .accept(MediaType.NDJSON)
                .text(textBody)
                .build();
        return transport.executeStreaming(request, valueType, token);
    }

    private CompletableFuture<TransportResponse> execute(RequestDescriptor request, CancellationToken token) {
        return transport.execute(request, token).thenApply(response -> {
            if (!response.isSuccessful()) {
                throw transport.getErrorMapper().map(response);
            }
            return response;
        });
    }

    private <T> T decode(TransportResponse response, Class<T> type) {
        T value = transport.getCodec().decode(response.getBody(), type);
        if (value == null) {
            throw new JsonDecodingException("Empty response from " + response.getUri(), null);
        }
        return value;
    }

    private URI resolve(Host host, String path) {
        return transport.getPolicy().resolve(host, path);
    }

    static class OkErrorResponse {
        public boolean ok;
        public String error;
    }
}
