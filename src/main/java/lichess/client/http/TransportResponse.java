package lichess.client.http;

import java.net.URI;
import java.net.http.HttpHeaders;

/**
 * A fully read response as returned by {@link LichessTransport#execute}. Status codes other than 429 are passed
 * through untouched.
 */
public final class TransportResponse {
    private final URI uri;
    private final int statusCode;
    private final HttpHeaders headers;
    private final String body;
    private final int transientRetries;
    private final int rateLimitRetries;

    public TransportResponse(URI uri, int statusCode, HttpHeaders headers, String body,
            int transientRetries, int rateLimitRetries) {
        this.uri = uri;
        this.statusCode = statusCode;
        this.headers = headers;
        this.body = body == null ? "" : body;
        this.transientRetries = transientRetries;
        this.rateLimitRetries = rateLimitRetries;
    }

    public URI getUri() {
        return uri;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public HttpHeaders getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public int getTransientRetries() {
        return transientRetries;
    }

    public int getRateLimitRetries() {
        return rateLimitRetries;
    }

    @Override
    public String toString() {
        return "TransportResponse{" + statusCode + " " + uri + "}";
    }
}
