package lichess.client.http;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An immutable description of one logical API call. The transport may send it several times.
 */
public final class RequestDescriptor {
    private static final Set<String> IDEMPOTENT_METHODS = Set.of("GET", "HEAD", "OPTIONS");
    private static final byte[] NO_BODY = new byte[0];

    private final String method;
    private final URI uri;
    private final byte[] body;
    private final String contentType;
    private final Map<String, String> headers;
    private final MediaType accept;

    private RequestDescriptor(Builder builder) {
        this.method = builder.method;
        this.uri = builder.uri;
        this.body = builder.body;
        this.contentType = builder.contentType;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.accept = builder.accept;
    }

    public static Builder get(URI uri) {
        return new Builder("GET", uri);
    }

    public static Builder post(URI uri) {
        return new Builder("POST", uri);
    }

    public static Builder delete(URI uri) {
        return new Builder("DELETE", uri);
    }

    public static Builder builder(String method, URI uri) {
        return new Builder(method, uri);
    }

    public String getMethod() {
        return method;
    }

    public URI getUri() {
        return uri;
    }

    /**
     * The body bytes; empty when the request has no body. Callers must not modify the returned array.
     */
    public byte[] getBody() {
        return body;
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    public String getContentType() {
        return contentType;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public MediaType getAccept() {
        return accept;
    }

    /**
     * Whether sending this request a second time is harmless. Only GET, HEAD and OPTIONS are; a POST changes state on
     * Lichess even without a body (a move, a resignation).
     */
    public boolean isReplayable() {
        return IDEMPOTENT_METHODS.contains(method);
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }

    /**
     * Values for the Accept header.
     */
    public enum MediaType {
        JSON("application/json"),
        NDJSON("application/x-ndjson"),
        TEXT("text/plain");

        private final String value;

        MediaType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public static final class Builder {
        private final String method;
        private final URI uri;
        private byte[] body = NO_BODY;
        private String contentType;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private MediaType accept = MediaType.JSON;

        private Builder(String method, URI uri) {
            this.method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
            this.uri = Objects.requireNonNull(uri, "uri");
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder accept(MediaType accept) {
            this.accept = Objects.requireNonNull(accept, "accept");
            return this;
        }

        public Builder body(byte[] body, String contentType) {
            this.body = body == null ? NO_BODY : body.clone();
            this.contentType = contentType;
            return this;
        }

        public Builder text(String text) {
            return body(text.getBytes(StandardCharsets.UTF_8), "text/plain; charset=utf-8");
        }

        /**
         * Sets an {@code application/x-www-form-urlencoded} body. An empty map leaves the request without a body.
         */
        public Builder form(Map<String, String> fields) {
            if (fields == null || fields.isEmpty()) {
                return body(NO_BODY, null);
            }
            String encoded = fields.entrySet().stream()
                    .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                    .collect(Collectors.joining("&"));
            return body(encoded.getBytes(StandardCharsets.UTF_8), "application/x-www-form-urlencoded");
        }

        public RequestDescriptor build() {
            return new RequestDescriptor(this);
        }

        private static String encode(String value) {
            return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
        }
    }
}
