package lichess.client;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import lichess.client.http.JsonCodec;
import lichess.client.http.RateLimitSignalExtractor;
import lichess.client.http.TransportResponse;

/**
 * Turns an unsuccessful response into the matching {@link LichessServiceException}.
 * <p>
 * Lichess reports errors as {@code {"error": "message"}}, or for form validation as
 * {@code {"error": {"field": ["message", ...]}}}. Bodies that are not JSON are kept as the error text, truncated.
 */
public final class ErrorMapper {
    static final String ACCEPTED_SCOPES_HEADER = "X-Accepted-OAuth-Scopes";
    private static final int MAX_ERROR_LENGTH = 200;

    private final JsonCodec codec;
    private final RateLimitSignalExtractor rateLimitSignals;

    public ErrorMapper(JsonCodec codec, RateLimitSignalExtractor rateLimitSignals) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.rateLimitSignals = Objects.requireNonNull(rateLimitSignals, "rateLimitSignals");
    }

    public LichessServiceException map(TransportResponse response) {
        int status = response.getStatusCode();
        String body = response.getBody();
        JsonNode json = codec.tryParse(body);
        String error = errorText(json, body);

        switch (status) {
        case 400:
            return new ValidationException("The request was invalid.", error, fieldErrors(json));
        case 401:
            return new AuthenticationException("Authentication failed. Check the access token.", error);
        case 403:
            return new AuthorizationException("Access denied. The token may lack the scope this operation needs.",
                    response.getHeaders().firstValue(ACCEPTED_SCOPES_HEADER).orElse(null), error);
        case 404:
            return new NotFoundException("The requested resource was not found: " + response.getUri().getPath(), error);
        case 429:
            return new RateLimitExceededException("API rate limit exceeded.",
                    rateLimitSignals.extract(response.getHeaders()).getWaitDuration());
        default:
            return new LichessServiceException("Request failed with status code " + status, status, error);
        }
    }

    private static String errorText(JsonNode json, String body) {
        if (json != null && json.has("error")) {
            JsonNode error = json.get("error");
            return error.isTextual() ? error.asText() : error.toString();
        }
        if (body == null || body.isBlank()) {
            return null;
        }
        return body.length() > MAX_ERROR_LENGTH ? body.substring(0, MAX_ERROR_LENGTH) : body;
    }

    private static Map<String, List<String>> fieldErrors(JsonNode json) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        if (json == null || !json.path("error").isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = json.get("error").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> messages = new ArrayList<>();
            if (field.getValue().isArray()) {
                field.getValue().forEach(message -> messages.add(message.asText()));
            } else {
                messages.add(field.getValue().asText());
            }
            result.put(field.getKey(), messages);
        }
        return result;
    }
}
