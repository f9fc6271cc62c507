package lichess.client.http;

import static com.fasterxml.jackson.databind.DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES;
import static com.fasterxml.jackson.databind.DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lichess.client.JsonDecodingException;

/**
 * JSON settings shared by the transport, the stream cursors and the error mapper. Configured once at construction;
 * the wrapped mapper is not exposed for reconfiguration.
 */
public final class JsonCodec {
    private final ObjectMapper mapper;

    private JsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Lenient about properties and enum values Lichess adds over time.
     */
    public static JsonCodec lenient() {
        return new JsonCodec(new ObjectMapper()
                .configure(FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE, true));
    }

    public <T> T decode(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new JsonDecodingException("Could not map JSON to " + type.getSimpleName(), e);
        }
    }

    /**
     * Parses a JSON document without binding it, or returns null when the text is not JSON.
     */
    public JsonNode tryParse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(text);
        } catch (IOException e) {
            return null;
        }
    }
}
