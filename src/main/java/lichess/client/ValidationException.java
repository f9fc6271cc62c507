package lichess.client;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * HTTP 400: Lichess rejected the request parameters.
 */
public class ValidationException extends LichessServiceException {
    private static final long serialVersionUID = 1L;

    private final Map<String, List<String>> fieldErrors;

    public ValidationException(String message, String lichessError, Map<String, List<String>> fieldErrors) {
        super(message, 400, lichessError);
        this.fieldErrors = fieldErrors == null ? Collections.emptyMap() : Collections.unmodifiableMap(fieldErrors);
    }

    /**
     * Messages per request field, empty when the error was not field-specific.
     */
    public Map<String, List<String>> getFieldErrors() {
        return fieldErrors;
    }
}
