package lichess.client;

import java.util.OptionalInt;

/**
 * Represents an error returned by a Lichess endpoint, or a failure to reach one.
 * <p>
 * Subclasses identify the kind of failure; callers that only care about "the call failed" can catch this type.
 */
public class LichessServiceException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String lichessError;

    public LichessServiceException(String message) {
        this(message, 0, null, null);
    }

    public LichessServiceException(String message, Throwable cause) {
        this(message, 0, null, cause);
    }

    public LichessServiceException(String message, int statusCode, String lichessError) {
        this(message, statusCode, lichessError, null);
    }

    public LichessServiceException(String message, int statusCode, String lichessError, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.lichessError = lichessError;
    }

    /**
     * The HTTP status code returned by the API, if the failure came from a response.
     */
    public OptionalInt getStatusCode() {
        return statusCode > 0 ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }

    /**
     * The error message returned by Lichess, or null.
     */
    public String getLichessError() {
        return lichessError;
    }
}
