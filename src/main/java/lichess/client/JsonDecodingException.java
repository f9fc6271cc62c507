package lichess.client;

/**
 * A response body could not be mapped to the requested type.
 */
public class JsonDecodingException extends LichessServiceException {
    private static final long serialVersionUID = 1L;

    public JsonDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
