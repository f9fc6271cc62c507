package lichess.client;

/**
 * HTTP 403: the token is valid but lacks the scope required by the endpoint.
 */
public class AuthorizationException extends LichessServiceException {
    private static final long serialVersionUID = 1L;

    private final String requiredScope;

    public AuthorizationException(String message, String requiredScope, String lichessError) {
        super(message, 403, lichessError);
        this.requiredScope = requiredScope;
    }

    /**
     * The OAuth scope Lichess reported as missing, or null when it didn't say.
     */
    public String getRequiredScope() {
        return requiredScope;
    }
}
