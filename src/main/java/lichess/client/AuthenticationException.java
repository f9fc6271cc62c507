package lichess.client;

/**
 * HTTP 401: the access token is missing, expired or revoked.
 */
public class AuthenticationException extends LichessServiceException {
    private static final long serialVersionUID = 1L;

    public AuthenticationException(String message, String lichessError) {
        super(message, 401, lichessError);
    }
}
