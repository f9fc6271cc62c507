package lichess.client;

import java.util.concurrent.CancellationException;

/**
 * Raised when the caller's {@link lichess.client.http.CancellationToken} fires while a call is sending, waiting to
 * retry or reading a stream. It is never wrapped into a {@link LichessServiceException}.
 */
public class RequestCancelledException extends CancellationException {
    private static final long serialVersionUID = 1L;

    public RequestCancelledException(String message) {
        super(message);
    }
}
