package lichess.client;

public class NotFoundException extends LichessServiceException {
    private static final long serialVersionUID = 1L;

    public NotFoundException(String message, String lichessError) {
        super(message, 404, lichessError);
    }
}
