package lichess.client.api;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

import lichess.client.LichessHttpClient;
import lichess.client.http.CancellationToken;
import lichess.client.http.Host;
import lichess.client.model.ExplorerResult;

/**
 * The opening explorer, served from its own host.
 */
public class OpeningExplorerApi {
    private final LichessHttpClient client;

    public OpeningExplorerApi(LichessHttpClient client) {
        this.client = client;
    }

    /**
     * Games played on Lichess from the given position.
     */
    public CompletableFuture<ExplorerResult> lichess(String fen, CancellationToken token) {
        return client.get(Host.OPENING_EXPLORER, "lichess?variant=standard&fen=" + encode(fen), ExplorerResult.class,
                token);
    }

    /**
     * Over-the-board games between masters from the given position.
     */
    public CompletableFuture<ExplorerResult> masters(String fen, CancellationToken token) {
        return client.get(Host.OPENING_EXPLORER, "masters?fen=" + encode(fen), ExplorerResult.class, token);
    }

    static String encode(String fen) {
        return URLEncoder.encode(fen, StandardCharsets.UTF_8);
    }
}
