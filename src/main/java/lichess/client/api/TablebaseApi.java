package lichess.client.api;

import java.util.concurrent.CompletableFuture;

import lichess.client.LichessHttpClient;
import lichess.client.http.CancellationToken;
import lichess.client.http.Host;
import lichess.client.model.TablebaseResult;

public class TablebaseApi {
    private final LichessHttpClient client;

    public TablebaseApi(LichessHttpClient client) {
        this.client = client;
    }

    /**
     * Looks up a standard chess position with at most 7 pieces.
     */
    public CompletableFuture<TablebaseResult> standard(String fen, CancellationToken token) {
        return client.get(Host.TABLEBASE, "standard?fen=" + OpeningExplorerApi.encode(fen), TablebaseResult.class,
                token);
    }
}
