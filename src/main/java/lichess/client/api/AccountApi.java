package lichess.client.api;

import java.util.concurrent.CompletableFuture;

import lichess.client.LichessHttpClient;
import lichess.client.http.CancellationToken;
import lichess.client.http.Host;
import lichess.client.model.Account;

/**
 * The account the access token belongs to.
 */
public class AccountApi {
    private final LichessHttpClient client;

    public AccountApi(LichessHttpClient client) {
        this.client = client;
    }

    public CompletableFuture<Account> getProfile() {
        return getProfile(CancellationToken.NONE);
    }

    public CompletableFuture<Account> getProfile(CancellationToken token) {
        return client.get(Host.MAIN, "api/account", Account.class, token);
    }
}
