package lichess.client;

import java.net.http.HttpClient;
import java.util.Objects;
import java.util.function.Supplier;

import lichess.client.api.AccountApi;
import lichess.client.api.BotApi;
import lichess.client.api.OpeningExplorerApi;
import lichess.client.api.TablebaseApi;
import lichess.client.http.ClientPolicy;
import lichess.client.http.LichessTransport;

/**
 * Entry point to the Lichess API.
 *
 * <pre>{@code
 * LichessClient lichess = LichessClient.builder()
 *         .accessToken(System.getenv("LICHESS_TOKEN"))
 *         .policy(ClientPolicy.builder().maxRateLimitRetries(5).build())
 *         .build();
 * Account me = lichess.account().getProfile().join();
 * }</pre>
 */
public class LichessClient {
    private final LichessHttpClient http;
    private final AccountApi account;
    private final BotApi bot;
    private final OpeningExplorerApi openingExplorer;
    private final TablebaseApi tablebase;

    public LichessClient(LichessTransport transport) {
        this.http = new LichessHttpClient(transport);
        this.account = new AccountApi(http);
        this.bot = new BotApi(http);
        this.openingExplorer = new OpeningExplorerApi(http);
        this.tablebase = new TablebaseApi(http);
    }

    /**
     * Creates a client with default settings, authenticated with the given personal API token (may be null).
     */
    public LichessClient(String apiToken) {
        this(LichessTransport.builder().accessToken(apiToken).build());
    }

    public static Builder builder() {
        return new Builder();
    }

    public AccountApi account() {
        return account;
    }

    public BotApi bot() {
        return bot;
    }

    public OpeningExplorerApi openingExplorer() {
        return openingExplorer;
    }

    public TablebaseApi tablebase() {
        return tablebase;
    }

    /**
     * Lower-level access for endpoints without a dedicated method.
     */
    public LichessHttpClient http() {
        return http;
    }

    public ClientPolicy getPolicy() {
        return http.getTransport().getPolicy();
    }

    public static final class Builder {
        private final LichessTransport.Builder transport = LichessTransport.builder();

        private Builder() {
        }

        public Builder accessToken(String accessToken) {
            transport.accessToken(accessToken);
            return this;
        }

        public Builder accessToken(Supplier<String> accessToken) {
            transport.accessToken(accessToken);
            return this;
        }

        public Builder policy(ClientPolicy policy) {
            transport.policy(Objects.requireNonNull(policy, "policy"));
            return this;
        }

        /**
         * Shares an existing HTTP client, and with it its connection pool.
         */
        public Builder httpClient(HttpClient httpClient) {
            transport.httpClient(httpClient);
            return this;
        }

        public Builder userAgent(String userAgent) {
            transport.userAgent(userAgent);
            return this;
        }

        public LichessClient build() {
            return new LichessClient(transport.build());
        }
    }
}
