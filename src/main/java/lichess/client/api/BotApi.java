package lichess.client.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

import lichess.client.LichessHttpClient;
import lichess.client.http.CancellationToken;
import lichess.client.http.Host;
import lichess.client.http.NdjsonCursor;
import lichess.client.model.Event;
import lichess.client.model.GameEvent;

/**
 * Endpoints for BOT accounts: incoming challenges and games, and playing moves.
 */
public class BotApi {
    public static final Pattern VALID_MOVE_PATTERN = Pattern.compile("[a-h][1-8][a-h][1-8][knbrq]?");

    private final LichessHttpClient client;

    public BotApi(LichessHttpClient client) {
        this.client = client;
    }

    /**
     * Streams challenges and game starts addressed to the account. The stream stays open until closed.
     */
    public CompletableFuture<NdjsonCursor<Event>> streamIncomingEvents(CancellationToken token) {
        return client.stream(Host.MAIN, "api/stream/event", Event.class, token);
    }

    /**
     * Streams the full game once, then every state change and chat line until the game ends.
     */
    public CompletableFuture<NdjsonCursor<GameEvent>> streamGame(String gameId, CancellationToken token) {
        return client.stream(Host.MAIN, "api/bot/game/stream/" + gameId, GameEvent.class, token);
    }

    /**
     * Upgrades the account to BOT status. Only possible for accounts that have not played any game.
     */
    public CompletableFuture<Void> upgradeToBotAccount(CancellationToken token) {
        return client.postForOk("api/bot/account/upgrade", token);
    }

    /**
     * @param move a move in UCI format such as "e2e4" or "e7e8q"
     */
    public CompletableFuture<Void> makeMove(String gameId, String move, CancellationToken token) {
        String normalized = move == null ? null : move.toLowerCase().trim();
        if (normalized == null || !VALID_MOVE_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid move: " + move);
        }
        return client.postForOk(String.format("api/bot/game/%s/move/%s", gameId, normalized), token);
    }

    /**
     * @param room "player" or "spectator"
     */
    public CompletableFuture<Void> writeChat(String gameId, String room, String text, CancellationToken token) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("room", room);
        form.put("text", text);
        return client.postForOk(String.format("api/bot/game/%s/chat", gameId), form, token);
    }

    public CompletableFuture<Void> resign(String gameId, CancellationToken token) {
        return client.postForOk(String.format("api/bot/game/%s/resign", gameId), token);
    }

    public CompletableFuture<Void> acceptChallenge(String challengeId, CancellationToken token) {
        return client.postForOk(String.format("api/challenge/%s/accept", challengeId), token);
    }

    /**
     * @param reason a Lichess decline reason key such as "generic", "later" or "tooFast", or null
     */
    public CompletableFuture<Void> declineChallenge(String challengeId, String reason, CancellationToken token) {
        Map<String, String> form = reason == null ? Collections.emptyMap() : Collections.singletonMap("reason", reason);
        return client.postForOk(String.format("api/challenge/%s/decline", challengeId), form, token);
    }
}
