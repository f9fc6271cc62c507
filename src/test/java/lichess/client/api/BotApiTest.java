package lichess.client.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import lichess.client.LichessClient;
import lichess.client.TestServer;
import lichess.client.http.CancellationToken;
import lichess.client.http.NdjsonCursor;
import lichess.client.model.GameEvent;

class BotApiTest {
    private TestServer server;
    private BotApi bot;

    @BeforeEach
    void start() throws IOException {
        server = new TestServer();
        server.context("/api/", exchange -> TestServer.respond(exchange, 200, "{\"ok\":true}"));
        bot = LichessClient.builder().accessToken("lip_bot").policy(server.policy().build()).build().bot();
    }

    @AfterEach
    void stop() {
        server.close();
    }

    @Test
    void makesMovesInUci() {
        bot.makeMove("abcd1234", "E7E8Q", CancellationToken.NONE).join();

        TestServer.Recorded request = server.requests().get(0);
        assertThat(request.method).isEqualTo("POST");
        assertThat(request.uri.getPath()).isEqualTo("/api/bot/game/abcd1234/move/e7e8q");
        assertThat(request.authorization).isEqualTo("Bearer lip_bot");
    }

    @Test
    void rejectsMalformedMovesWithoutCallingLichess() {
        assertThatThrownBy(() -> bot.makeMove("abcd1234", "e2e9", CancellationToken.NONE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid move: e2e9");
        assertThatThrownBy(() -> bot.makeMove("abcd1234", null, CancellationToken.NONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(server.requests()).isEmpty();
    }

    @Test
    void writesChatAsForm() {
        bot.writeChat("abcd1234", "player", "good luck & have fun", CancellationToken.NONE).join();

        TestServer.Recorded request = server.requests().get(0);
        assertThat(request.uri.getPath()).isEqualTo("/api/bot/game/abcd1234/chat");
        assertThat(request.contentType).isEqualTo("application/x-www-form-urlencoded");
        assertThat(request.body).isEqualTo("room=player&text=good+luck+%26+have+fun");
    }

    @Test
    void answersChallenges() {
        bot.acceptChallenge("ch1", CancellationToken.NONE).join();
        bot.declineChallenge("ch2", "tooFast", CancellationToken.NONE).join();
        bot.resign("g1", CancellationToken.NONE).join();

        List<String> paths = server.requests().stream().map(r -> r.uri.getPath()).collect(Collectors.toList());
        assertThat(paths).containsExactly("/api/challenge/ch1/accept", "/api/challenge/ch2/decline",
                "/api/bot/game/g1/resign");
        assertThat(server.requests().get(1).body).isEqualTo("reason=tooFast");
        assertThat(server.requests().get(0).body).isEmpty();
    }

    @Test
    void streamsAGameUntilItEnds() {
        server.context("/api/bot/game/stream/g1", exchange -> {
            String lines = "{\"type\":\"gameFull\",\"id\":\"g1\",\"rated\":false,"
                    + "\"state\":{\"type\":\"gameState\",\"moves\":\"e2e4\",\"status\":\"started\"}}\n"
                    + "\n"
                    + "{\"type\":\"chatLine\",\"username\":\"lichess\",\"text\":\"hi\",\"room\":\"player\"}\n"
                    + "{\"type\":\"someNewThing\"}\n"
                    + "{\"type\":\"gameState\",\"moves\":\"e2e4 e7e5\",\"status\":\"resign\"}\n";
            byte[] bytes = lines.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });

        List<GameEvent> events;
        try (NdjsonCursor<GameEvent> cursor = bot.streamGame("g1", CancellationToken.NONE).join()) {
            events = cursor.stream().collect(Collectors.toList());
        }

        assertThat(events).extracting(e -> e.type).containsExactly(GameEvent.GameEventType.FULL,
                GameEvent.GameEventType.CHAT, GameEvent.GameEventType.UNKNOWN, GameEvent.GameEventType.STATE);
        assertThat(events.get(0).state.moves).isEqualTo("e2e4");
        assertThat(events.get(3).status).isEqualTo("resign");
    }
}
