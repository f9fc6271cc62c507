package lichess.client.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A line of a bot game stream ({@code api/bot/game/stream/{gameId}}). Which fields are set depends on the type.
 */
public class GameEvent {
    public GameEventType type;

    // full
    public String id;
    public boolean rated;
    public Variant variant;
    public Clock clock;
    public String speed;
    public Perf perf;
    public long createdAt;
    public User white;
    public User black;
    public String initialFen;
    public GameState state;

    // game state
    public String moves;
    public long wtime;
    public long btime;
    public long winc;
    public long binc;
    public String status;

    // chat line
    public String username;
    public String text;
    public String room;

    // opponent gone
    public Boolean gone;
    public Integer claimWinInSeconds;

    public enum GameEventType {
        @JsonProperty("gameFull") FULL,
        @JsonProperty("gameState") STATE,
        @JsonProperty("chatLine") CHAT,
        @JsonProperty("opponentGone") OPPONENT_GONE,
        @JsonEnumDefaultValue UNKNOWN;
    }
}
