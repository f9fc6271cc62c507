package lichess.client.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A line of the incoming events stream ({@code api/stream/event}).
 */
public class Event {
    public EventType type;
    public Challenge challenge;
    public GameStart game;

    public static class Challenge {
        public String id;
        public String url;
        public String status;
        public User challenger;
        public User destUser;
        public Variant variant;
        public boolean rated;
        public String speed;
        public TimeControl timeControl;
        public String color;
        public Perf perf;
        public String declineReason;
    }

    public static class GameStart {
        public String id;
        public String gameId;
        public String fen;
        public String color;
        public boolean isMyTurn;
        public User opponent;
    }

    public enum EventType {
        @JsonProperty("challenge") CHALLENGE,
        @JsonProperty("challengeCanceled") CHALLENGE_CANCELED,
        @JsonProperty("challengeDeclined") CHALLENGE_DECLINED,
        @JsonProperty("gameStart") GAME_START,
        @JsonProperty("gameFinish") GAME_FINISH,
        @JsonEnumDefaultValue UNKNOWN;
    }
}
