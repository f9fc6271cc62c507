package lichess.client.model;

import java.util.List;

/**
 * Statistics for a position from the opening explorer.
 */
public class ExplorerResult {
    public long white;
    public long draws;
    public long black;
    public List<Move> moves;
    public List<GameRef> topGames;
    public List<GameRef> recentGames;
    public Opening opening;

    public static class Move {
        public String uci;
        public String san;
        public long white;
        public long draws;
        public long black;
        public Integer averageRating;
    }

    public static class GameRef {
        public String id;
        public String winner;
        public String uci;
        public Integer year;
    }

    public static class Opening {
        public String eco;
        public String name;
    }
}
