package lichess.client.model;

import java.util.List;

/**
 * Endgame tablebase verdict for a position.
 */
public class TablebaseResult {
    public boolean checkmate;
    public boolean stalemate;
    public boolean insufficientMaterial;
    public Integer dtz;
    public Integer preciseDtz;
    public Integer dtm;
    /** "win", "loss", "draw", "cursed-win", "blessed-loss", "unknown", ... */
    public String category;
    public List<Move> moves;

    public static class Move {
        public String uci;
        public String san;
        public boolean zeroing;
        public boolean checkmate;
        public boolean stalemate;
        public Integer dtz;
        public Integer dtm;
        public String category;
    }
}
