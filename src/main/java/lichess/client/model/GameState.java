package lichess.client.model;

public class GameState {
    /** Moves in UCI, space separated. */
    public String moves;
    public long wtime;
    public long btime;
    public long winc;
    public long binc;
    public String status;
    public String winner;
}
