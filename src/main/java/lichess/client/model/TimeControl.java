package lichess.client.model;

public class TimeControl {
    /** "clock", "correspondence" or "unlimited". */
    public String type;
    public Integer limit;
    public Integer increment;
    public Integer daysPerTurn;
    public String show;
}
