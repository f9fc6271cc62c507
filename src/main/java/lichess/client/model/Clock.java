package lichess.client.model;

public class Clock {
    /** Millis. */
    public long initial;
    /** Millis. */
    public long increment;
}
