package lichess.client.model;

/**
 * A player as it appears inside games and challenges.
 */
public class User {
    public String id;
    public String name;
    public String title;
    public Integer rating;
    public boolean provisional;
    public boolean online;
}
