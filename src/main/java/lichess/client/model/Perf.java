package lichess.client.model;

public class Perf {
    public String icon;
    public String name;
}
