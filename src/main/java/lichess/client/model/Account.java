package lichess.client.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class Account {
    public String id;
    public String username;
    public String title;
    public boolean disabled;
    public long createdAt;
    public long seenAt;

    @JsonIgnore
    public boolean isBot() {
        return "bot".equalsIgnoreCase(title);
    }
}
