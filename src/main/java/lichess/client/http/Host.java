package lichess.client.http;

/**
 * The Lichess services a request can be routed to. Each has its own base address in {@link ClientPolicy}.
 */
public enum Host {
    MAIN,
    OPENING_EXPLORER,
    TABLEBASE
}
