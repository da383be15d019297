package max.chess.ai.search;

public final class SearchConstants {
    // Window bound, above any mate score
    public static final int INF = 1_000_000;

    private SearchConstants() {}
}
