package max.chess.ai.search.evaluator;

public final class GameValues {
    // Larger than any material + placement + mobility total, so a mate always dominates
    public static final int CHECKMATE_VALUE = 100_000;
    public static final int DRAW_VALUE = 0;

    private GameValues() {}
}
