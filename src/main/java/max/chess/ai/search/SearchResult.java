package max.chess.ai.search;

import max.chess.ai.game.Move;

import java.util.List;

/**
 * Outcome of one call. {@code move} is null when the game is already decided.
 *
 * @param depth      deepest fully searched depth, 0 when no search ran
 * @param candidates root moves ranked best first at that depth
 */
public record SearchResult(Move move, int score, int depth, long nodes, long timeMs, List<RootCandidate> candidates) {

    public static final SearchResult NO_MOVE = new SearchResult(null, 0, 0, 0, 0, List.of());

    public SearchResult {
        candidates = List.copyOf(candidates);
    }

    public boolean hasMove() {
        return move != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SearchResult\n")
                .append("best move: ").append(move == null ? "(none)" : move.san()).append("\n")
                .append("score: ").append(score).append("\n")
                .append("depth: ").append(depth).append("\n")
                .append("nodes: ").append(nodes).append("\n")
                .append("search time (ms): ").append(timeMs).append("\n")
                .append("candidates: ");
        for (RootCandidate candidate : candidates) {
            sb.append(candidate).append(", ");
        }
        return sb.toString();
    }
}
