package max.chess.ai.search;

import max.chess.ai.game.GameState;
import max.chess.ai.game.Move;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static max.chess.ai.search.SearchConstants.INF;

final class RootSearch {

    private static final Comparator<RootCandidate> LOWEST_FIRST = Comparator.comparingInt(RootCandidate::score);
    private static final Comparator<RootCandidate> HIGHEST_FIRST = LOWEST_FIRST.reversed();

    /**
     * @param best      best move of this iteration; when it was cut short this is compared against the previous depth
     * @param ranked    the root moves scored at this depth, best first (all of them when completed)
     * @param completed false if the deadline stopped the iteration before every root move was scored
     */
    record DepthResult(RootCandidate best, List<RootCandidate> ranked, boolean completed) {}

    private RootSearch() {}

    /** First root move that mates on the spot, or null. Only one ply is looked at. */
    static Move findMateInOne(GameState state, List<Move> rootMoves) {
        for (Move move : rootMoves) {
            try (MoveScope ignored = MoveScope.play(state, move)) {
                if (state.isCheckmate()) {
                    return move;
                }
            }
        }
        return null;
    }

    /**
     * Scores every root move with a full window search of {@code depth - 1} plies below it.
     * White to move maximizes, black to move minimizes.
     */
    static DepthResult searchAtDepth(GameState state, List<Move> rootMoves, int depth, SearchBudget budget,
                                     boolean rootMaximizing, RootCandidate incumbent) {
        List<RootCandidate> scored = new ArrayList<>(rootMoves.size());
        RootCandidate best = incumbent;
        for (Move move : rootMoves) {
            int score;
            try (MoveScope ignored = MoveScope.play(state, move)) {
                score = Minimax.search(state, depth - 1, -INF, INF, !rootMaximizing, budget);
            }
            RootCandidate candidate = new RootCandidate(move, score);
            scored.add(candidate);
            if (best == null || improves(score, best.score(), rootMaximizing)) {
                best = candidate;
            }
            if (budget.deadlinePassed() && scored.size() < rootMoves.size()) {
                return new DepthResult(best, rank(scored, rootMaximizing), false);
            }
        }
        List<RootCandidate> ranked = rank(scored, rootMaximizing);
        return new DepthResult(ranked.get(0), ranked, true);
    }

    static boolean improves(int score, int bestScore, boolean rootMaximizing) {
        return rootMaximizing ? score > bestScore : score < bestScore;
    }

    /** Stable: equal scores keep move ordering. */
    static List<RootCandidate> rank(List<RootCandidate> scored, boolean rootMaximizing) {
        List<RootCandidate> ranked = new ArrayList<>(scored);
        ranked.sort(rootMaximizing ? HIGHEST_FIRST : LOWEST_FIRST);
        return ranked;
    }
}
