package max.chess.ai.search;

import max.chess.ai.game.GameState;
import max.chess.ai.game.Move;
import max.chess.ai.search.evaluator.PositionEvaluator;

import java.util.List;

import static max.chess.ai.search.SearchConstants.INF;

/**
 * Depth limited minimax with alpha-beta pruning. Scores are from white's point of view,
 * {@code maximizing} tells which side this frame plays for.
 */
public final class Minimax {

    private Minimax() {}

    public static int search(GameState state, int depth, int alpha, int beta, boolean maximizing, SearchBudget budget) {
        if (budget.nodesExhausted() || budget.deadlinePassed()) {
            return PositionEvaluator.evaluate(state);
        }
        budget.visit();
        if (depth <= 0 || state.isGameOver()) {
            return PositionEvaluator.evaluate(state);
        }

        final List<Move> moves = MoveOrdering.orderedLegalMoves(state);
        if (moves.isEmpty()) {
            return PositionEvaluator.evaluate(state);
        }

        int best = maximizing ? -INF : INF;
        for (Move move : moves) {
            int value;
            try (MoveScope ignored = MoveScope.play(state, move)) {
                value = search(state, depth - 1, alpha, beta, !maximizing, budget);
            }
            if (maximizing) {
                if (value > best) best = value;
                if (value > alpha) alpha = value;
            } else {
                if (value < best) best = value;
                if (value < beta) beta = value;
            }
            // cut-off: the value is only a bound from here
            if (alpha >= beta) break;
        }
        return best;
    }
}
