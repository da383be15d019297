package max.chess.ai.search;

import max.chess.ai.game.GameState;
import max.chess.ai.game.Move;
import max.chess.ai.game.SafeMoves;
import max.chess.ai.search.evaluator.PieceValues;

import java.util.List;

/**
 * Capture-first ordering: most valuable victim, then least valuable attacker.
 * Quiet moves end up behind captures, cheapest piece first.
 */
public final class MoveOrdering {

    private MoveOrdering() {}

    public static int score(Move move) {
        return 10 * PieceValues.value(move.captured()) - PieceValues.value(move.piece());
    }

    /** Returns a new list sorted by descending {@link #score(Move)}; equal scores keep their input order. */
    public static List<Move> order(List<Move> moves) {
        final int n = moves.size();
        final Move[] ordered = moves.toArray(new Move[0]);
        final int[] scores = new int[n];
        for (int i = 0; i < n; i++) {
            scores[i] = score(ordered[i]);
        }
        // insertion sort, strict comparison keeps it stable
        for (int i = 1; i < n; i++) {
            Move m = ordered[i];
            int s = scores[i];
            int j = i - 1;
            while (j >= 0 && scores[j] < s) {
                ordered[j + 1] = ordered[j];
                scores[j + 1] = scores[j];
                j--;
            }
            ordered[j + 1] = m;
            scores[j + 1] = s;
        }
        return List.of(ordered);
    }

    static List<Move> orderedLegalMoves(GameState state) {
        return order(SafeMoves.legal(state));
    }
}
