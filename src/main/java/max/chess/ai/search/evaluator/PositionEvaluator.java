package max.chess.ai.search.evaluator;

import max.chess.ai.common.Piece;
import max.chess.ai.game.GameState;
import max.chess.ai.game.RepetitionProbe;
import max.chess.ai.game.SafeMoves;

/**
 * Static evaluation, always from white's point of view: positive means white is better.
 */
public final class PositionEvaluator {
    // cp per legal move of the side to move
    public static final int MOBILITY_WEIGHT = 2;

    private PositionEvaluator() {}

    public static int evaluate(GameState state) {
        if (state.isCheckmate()) {
            // the side to move is the one mated
            return state.sideToMove().isWhite() ? -GameValues.CHECKMATE_VALUE : GameValues.CHECKMATE_VALUE;
        }
        if (state.isDraw() || RepetitionProbe.isThreefold(state)) {
            return GameValues.DRAW_VALUE;
        }

        int score = materialAndPlacement(state.board());
        int mobility = SafeMoves.legal(state).size();
        score += state.sideToMove().sign * mobility * MOBILITY_WEIGHT;
        return score;
    }

    /** Material plus piece-square bonuses, white pieces counted positive and black pieces negative. */
    public static int materialAndPlacement(Piece[][] board) {
        int score = 0;
        for (int row = 0; row < 8; row++) {
            for (int file = 0; file < 8; file++) {
                Piece piece = board[row][file];
                if (piece == null) {
                    continue;
                }
                int contribution = PieceValues.value(piece.type())
                        + PieceValues.placement(piece.type(), piece.color(), row, file);
                score += piece.color().sign * contribution;
            }
        }
        return score;
    }
}
