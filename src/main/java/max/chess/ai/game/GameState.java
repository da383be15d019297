package max.chess.ai.game;

import max.chess.ai.common.Color;
import max.chess.ai.common.Piece;
import max.chess.ai.common.PieceType;

import java.util.List;

/**
 * What the search needs from a rules engine. Implementations are mutable and single writer:
 * {@link #apply(Move)} and {@link #undo()} must be strictly paired, last in first out.
 */
public interface GameState {

    List<Move> legalMoves();

    List<Move> legalMoves(int fromSquare);

    /**
     * Plays a move in place.
     *
     * @return the applied move (with capture info and notation), or {@code null} if it is not legal here
     */
    Move apply(Move move);

    Move apply(int from, int to, PieceType promotion);

    /** Reverts the most recently applied move. */
    void undo();

    Color sideToMove();

    boolean inCheck();

    boolean isCheckmate();

    boolean isStalemate();

    boolean isDraw();

    boolean isGameOver();

    /**
     * 8x8 grid of the board contents, {@code null} for empty squares.
     * Row 0 is rank 8 and column 0 is file a, as the board is seen from white's side.
     */
    Piece[][] board();

    /** Serialized form of the full position. */
    String fen();
}
