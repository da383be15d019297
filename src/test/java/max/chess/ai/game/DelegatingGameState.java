package max.chess.ai.game;

import max.chess.ai.common.Color;
import max.chess.ai.common.Piece;
import max.chess.ai.common.PieceType;

import java.util.List;

/**
 * Forwards everything to a {@link Game}; tests override single calls to simulate
 * misbehaving rules engines or to count traffic.
 */
public class DelegatingGameState implements GameState {
    protected final Game game;
    public int applied;
    public int undone;

    public DelegatingGameState(Game game) {
        this.game = game;
    }

    @Override
    public List<Move> legalMoves() {
        return game.legalMoves();
    }

    @Override
    public List<Move> legalMoves(int fromSquare) {
        return game.legalMoves(fromSquare);
    }

    @Override
    public Move apply(Move move) {
        Move played = game.apply(move);
        if (played != null) {
            applied++;
        }
        return played;
    }

    @Override
    public Move apply(int from, int to, PieceType promotion) {
        Move played = game.apply(from, to, promotion);
        if (played != null) {
            applied++;
        }
        return played;
    }

    @Override
    public void undo() {
        game.undo();
        undone++;
    }

    @Override
    public Color sideToMove() {
        return game.sideToMove();
    }

    @Override
    public boolean inCheck() {
        return game.inCheck();
    }

    @Override
    public boolean isCheckmate() {
        return game.isCheckmate();
    }

    @Override
    public boolean isStalemate() {
        return game.isStalemate();
    }

    @Override
    public boolean isDraw() {
        return game.isDraw();
    }

    @Override
    public boolean isGameOver() {
        return game.isGameOver();
    }

    @Override
    public Piece[][] board() {
        return game.board();
    }

    @Override
    public String fen() {
        return game.fen();
    }
}
