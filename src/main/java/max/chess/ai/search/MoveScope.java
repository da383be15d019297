package max.chess.ai.search;

import max.chess.ai.game.GameState;
import max.chess.ai.game.Move;

/**
 * A move played on the shared position for the duration of a try-with-resources block.
 * Closing undoes it, whatever way the block is left.
 */
final class MoveScope implements AutoCloseable {
    private final GameState state;

    private MoveScope(GameState state) {
        this.state = state;
    }

    static MoveScope play(GameState state, Move move) {
        if (state.apply(move) == null) {
            // the move came from the same rules engine's legal list
            throw new IllegalStateException("Rules engine rejected its own legal move " + move + " in " + state.fen());
        }
        return new MoveScope(state);
    }

    @Override
    public void close() {
        state.undo();
    }
}
