package max.chess.ai.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Legal move enumeration that cannot fail: a rules engine that throws, or hands back null,
 * is treated as having no moves.
 */
public final class SafeMoves {
    private static final Logger LOG = LoggerFactory.getLogger(SafeMoves.class);

    private SafeMoves() {}

    public static List<Move> legal(GameState state) {
        try {
            List<Move> moves = state.legalMoves();
            return moves != null ? moves : List.of();
        } catch (RuntimeException e) {
            LOG.debug("Move enumeration failed on {}, treating it as no moves", state.getClass().getSimpleName(), e);
            return List.of();
        }
    }
}
