package max.chess.ai.search;

import max.chess.ai.game.DelegatingGameState;
import max.chess.ai.game.Game;
import max.chess.ai.game.Move;
import max.chess.ai.game.notation.FENUtils;
import max.chess.ai.search.evaluator.GameValues;
import max.chess.ai.search.evaluator.PositionEvaluator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static max.chess.ai.search.SearchConstants.INF;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MinimaxTest {
    private static final String KIWIPETE = "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1";

    @Test
    public void depthZeroIsTheStaticEvaluation() {
        Game game = FENUtils.fromFen(KIWIPETE);
        int expected = PositionEvaluator.evaluate(game);

        assertEquals(expected, Minimax.search(game, 0, -INF, INF, true, SearchBudget.unlimited()));
        assertEquals(expected, Minimax.search(game, 0, -INF, INF, false, SearchBudget.unlimited()));
        assertEquals(expected, Minimax.search(game, 0, 0, 1, true, SearchBudget.unlimited()));
    }

    @ParameterizedTest
    @CsvSource({
            "r1bqkbnr/pppp1ppp/2n5/4p3/4P3/5N2/PPPP1PPP/RNBQKB1R w KQkq - 2 3, 2",
            "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1, 2",
            "8/5k2/3p4/2p1p3/4P3/2NK4/8/8 w - - 0 1, 3",
            "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 b - - 0 1, 3",
    })
    public void pruningDoesNotChangeTheValue(String fen, int depth) {
        Game game = FENUtils.fromFen(fen);
        boolean maximizing = game.sideToMove().isWhite();

        int pruned = Minimax.search(game, depth, -INF, INF, maximizing, SearchBudget.unlimited());
        int plain = plainMinimax(game, depth, maximizing);

        assertEquals(plain, pruned);
        assertEquals(fen, game.fen());
    }

    @Test
    public void findsTheMateOnePlyAhead() {
        Game game = FENUtils.fromFen("6k1/5ppp/8/8/8/8/5PPP/R5K1 w - - 0 1");

        assertEquals(GameValues.CHECKMATE_VALUE, Minimax.search(game, 1, -INF, INF, true, SearchBudget.unlimited()));
    }

    @Test
    public void neverVisitsMoreNodesThanTheLimit() {
        Game game = Game.newStandardGame();
        SearchBudget budget = new SearchBudget(50, SearchBudget.NO_DEADLINE, Clock.systemUTC());

        Minimax.search(game, 4, -INF, INF, true, budget);

        assertEquals(50, budget.nodes());
        assertTrue(budget.nodesExhausted());
        assertEquals(Game.STANDARD_START_FEN, game.fen());
    }

    @Test
    public void passedDeadlineFallsBackToTheEvaluation() {
        Game game = FENUtils.fromFen(KIWIPETE);
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_000), ZoneOffset.UTC);
        SearchBudget budget = new SearchBudget(0, 500, clock);

        int value = Minimax.search(game, 5, -INF, INF, true, budget);

        assertEquals(PositionEvaluator.evaluate(game), value);
        assertEquals(0, budget.nodes());
    }

    @Test
    public void everyAppliedMoveIsUndone() {
        DelegatingGameState state = new DelegatingGameState(FENUtils.fromFen(KIWIPETE));

        Minimax.search(state, 3, -INF, INF, true, new SearchBudget(2_000, SearchBudget.NO_DEADLINE, Clock.systemUTC()));

        assertTrue(state.applied > 0);
        assertEquals(state.applied, state.undone);
        assertEquals(KIWIPETE, state.fen());
    }

    @Test
    public void deadlineHitMidSearchLeavesThePositionIntact() {
        Game game = FENUtils.fromFen(KIWIPETE);
        TickingClock clock = new TickingClock(0, 1);

        Minimax.search(game, 6, -INF, INF, true, new SearchBudget(0, 200, clock));

        assertEquals(KIWIPETE, game.fen());
    }

    private static int plainMinimax(Game game, int depth, boolean maximizing) {
        if (depth == 0 || game.isGameOver()) {
            return PositionEvaluator.evaluate(game);
        }
        List<Move> moves = game.legalMoves();
        if (moves.isEmpty()) {
            return PositionEvaluator.evaluate(game);
        }
        int best = maximizing ? -INF : INF;
        for (Move move : moves) {
            game.apply(move);
            int value = plainMinimax(game, depth - 1, !maximizing);
            game.undo();
            best = maximizing ? Math.max(best, value) : Math.min(best, value);
        }
        return best;
    }
}
