package max.chess.ai.search;

import max.chess.ai.game.GameState;
import max.chess.ai.game.Move;
import max.chess.ai.search.difficulty.Difficulties;
import max.chess.ai.search.difficulty.Difficulty;
import max.chess.ai.search.difficulty.DifficultyPolicy;
import max.chess.ai.search.evaluator.GameValues;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Picks a move for the side to move at a given difficulty. Every call owns its own budgets, so the
 * facade keeps no state between calls apart from its random source.
 * <p>
 * The position is played on and restored in place: nothing else may touch it during a call.
 */
public final class SearchFacade {

    private final Difficulties difficulties;
    private final RandomGenerator random;
    private final Clock clock;

    public SearchFacade() {
        this(Difficulties.load(), new Random(), Clock.systemUTC());
    }

    public SearchFacade(Difficulties difficulties, RandomGenerator random, Clock clock) {
        this.difficulties = Objects.requireNonNull(difficulties, "difficulties");
        this.random = Objects.requireNonNull(random, "random");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** The move to play, or null if the game is already over. */
    public Move findBestMove(GameState state, String difficultyName) {
        return search(state, difficultyName).move();
    }

    public SearchResult search(GameState state, String difficultyName) {
        final long start = clock.millis();
        if (state.isCheckmate() || state.isDraw()) {
            return SearchResult.NO_MOVE;
        }

        Difficulty difficulty = difficulties.resolve(difficultyName);
        List<Move> rootMoves = MoveOrdering.orderedLegalMoves(state);
        if (rootMoves.isEmpty()) {
            return SearchResult.NO_MOVE;
        }

        Move mate = RootSearch.findMateInOne(state, rootMoves);
        if (mate != null) {
            int score = state.sideToMove().sign * GameValues.CHECKMATE_VALUE;
            return new SearchResult(mate, score, 1, 0, clock.millis() - start, List.of(new RootCandidate(mate, score)));
        }

        SearchResult deepened = IterativeDeepening.run(state, rootMoves, difficulty, clock, start);
        RootCandidate pick = DifficultyPolicy.select(deepened.candidates(), difficulty.randomness(), random);
        return new SearchResult(pick.move(), pick.score(), deepened.depth(), deepened.nodes(),
                clock.millis() - start, deepened.candidates());
    }

    public Difficulties difficulties() {
        return difficulties;
    }
}
