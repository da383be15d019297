package max.chess.ai.search;

import max.chess.ai.game.GameState;
import max.chess.ai.game.Move;
import max.chess.ai.search.difficulty.Difficulty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

final class IterativeDeepening {
    private static final Logger LOG = LoggerFactory.getLogger(IterativeDeepening.class);

    private IterativeDeepening() {}

    /**
     * Deepens from 1 ply to the tier's ceiling, each depth with a fresh node budget and the shared deadline.
     * The returned candidates are ranked at the deepest completed depth, with the final best move first.
     */
    static SearchResult run(GameState state, List<Move> rootMoves, Difficulty difficulty, Clock clock, long startMillis) {
        final long deadline = deadline(startMillis, difficulty);
        final boolean rootMaximizing = state.sideToMove().isWhite();

        RootCandidate best = null;
        List<RootCandidate> ranked = List.of();
        int completedDepth = 0;
        long totalNodes = 0;

        for (int depth = 1; depth <= difficulty.depth(); depth++) {
            SearchBudget budget = new SearchBudget(difficulty.nodeLimit(), deadline, clock);
            RootSearch.DepthResult result = RootSearch.searchAtDepth(state, rootMoves, depth, budget, rootMaximizing, best);
            totalNodes += budget.nodes();
            best = result.best();

            if (result.completed()) {
                ranked = result.ranked();
                completedDepth = depth;
            } else {
                // keep the last full ranking, but what this depth already proved better goes first
                ranked = bestFirst(ranked.isEmpty() ? result.ranked() : ranked, best);
            }

            if (LOG.isDebugEnabled()) {
                LOG.debug("depth {}{} best {} score {} nodes {} time {}ms",
                        depth, result.completed() ? "" : " (interrupted)", best.move(), best.score(),
                        budget.nodes(), clock.millis() - startMillis);
            }
            if (!result.completed() || budget.deadlinePassed()) {
                break;
            }
        }

        return new SearchResult(best.move(), best.score(), completedDepth, totalNodes,
                clock.millis() - startMillis, ranked);
    }

    /** Absolute deadline of the call; a time budget too large to add up means no deadline. */
    static long deadline(long startMillis, Difficulty difficulty) {
        if (!difficulty.hasTimeLimit() || startMillis > SearchBudget.NO_DEADLINE - difficulty.timeMs()) {
            return SearchBudget.NO_DEADLINE;
        }
        return startMillis + difficulty.timeMs();
    }

    private static List<RootCandidate> bestFirst(List<RootCandidate> ranked, RootCandidate best) {
        List<RootCandidate> reordered = new ArrayList<>(ranked.size() + 1);
        reordered.add(best);
        for (RootCandidate candidate : ranked) {
            if (!candidate.move().equals(best.move())) {
                reordered.add(candidate);
            }
        }
        return reordered;
    }
}
