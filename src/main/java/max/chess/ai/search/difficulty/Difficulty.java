package max.chess.ai.search.difficulty;

import java.util.Objects;

/**
 * One difficulty tier.
 *
 * @param depth      iterative deepening ceiling, in plies
 * @param nodeLimit  nodes allowed per depth iteration, 0 for no limit
 * @param randomness fraction of the ranked root moves the final pick is drawn from, 0 picks the best
 * @param timeMs     time budget for the whole call, 0 for no limit
 */
public record Difficulty(String name, int depth, long nodeLimit, double randomness, long timeMs) {

    public Difficulty {
        Objects.requireNonNull(name, "name");
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1 for " + name);
        }
        if (nodeLimit < 0) {
            throw new IllegalArgumentException("nodeLimit must not be negative for " + name);
        }
        if (!(randomness >= 0 && randomness <= 1)) {
            throw new IllegalArgumentException("randomness must be within [0, 1] for " + name);
        }
        if (timeMs < 0) {
            throw new IllegalArgumentException("timeMs must not be negative for " + name);
        }
    }

    public boolean hasTimeLimit() {
        return timeMs > 0;
    }

    public boolean hasNodeLimit() {
        return nodeLimit > 0;
    }
}
