package max.chess.ai.search.difficulty;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Final pick among the ranked root candidates: uniform over the top
 * {@code max(1, round(n * randomness))} entries.
 */
public final class DifficultyPolicy {

    private DifficultyPolicy() {}

    public static <T> T select(List<T> ranked, double randomness, RandomGenerator random) {
        if (ranked.isEmpty()) {
            throw new IllegalArgumentException("Nothing to select from");
        }
        if (randomness <= 0 || ranked.size() == 1) {
            return ranked.get(0);
        }
        return ranked.get(random.nextInt(windowSize(ranked.size(), randomness)));
    }

    static int windowSize(int candidates, double randomness) {
        long window = Math.round(candidates * randomness);
        return (int) Math.max(1, Math.min(candidates, window));
    }
}
