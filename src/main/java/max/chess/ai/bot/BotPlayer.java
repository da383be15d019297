package max.chess.ai.bot;

import max.chess.ai.game.GameState;
import max.chess.ai.game.Move;
import max.chess.ai.search.SearchFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * The automated player as a host sees it: asks the search for a move and, if the requested tier
 * blows up, tries once more at the default tier before giving up with no move.
 */
public class BotPlayer {
    private static final Logger LOG = LoggerFactory.getLogger(BotPlayer.class);

    private final SearchFacade search;

    public BotPlayer() {
        this(new SearchFacade());
    }

    public BotPlayer(SearchFacade search) {
        this.search = search;
    }

    public Move chooseMove(GameState state, String difficulty) {
        try {
            return search.findBestMove(state, difficulty);
        } catch (RuntimeException e) {
            String fallback = defaultDifficulty();
            LOG.error("Search at difficulty {} failed, falling back to {}", difficulty, fallback, e);
            if (difficulty != null && fallback.equals(difficulty.trim().toLowerCase(Locale.ROOT))) {
                return null;
            }
            try {
                return search.findBestMove(state, fallback);
            } catch (RuntimeException fallbackFailure) {
                LOG.error("Fallback search at difficulty {} failed too, no move played", fallback, fallbackFailure);
                return null;
            }
        }
    }

    /** The fallback tier of the configured difficulties, {@code default=} in the properties if set. */
    public String defaultDifficulty() {
        return search.difficulties().defaultTier().name();
    }
}
