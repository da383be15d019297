package max.chess.ai.search;

import max.chess.ai.game.Move;

public record RootCandidate(Move move, int score) {
    @Override
    public String toString() {
        return move + " " + score;
    }
}
