package max.chess.ai.bot;

import max.chess.ai.game.Game;
import max.chess.ai.game.Move;
import max.chess.ai.game.notation.FENUtils;

/**
 * Usage: {@code Main ["<fen>"] [difficulty]}. Prints the chosen move as "SAN UCI", or "(none)".
 */
public class Main {
    public static void main(String[] args) {
        String fen = args.length > 0 ? args[0] : Game.STANDARD_START_FEN;

        Game game;
        try {
            game = FENUtils.fromFen(fen);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }

        BotPlayer bot = new BotPlayer();
        String difficulty = args.length > 1 ? args[1] : bot.defaultDifficulty();
        Move move = bot.chooseMove(game, difficulty);
        System.out.println(move == null ? "(none)" : move.san() + " " + move.uci());
    }
}
