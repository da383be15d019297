package max.chess.ai.game.notation;

import max.chess.ai.common.PieceType;
import max.chess.ai.common.Square;
import max.chess.ai.game.Move;

import java.util.List;

public final class MoveIOUtils {

    private MoveIOUtils() {}

    /**
     * Standard algebraic notation of a legal move.
     *
     * @param rivalOrigins origins of the other pieces of the same type that can legally reach the same square
     * @param checkSuffix  "", "+" or "#"
     */
    public static String writeSan(Move move, List<Integer> rivalOrigins, String checkSuffix) {
        if (move.piece() == PieceType.KING && Math.abs(move.to() - move.from()) == 2) {
            return (move.to() > move.from() ? "O-O" : "O-O-O") + checkSuffix;
        }

        StringBuilder san = new StringBuilder(8);
        if (move.piece() == PieceType.PAWN) {
            if (move.isCapture()) {
                san.append(Square.fileLetter(move.from()));
            }
        } else {
            san.append(move.piece().sanLetter());
            appendDisambiguation(san, move.from(), rivalOrigins);
        }
        if (move.isCapture()) {
            san.append('x');
        }
        san.append(Square.name(move.to()));
        if (move.isPromotion()) {
            san.append('=').append(move.promotion().sanLetter());
        }
        return san.append(checkSuffix).toString();
    }

    private static void appendDisambiguation(StringBuilder san, int from, List<Integer> rivalOrigins) {
        if (rivalOrigins.isEmpty()) {
            return;
        }
        boolean sharesFile = false;
        boolean sharesRank = false;
        for (int rival : rivalOrigins) {
            sharesFile |= Square.file(rival) == Square.file(from);
            sharesRank |= Square.rank(rival) == Square.rank(from);
        }
        if (!sharesFile) {
            san.append(Square.fileLetter(from));
        } else if (!sharesRank) {
            san.append(Square.rankDigit(from));
        } else {
            san.append(Square.name(from));
        }
    }

    /** Parses long algebraic notation (e2e4, e7e8q) into origin, target and promotion. */
    public static ParsedMove parseUci(String notation) {
        if (notation == null || (notation.length() != 4 && notation.length() != 5)) {
            throw new IllegalArgumentException("Cannot parse move " + notation);
        }
        int from = Square.parse(notation.substring(0, 2));
        int to = Square.parse(notation.substring(2, 4));
        PieceType promotion = notation.length() == 5 ? PieceType.fromLetter(notation.charAt(4)) : PieceType.NONE;
        return new ParsedMove(from, to, promotion);
    }

    public record ParsedMove(int from, int to, PieceType promotion) {}
}
