package max.chess.ai.game;

import max.chess.ai.common.PieceType;
import max.chess.ai.common.Square;

import java.util.Objects;

/**
 * A move as handed out by the rules engine. {@code captured} and {@code promotion} are
 * {@link PieceType#NONE} when absent, {@code san} is the standard algebraic notation.
 */
public record Move(int from, int to, PieceType piece, PieceType captured, PieceType promotion, String san) {

    public Move {
        Objects.requireNonNull(piece, "piece");
        Objects.requireNonNull(captured, "captured");
        Objects.requireNonNull(promotion, "promotion");
    }

    public boolean isCapture() {
        return !captured.isNone();
    }

    public boolean isPromotion() {
        return !promotion.isNone();
    }

    Move withSan(String san) {
        return new Move(from, to, piece, captured, promotion, san);
    }

    /** Long algebraic form, e.g. e2e4 or e7e8q. */
    public String uci() {
        String promotionLetter = isPromotion() ? String.valueOf(promotion.letter) : "";
        return Square.name(from) + Square.name(to) + promotionLetter;
    }

    @Override
    public String toString() {
        return san != null ? san : uci();
    }
}
