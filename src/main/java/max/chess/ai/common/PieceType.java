package max.chess.ai.common;

public enum PieceType {
    PAWN('p'), KNIGHT('n'), BISHOP('b'), ROOK('r'), QUEEN('q'), KING('k'), NONE(' ');

    public static final PieceType[] REAL_PIECES = {PAWN, KNIGHT, BISHOP, ROOK, QUEEN, KING};
    // Promotion choices, most valuable first
    public static final PieceType[] PROMOTIONS = {QUEEN, ROOK, BISHOP, KNIGHT};

    public final char letter;

    PieceType(char letter) {
        this.letter = letter;
    }

    public boolean isNone() {
        return this == NONE;
    }

    /** Upper case letter used by SAN, empty for pawns. */
    public String sanLetter() {
        return this == PAWN || this == NONE ? "" : String.valueOf(Character.toUpperCase(letter));
    }

    public static PieceType fromLetter(char letter) {
        return switch (Character.toLowerCase(letter)) {
            case 'p' -> PAWN;
            case 'n' -> KNIGHT;
            case 'b' -> BISHOP;
            case 'r' -> ROOK;
            case 'q' -> QUEEN;
            case 'k' -> KING;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
    }
}
