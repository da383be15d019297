package max.chess.ai.common;

public record Piece(PieceType type, Color color) {
    private static final Piece[][] CACHE = new Piece[2][PieceType.REAL_PIECES.length];
    static {
        for (Color color : Color.values()) {
            for (PieceType type : PieceType.REAL_PIECES) {
                CACHE[color.ordinal()][type.ordinal()] = new Piece(type, color);
            }
        }
    }

    public Piece {
        if (type == null || type.isNone() || color == null) {
            throw new IllegalArgumentException("A piece needs a real type and a color");
        }
    }

    public static Piece of(PieceType type, Color color) {
        return CACHE[color.ordinal()][type.ordinal()];
    }

    /** FEN letter: upper case for white, lower case for black. */
    public char fenLetter() {
        return color.isWhite() ? Character.toUpperCase(type.letter) : type.letter;
    }

    public static Piece fromFenLetter(char letter) {
        Color color = Character.isUpperCase(letter) ? Color.WHITE : Color.BLACK;
        return of(PieceType.fromLetter(letter), color);
    }

    @Override
    public String toString() {
        return String.valueOf(fenLetter());
    }
}
