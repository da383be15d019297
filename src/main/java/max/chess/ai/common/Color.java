package max.chess.ai.common;

public enum Color {
    WHITE(1, 'w'), BLACK(-1, 'b');

    // +1 for white, -1 for black: scores are always from white's point of view
    public final int sign;
    public final char fenLetter;

    Color(int sign, char fenLetter) {
        this.sign = sign;
        this.fenLetter = fenLetter;
    }

    public Color opposite() {
        return this == WHITE ? BLACK : WHITE;
    }

    public boolean isWhite() {
        return this == WHITE;
    }

    public static Color fromFenLetter(char letter) {
        return switch (letter) {
            case 'w', 'W' -> WHITE;
            case 'b', 'B' -> BLACK;
            default -> throw new IllegalArgumentException("Unknown side to move " + letter);
        };
    }
}
