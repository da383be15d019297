package max.chess.ai.common;

/**
 * Squares are plain ints: a1 = 0, b1 = 1, ..., h8 = 63.
 */
public final class Square {
    public static final int NONE = -1;

    private Square() {}

    public static int of(int file, int rank) {
        return rank * 8 + file;
    }

    public static int file(int square) {
        return square & 7;
    }

    public static int rank(int square) {
        return square >>> 3;
    }

    public static boolean onBoard(int file, int rank) {
        return file >= 0 && file < 8 && rank >= 0 && rank < 8;
    }

    public static char fileLetter(int square) {
        return (char) ('a' + file(square));
    }

    public static char rankDigit(int square) {
        return (char) ('1' + rank(square));
    }

    public static String name(int square) {
        return "" + fileLetter(square) + rankDigit(square);
    }

    public static int parse(String name) {
        if (name == null || name.length() != 2) {
            throw new IllegalArgumentException("Invalid square " + name);
        }
        int file = name.charAt(0) - 'a';
        int rank = name.charAt(1) - '1';
        if (!onBoard(file, rank)) {
            throw new IllegalArgumentException("Invalid square " + name);
        }
        return of(file, rank);
    }

    public static boolean isLight(int square) {
        return ((file(square) + rank(square)) & 1) == 1;
    }
}
