package max.chess.ai.game;

import max.chess.ai.common.Color;
import max.chess.ai.common.Piece;

final class Zobrist {
    private static final long[][][] PIECE_SQUARE = new long[2][6][64];
    private static final long[] CASTLING = new long[16];
    private static final long[] EN_PASSANT_FILE = new long[8];
    private static final long BLACK_TO_MOVE;

    static {
        long seed = 0x2545F4914F6CDD1DL;
        for (int color = 0; color < 2; color++) {
            for (int type = 0; type < 6; type++) {
                for (int square = 0; square < 64; square++) {
                    seed = mix(seed);
                    PIECE_SQUARE[color][type][square] = seed;
                }
            }
        }
        for (int i = 0; i < CASTLING.length; i++) {
            seed = mix(seed);
            CASTLING[i] = seed;
        }
        for (int i = 0; i < EN_PASSANT_FILE.length; i++) {
            seed = mix(seed);
            EN_PASSANT_FILE[i] = seed;
        }
        BLACK_TO_MOVE = mix(seed);
    }

    private Zobrist() {}

    /** SplitMix64 step. */
    private static long mix(long z) {
        z += 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    /**
     * Full hash of the position. The en passant file only counts when the side to move
     * could actually capture, so positions that only differ by a dead en passant square repeat.
     */
    static long hash(Piece[] squares, Color sideToMove, int castlingRights, int enPassantFile) {
        long key = 0;
        for (int square = 0; square < 64; square++) {
            Piece piece = squares[square];
            if (piece != null) {
                key ^= PIECE_SQUARE[piece.color().ordinal()][piece.type().ordinal()][square];
            }
        }
        key ^= CASTLING[castlingRights & 0xF];
        if (enPassantFile >= 0) {
            key ^= EN_PASSANT_FILE[enPassantFile];
        }
        if (sideToMove == Color.BLACK) {
            key ^= BLACK_TO_MOVE;
        }
        return key;
    }
}
