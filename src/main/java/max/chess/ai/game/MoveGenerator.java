package max.chess.ai.game;

import max.chess.ai.common.Color;
import max.chess.ai.common.Piece;
import max.chess.ai.common.PieceType;
import max.chess.ai.common.Square;

import java.util.ArrayList;
import java.util.List;

/**
 * Pseudo-legal move generation and attack detection on a plain 64 square array.
 * Legality (own king left in check) is checked by {@link Game}.
 */
final class MoveGenerator {
    private static final int[][] KNIGHT_STEPS = {{1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}};
    private static final int[][] KING_STEPS = {{1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}};
    private static final int[][] ROOK_RAYS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
    private static final int[][] BISHOP_RAYS = {{1, 1}, {-1, 1}, {1, -1}, {-1, -1}};

    private MoveGenerator() {}

    /** Moves are produced square by square from a1 to h8, in a stable order. */
    static List<Move> generate(Game game) {
        List<Move> moves = new ArrayList<>(48);
        Piece[] squares = game.squares;
        Color us = game.sideToMove();
        for (int square = 0; square < 64; square++) {
            Piece piece = squares[square];
            if (piece == null || piece.color() != us) {
                continue;
            }
            switch (piece.type()) {
                case PAWN -> addPawnMoves(game, square, us, moves);
                case KNIGHT -> addSteps(squares, square, piece, KNIGHT_STEPS, moves);
                case BISHOP -> addRays(squares, square, piece, BISHOP_RAYS, moves);
                case ROOK -> addRays(squares, square, piece, ROOK_RAYS, moves);
                case QUEEN -> {
                    addRays(squares, square, piece, ROOK_RAYS, moves);
                    addRays(squares, square, piece, BISHOP_RAYS, moves);
                }
                case KING -> {
                    addSteps(squares, square, piece, KING_STEPS, moves);
                    addCastles(game, square, us, moves);
                }
                default -> throw new IllegalStateException("Unexpected piece " + piece);
            }
        }
        return moves;
    }

    private static void addPawnMoves(Game game, int from, Color us, List<Move> moves) {
        Piece[] squares = game.squares;
        int direction = us.isWhite() ? 1 : -1;
        int startRank = us.isWhite() ? 1 : 6;
        int lastRank = us.isWhite() ? 7 : 0;
        int file = Square.file(from);
        int rank = Square.rank(from);

        int oneRank = rank + direction;
        if (!Square.onBoard(file, oneRank)) {
            return;
        }
        int oneStep = Square.of(file, oneRank);
        if (squares[oneStep] == null) {
            addPawnMove(from, oneStep, PieceType.NONE, oneRank == lastRank, moves);
            int twoStep = Square.of(file, rank + 2 * direction);
            if (rank == startRank && squares[twoStep] == null) {
                moves.add(quiet(from, twoStep, PieceType.PAWN));
            }
        }
        for (int side = -1; side <= 1; side += 2) {
            if (!Square.onBoard(file + side, oneRank)) {
                continue;
            }
            int target = Square.of(file + side, oneRank);
            Piece victim = squares[target];
            if (victim != null && victim.color() != us) {
                addPawnMove(from, target, victim.type(), oneRank == lastRank, moves);
            } else if (victim == null && target == game.enPassantSquare()) {
                moves.add(new Move(from, target, PieceType.PAWN, PieceType.PAWN, PieceType.NONE, null));
            }
        }
    }

    private static void addPawnMove(int from, int to, PieceType captured, boolean promotes, List<Move> moves) {
        if (promotes) {
            for (PieceType promotion : PieceType.PROMOTIONS) {
                moves.add(new Move(from, to, PieceType.PAWN, captured, promotion, null));
            }
        } else {
            moves.add(new Move(from, to, PieceType.PAWN, captured, PieceType.NONE, null));
        }
    }

    private static void addSteps(Piece[] squares, int from, Piece piece, int[][] steps, List<Move> moves) {
        int file = Square.file(from);
        int rank = Square.rank(from);
        for (int[] step : steps) {
            int toFile = file + step[0];
            int toRank = rank + step[1];
            if (!Square.onBoard(toFile, toRank)) {
                continue;
            }
            int to = Square.of(toFile, toRank);
            Piece target = squares[to];
            if (target == null) {
                moves.add(quiet(from, to, piece.type()));
            } else if (target.color() != piece.color()) {
                moves.add(capture(from, to, piece.type(), target.type()));
            }
        }
    }

    private static void addRays(Piece[] squares, int from, Piece piece, int[][] rays, List<Move> moves) {
        int file = Square.file(from);
        int rank = Square.rank(from);
        for (int[] ray : rays) {
            int toFile = file + ray[0];
            int toRank = rank + ray[1];
            while (Square.onBoard(toFile, toRank)) {
                int to = Square.of(toFile, toRank);
                Piece target = squares[to];
                if (target == null) {
                    moves.add(quiet(from, to, piece.type()));
                } else {
                    if (target.color() != piece.color()) {
                        moves.add(capture(from, to, piece.type(), target.type()));
                    }
                    break;
                }
                toFile += ray[0];
                toRank += ray[1];
            }
        }
    }

    private static void addCastles(Game game, int kingSquare, Color us, List<Move> moves) {
        int home = us.isWhite() ? 4 : 60;
        if (kingSquare != home) {
            return;
        }
        int rights = game.castlingRights();
        int kingSide = us.isWhite() ? Game.WHITE_KING_SIDE : Game.BLACK_KING_SIDE;
        int queenSide = us.isWhite() ? Game.WHITE_QUEEN_SIDE : Game.BLACK_QUEEN_SIDE;
        if ((rights & (kingSide | queenSide)) == 0) {
            return;
        }
        Piece[] squares = game.squares;
        Color them = us.opposite();
        if (isAttacked(squares, home, them)) {
            return;
        }
        Piece rook = Piece.of(PieceType.ROOK, us);
        if ((rights & kingSide) != 0
                && rook.equals(squares[home + 3])
                && squares[home + 1] == null && squares[home + 2] == null
                && !isAttacked(squares, home + 1, them) && !isAttacked(squares, home + 2, them)) {
            moves.add(quiet(home, home + 2, PieceType.KING));
        }
        if ((rights & queenSide) != 0
                && rook.equals(squares[home - 4])
                && squares[home - 1] == null && squares[home - 2] == null && squares[home - 3] == null
                && !isAttacked(squares, home - 1, them) && !isAttacked(squares, home - 2, them)) {
            moves.add(quiet(home, home - 2, PieceType.KING));
        }
    }

    private static Move quiet(int from, int to, PieceType piece) {
        return new Move(from, to, piece, PieceType.NONE, PieceType.NONE, null);
    }

    private static Move capture(int from, int to, PieceType piece, PieceType captured) {
        return new Move(from, to, piece, captured, PieceType.NONE, null);
    }

    /** Is {@code square} attacked by any piece of color {@code by}. */
    static boolean isAttacked(Piece[] squares, int square, Color by) {
        if (square == Square.NONE) {
            return false;
        }
        int file = Square.file(square);
        int rank = Square.rank(square);

        // pawns attack diagonally forward, so look one rank behind from the attacker's side
        int pawnRank = rank - (by.isWhite() ? 1 : -1);
        for (int side = -1; side <= 1; side += 2) {
            if (Square.onBoard(file + side, pawnRank)
                    && isPiece(squares[Square.of(file + side, pawnRank)], PieceType.PAWN, by)) {
                return true;
            }
        }
        if (stepAttack(squares, file, rank, KNIGHT_STEPS, PieceType.KNIGHT, by)
                || stepAttack(squares, file, rank, KING_STEPS, PieceType.KING, by)) {
            return true;
        }
        return rayAttack(squares, file, rank, ROOK_RAYS, PieceType.ROOK, by)
                || rayAttack(squares, file, rank, BISHOP_RAYS, PieceType.BISHOP, by);
    }

    private static boolean stepAttack(Piece[] squares, int file, int rank, int[][] steps, PieceType type, Color by) {
        for (int[] step : steps) {
            int f = file + step[0];
            int r = rank + step[1];
            if (Square.onBoard(f, r) && isPiece(squares[Square.of(f, r)], type, by)) {
                return true;
            }
        }
        return false;
    }

    // sliderType is ROOK or BISHOP; queens attack along both
    private static boolean rayAttack(Piece[] squares, int file, int rank, int[][] rays, PieceType sliderType, Color by) {
        for (int[] ray : rays) {
            int f = file + ray[0];
            int r = rank + ray[1];
            while (Square.onBoard(f, r)) {
                Piece piece = squares[Square.of(f, r)];
                if (piece != null) {
                    if (piece.color() == by && (piece.type() == sliderType || piece.type() == PieceType.QUEEN)) {
                        return true;
                    }
                    break;
                }
                f += ray[0];
                r += ray[1];
            }
        }
        return false;
    }

    private static boolean isPiece(Piece piece, PieceType type, Color color) {
        return piece != null && piece.type() == type && piece.color() == color;
    }
}
