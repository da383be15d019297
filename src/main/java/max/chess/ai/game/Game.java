package max.chess.ai.game;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import max.chess.ai.common.Color;
import max.chess.ai.common.Piece;
import max.chess.ai.common.PieceType;
import max.chess.ai.common.Square;
import max.chess.ai.game.notation.FENUtils;
import max.chess.ai.game.notation.MoveIOUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Standard chess rules on a 64 square array. This is the rules engine the search plays against;
 * the search itself only sees it through {@link GameState}.
 */
public class Game implements GameState {
    public static final String STANDARD_START_FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    public static final int WHITE_KING_SIDE = 1;
    public static final int WHITE_QUEEN_SIDE = 2;
    public static final int BLACK_KING_SIDE = 4;
    public static final int BLACK_QUEEN_SIDE = 8;

    // Rights kept when a move touches a square: moving the king or a rook, or capturing a rook at home
    private static final int[] CASTLING_KEPT = new int[64];
    static {
        Arrays.fill(CASTLING_KEPT, 0xF);
        CASTLING_KEPT[0] &= ~WHITE_QUEEN_SIDE;
        CASTLING_KEPT[7] &= ~WHITE_KING_SIDE;
        CASTLING_KEPT[4] &= ~(WHITE_KING_SIDE | WHITE_QUEEN_SIDE);
        CASTLING_KEPT[56] &= ~BLACK_QUEEN_SIDE;
        CASTLING_KEPT[63] &= ~BLACK_KING_SIDE;
        CASTLING_KEPT[60] &= ~(BLACK_KING_SIDE | BLACK_QUEEN_SIDE);
    }

    private record Undo(Move move, Piece moved, Piece captured, int capturedSquare,
                        int castlingRights, int enPassantSquare, int halfMoveClock, int fullMoveNumber) {}

    final Piece[] squares = new Piece[64];
    private final int[] kingSquare = {Square.NONE, Square.NONE};
    private Color sideToMove = Color.WHITE;
    private int castlingRights;
    private int enPassantSquare = Square.NONE;
    private int halfMoveClock = 0;
    private int fullMoveNumber = 1;

    // Both exploratory (legality) and played moves go on this stack
    private final Deque<Undo> undoStack = new ArrayDeque<>();
    // Keys of every position reached by played moves, the current one last
    private final LongArrayList keyHistory = new LongArrayList();

    /** An empty board, white to move. Use {@link FENUtils} or {@link #newStandardGame()} for real positions. */
    public Game() {
        resetHistory();
    }

    public static Game newStandardGame() {
        return FENUtils.fromFen(STANDARD_START_FEN);
    }

    // ---------------------------------------------------------------- GameState

    @Override
    public List<Move> legalMoves() {
        return buildLegalMoves(Square.NONE);
    }

    @Override
    public List<Move> legalMoves(int fromSquare) {
        return buildLegalMoves(fromSquare);
    }

    @Override
    public Move apply(Move move) {
        return apply(move.from(), move.to(), move.promotion());
    }

    @Override
    public Move apply(int from, int to, PieceType promotion) {
        PieceType requested = promotion == null ? PieceType.NONE : promotion;
        for (Move candidate : legalMoves(from)) {
            if (candidate.to() != to) {
                continue;
            }
            // a promotion without an explicit piece defaults to a queen
            if (candidate.promotion() == requested
                    || (requested.isNone() && candidate.promotion() == PieceType.QUEEN)) {
                makeRaw(candidate);
                keyHistory.add(computeKey());
                return candidate;
            }
        }
        return null;
    }

    @Override
    public void undo() {
        if (keyHistory.size() <= 1 || undoStack.isEmpty()) {
            throw new IllegalStateException("No move to undo");
        }
        keyHistory.removeLong(keyHistory.size() - 1);
        unmakeRaw();
    }

    @Override
    public Color sideToMove() {
        return sideToMove;
    }

    @Override
    public boolean inCheck() {
        return MoveGenerator.isAttacked(squares, kingSquare[sideToMove.ordinal()], sideToMove.opposite());
    }

    @Override
    public boolean isCheckmate() {
        return inCheck() && !hasLegalMove();
    }

    @Override
    public boolean isStalemate() {
        return !inCheck() && !hasLegalMove();
    }

    @Override
    public boolean isDraw() {
        return halfMoveClock >= 100
                || isStalemate()
                || isInsufficientMaterial()
                || isThreefoldRepetition();
    }

    @Override
    public boolean isGameOver() {
        return isCheckmate() || isDraw();
    }

    @Override
    public Piece[][] board() {
        Piece[][] grid = new Piece[8][8];
        for (int square = 0; square < 64; square++) {
            grid[7 - Square.rank(square)][Square.file(square)] = squares[square];
        }
        return grid;
    }

    @Override
    public String fen() {
        return FENUtils.toFen(this);
    }

    // ---------------------------------------------------------------- draws

    public boolean isThreefoldRepetition() {
        int last = keyHistory.size() - 1;
        long current = keyHistory.getLong(last);
        // nothing before the last pawn move or capture can repeat
        int oldest = Math.max(0, last - halfMoveClock);
        int count = 0;
        for (int i = last; i >= oldest; i -= 2) {
            if (keyHistory.getLong(i) == current) {
                count++;
            }
        }
        return count >= 3;
    }

    public boolean isInsufficientMaterial() {
        int knights = 0;
        int bishops = 0;
        boolean lightBishop = false;
        boolean darkBishop = false;
        for (int square = 0; square < 64; square++) {
            Piece piece = squares[square];
            if (piece == null) {
                continue;
            }
            switch (piece.type()) {
                case PAWN, ROOK, QUEEN -> {
                    return false;
                }
                case KNIGHT -> knights++;
                case BISHOP -> {
                    bishops++;
                    if (Square.isLight(square)) {
                        lightBishop = true;
                    } else {
                        darkBishop = true;
                    }
                }
                default -> { }
            }
        }
        if (knights + bishops <= 1) {
            return true;
        }
        // any number of bishops, all on the same square color
        return knights == 0 && !(lightBishop && darkBishop);
    }

    // ---------------------------------------------------------------- move generation

    private List<Move> buildLegalMoves(int fromFilter) {
        List<Move> pseudoLegal = MoveGenerator.generate(this);
        List<Move> legal = new ArrayList<>(pseudoLegal.size());
        for (Move move : pseudoLegal) {
            if (fromFilter != Square.NONE && move.from() != fromFilter) {
                continue;
            }
            String checkSuffix = checkSuffixIfLegal(move);
            if (checkSuffix != null) {
                List<Integer> rivals = rivalOrigins(move, pseudoLegal);
                legal.add(move.withSan(MoveIOUtils.writeSan(move, rivals, checkSuffix)));
            }
        }
        return legal;
    }

    /** Returns null if the move leaves our own king in check, else "", "+" or "#". */
    private String checkSuffixIfLegal(Move move) {
        Color mover = sideToMove;
        makeRaw(move);
        try {
            if (MoveGenerator.isAttacked(squares, kingSquare[mover.ordinal()], mover.opposite())) {
                return null;
            }
            if (!inCheck()) {
                return "";
            }
            return hasLegalMove() ? "+" : "#";
        } finally {
            unmakeRaw();
        }
    }

    private List<Integer> rivalOrigins(Move move, List<Move> pseudoLegal) {
        if (move.piece() == PieceType.PAWN || move.piece() == PieceType.KING) {
            return List.of();
        }
        List<Integer> rivals = new ArrayList<>(2);
        for (Move other : pseudoLegal) {
            if (other.to() == move.to() && other.piece() == move.piece()
                    && other.from() != move.from() && !rivals.contains(other.from()) && isLegal(other)) {
                rivals.add(other.from());
            }
        }
        return rivals;
    }

    private boolean hasLegalMove() {
        for (Move move : MoveGenerator.generate(this)) {
            if (isLegal(move)) {
                return true;
            }
        }
        return false;
    }

    private boolean isLegal(Move move) {
        Color mover = sideToMove;
        makeRaw(move);
        try {
            return !MoveGenerator.isAttacked(squares, kingSquare[mover.ordinal()], mover.opposite());
        } finally {
            unmakeRaw();
        }
    }

    // ---------------------------------------------------------------- make / unmake

    private void makeRaw(Move move) {
        int from = move.from();
        int to = move.to();
        Piece moved = squares[from];
        Piece captured = squares[to];
        int capturedSquare = to;
        if (moved.type() == PieceType.PAWN && captured == null && Square.file(from) != Square.file(to)) {
            capturedSquare = to + (moved.color().isWhite() ? -8 : 8);
            captured = squares[capturedSquare];
        }
        undoStack.push(new Undo(move, moved, captured, capturedSquare,
                castlingRights, enPassantSquare, halfMoveClock, fullMoveNumber));

        if (captured != null) {
            squares[capturedSquare] = null;
        }
        squares[from] = null;
        squares[to] = move.isPromotion() ? Piece.of(move.promotion(), moved.color()) : moved;

        if (moved.type() == PieceType.KING) {
            kingSquare[moved.color().ordinal()] = to;
            if (to - from == 2) {
                relocate(from + 3, from + 1);
            } else if (from - to == 2) {
                relocate(from - 4, from - 1);
            }
        }

        castlingRights &= CASTLING_KEPT[from] & CASTLING_KEPT[to];
        enPassantSquare = moved.type() == PieceType.PAWN && Math.abs(to - from) == 16 ? (from + to) / 2 : Square.NONE;
        halfMoveClock = moved.type() == PieceType.PAWN || captured != null ? 0 : halfMoveClock + 1;
        if (sideToMove == Color.BLACK) {
            fullMoveNumber++;
        }
        sideToMove = sideToMove.opposite();
    }

    private void unmakeRaw() {
        Undo undo = undoStack.pop();
        Move move = undo.move();
        int from = move.from();
        int to = move.to();

        sideToMove = sideToMove.opposite();
        squares[to] = null;
        squares[from] = undo.moved();
        if (undo.captured() != null) {
            squares[undo.capturedSquare()] = undo.captured();
        }
        if (undo.moved().type() == PieceType.KING) {
            kingSquare[undo.moved().color().ordinal()] = from;
            if (to - from == 2) {
                relocate(from + 1, from + 3);
            } else if (from - to == 2) {
                relocate(from - 1, from - 4);
            }
        }
        castlingRights = undo.castlingRights();
        enPassantSquare = undo.enPassantSquare();
        halfMoveClock = undo.halfMoveClock();
        fullMoveNumber = undo.fullMoveNumber();
    }

    private void relocate(int from, int to) {
        squares[to] = squares[from];
        squares[from] = null;
    }

    private long computeKey() {
        return Zobrist.hash(squares, sideToMove, castlingRights, capturableEnPassantFile());
    }

    private int capturableEnPassantFile() {
        if (enPassantSquare == Square.NONE) {
            return Square.NONE;
        }
        int file = Square.file(enPassantSquare);
        int pawnRank = Square.rank(enPassantSquare) + (sideToMove.isWhite() ? -1 : 1);
        Piece ourPawn = Piece.of(PieceType.PAWN, sideToMove);
        for (int side = -1; side <= 1; side += 2) {
            if (Square.onBoard(file + side, pawnRank) && ourPawn.equals(squares[Square.of(file + side, pawnRank)])) {
                return file;
            }
        }
        return Square.NONE;
    }

    // ---------------------------------------------------------------- setup and accessors

    public Piece pieceAt(int square) {
        return squares[square];
    }

    public void put(int square, Piece piece) {
        squares[square] = piece;
    }

    public void setSideToMove(Color sideToMove) {
        this.sideToMove = sideToMove;
    }

    public int castlingRights() {
        return castlingRights;
    }

    public void setCastlingRights(int castlingRights) {
        this.castlingRights = castlingRights & 0xF;
    }

    public int enPassantSquare() {
        return enPassantSquare;
    }

    public void setEnPassantSquare(int enPassantSquare) {
        this.enPassantSquare = enPassantSquare;
    }

    public int halfMoveClock() {
        return halfMoveClock;
    }

    public void setHalfMoveClock(int halfMoveClock) {
        this.halfMoveClock = halfMoveClock;
    }

    public int fullMoveNumber() {
        return fullMoveNumber;
    }

    public void setFullMoveNumber(int fullMoveNumber) {
        this.fullMoveNumber = fullMoveNumber;
    }

    /** Must be called once the position has been set up: locates kings and starts a fresh repetition history. */
    public void resetHistory() {
        kingSquare[0] = Square.NONE;
        kingSquare[1] = Square.NONE;
        for (int square = 0; square < 64; square++) {
            Piece piece = squares[square];
            if (piece != null && piece.type() == PieceType.KING) {
                kingSquare[piece.color().ordinal()] = square;
            }
        }
        undoStack.clear();
        keyHistory.clear();
        keyHistory.add(computeKey());
    }

    public long key() {
        return keyHistory.getLong(keyHistory.size() - 1);
    }

    /** Plays moves given in long algebraic notation, e.g. "e2e4 e7e5". */
    public List<Move> playMoves(String moves) {
        List<Move> played = new ArrayList<>();
        for (String notation : moves.trim().split("\\s+")) {
            MoveIOUtils.ParsedMove parsed = MoveIOUtils.parseUci(notation);
            Move move = apply(parsed.from(), parsed.to(), parsed.promotion());
            if (move == null) {
                throw new IllegalArgumentException("Illegal move " + notation + " in " + fen());
            }
            played.add(move);
        }
        return played;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(8 * 20);
        for (int rank = 7; rank >= 0; rank--) {
            sb.append(rank + 1).append("  ");
            for (int file = 0; file < 8; file++) {
                Piece piece = squares[Square.of(file, rank)];
                sb.append(piece == null ? '.' : piece.fenLetter()).append(' ');
            }
            sb.append('\n');
        }
        sb.append("\n   a b c d e f g h");
        return sb.toString();
    }
}
