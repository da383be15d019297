package max.chess.ai.game;

import max.chess.ai.common.Color;
import max.chess.ai.common.Piece;
import max.chess.ai.common.PieceType;
import max.chess.ai.common.Square;
import max.chess.ai.game.notation.FENUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GameTest {

    @Test
    public void boardGridIsSeenFromWhiteSide() {
        Game game = Game.newStandardGame();

        Piece[][] board = game.board();

        assertEquals(Piece.of(PieceType.ROOK, Color.BLACK), board[0][0]);
        assertEquals(Piece.of(PieceType.KING, Color.WHITE), board[7][4]);
        assertEquals(Piece.of(PieceType.PAWN, Color.WHITE), board[6][3]);
        assertNull(board[4][4]);
    }

    @Test
    public void undoRestoresTheExactPosition() {
        // Given
        Game game = FENUtils.fromFen("r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1");
        String before = game.fen();
        long keyBefore = game.key();

        // When / Then
        for (Move move : game.legalMoves()) {
            assertNotNull(game.apply(move), move.san());
            game.undo();
            assertEquals(before, game.fen(), "after " + move.san());
            assertEquals(keyBefore, game.key());
        }
    }

    @Test
    public void applyRejectsIllegalMoves() {
        Game game = Game.newStandardGame();

        assertNull(game.apply(Square.parse("e2"), Square.parse("e5"), PieceType.NONE));
        assertNull(game.apply(Square.parse("e7"), Square.parse("e5"), PieceType.NONE));
        assertEquals(Game.STANDARD_START_FEN, game.fen());
    }

    @Test
    public void undoWithoutMoveIsAnError() {
        Game game = Game.newStandardGame();

        assertThrows(IllegalStateException.class, game::undo);
    }

    @Test
    public void castlingMovesKingAndRookAndDropsRights() {
        // Given
        Game game = FENUtils.fromFen("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");

        // When
        List<String> kingMoves = game.legalMoves(Square.parse("e1")).stream().map(Move::san).toList();
        Move castle = game.apply(Square.parse("e1"), Square.parse("g1"), PieceType.NONE);

        // Then
        assertTrue(kingMoves.contains("O-O"));
        assertTrue(kingMoves.contains("O-O-O"));
        assertEquals("O-O", castle.san());
        assertEquals("r3k2r/8/8/8/8/8/8/R4RK1 b kq - 1 1", game.fen());
    }

    @Test
    public void castlingThroughAnAttackedSquareIsIllegal() {
        // black rook on f8 covers f1
        Game game = FENUtils.fromFen("4kr2/8/8/8/8/8/8/R3K2R w KQ - 0 1");

        List<String> kingMoves = game.legalMoves(Square.parse("e1")).stream().map(Move::san).toList();

        assertFalse(kingMoves.contains("O-O"));
        assertTrue(kingMoves.contains("O-O-O"));
    }

    @Test
    public void enPassantCapturesThePassedPawn() {
        Game game = FENUtils.fromFen("4k3/8/8/3pP3/8/8/8/4K3 w - d6 0 1");

        Move move = game.apply(Square.parse("e5"), Square.parse("d6"), PieceType.NONE);

        assertEquals("exd6", move.san());
        assertEquals(PieceType.PAWN, move.captured());
        assertEquals("4k3/8/3P4/8/8/8/8/4K3 b - - 0 1", game.fen());
        game.undo();
        assertEquals("4k3/8/8/3pP3/8/8/8/4K3 w - d6 0 1", game.fen());
    }

    @Test
    public void promotionsAreListedMostValuableFirstWithCheckSuffixes() {
        Game game = FENUtils.fromFen("8/P7/8/8/8/8/8/k1K5 w - - 0 1");

        List<String> promotions = game.legalMoves(Square.parse("a7")).stream().map(Move::san).toList();

        assertEquals(List.of("a8=Q#", "a8=R#", "a8=B", "a8=N"), promotions);
        // no piece given means queen
        assertEquals(PieceType.QUEEN, game.apply(Square.parse("a7"), Square.parse("a8"), null).promotion());
        assertTrue(game.isCheckmate());
    }

    @Test
    public void sanDisambiguatesByFileThenRank() {
        Game byFile = FENUtils.fromFen("4k3/8/8/8/8/5N2/8/1N2K3 w - - 0 1");
        Game byRank = FENUtils.fromFen("4k3/8/8/8/8/1N6/8/1N2K3 w - - 0 1");

        List<String> fileSans = byFile.legalMoves().stream().map(Move::san).toList();
        List<String> rankSans = byRank.legalMoves().stream().map(Move::san).toList();

        assertTrue(fileSans.contains("Nbd2"));
        assertTrue(fileSans.contains("Nfd2"));
        assertTrue(rankSans.contains("N1d2"));
        assertTrue(rankSans.contains("N3d2"));
    }

    @Test
    public void foolsMateIsCheckmate() {
        Game game = Game.newStandardGame();

        List<Move> played = game.playMoves("f2f3 e7e5 g2g4 d8h4");

        assertEquals("Qh4#", played.get(3).san());
        assertTrue(game.inCheck());
        assertTrue(game.isCheckmate());
        assertTrue(game.isGameOver());
        assertFalse(game.isDraw());
        assertTrue(game.legalMoves().isEmpty());
    }

    @Test
    public void stalemateIsADraw() {
        Game game = FENUtils.fromFen("k7/8/1K6/2Q5/8/8/8/8 w - - 0 1");
        assertFalse(game.isGameOver());

        game.apply(Square.parse("c5"), Square.parse("c7"), PieceType.NONE);

        assertTrue(game.isStalemate());
        assertFalse(game.isCheckmate());
        assertTrue(game.isDraw());
    }

    @Test
    public void gameShouldDetect_drawBy3FoldRepetition() {
        // Given
        Game game = Game.newStandardGame();

        // When
        // Knight dance, the start position comes back every four plies
        game.playMoves("b1c3 b8c6 c3b1 c6b8");
        boolean drawAfterSecondOccurrence = game.isDraw();
        game.playMoves("b1c3 b8c6 c3b1 c6b8");

        // Then
        assertFalse(drawAfterSecondOccurrence);
        assertTrue(game.isThreefoldRepetition());
        assertTrue(game.isDraw());
        // moves are still enumerated, the draw is a status
        assertEquals(20, game.legalMoves().size());
        game.undo();
        assertFalse(game.isThreefoldRepetition());
    }

    @Test
    public void gameShouldDetect_drawBy50MovesRule() {
        Game game = FENUtils.fromFen("7k/8/8/8/8/8/8/R6K w - - 99 80");
        assertFalse(game.isDraw());

        game.apply(Square.parse("a1"), Square.parse("a2"), PieceType.NONE);

        assertEquals(100, game.halfMoveClock());
        assertTrue(game.isDraw());
    }

    @Test
    public void insufficientMaterial() {
        assertTrue(FENUtils.fromFen("8/8/8/4k3/8/8/8/4K3 w - - 0 1").isInsufficientMaterial());
        assertTrue(FENUtils.fromFen("8/8/8/4k3/8/8/8/3BK3 w - - 0 1").isInsufficientMaterial());
        assertTrue(FENUtils.fromFen("8/8/8/4k3/8/8/8/3NK3 w - - 0 1").isInsufficientMaterial());
        // bishops on the same square color
        assertTrue(FENUtils.fromFen("5b2/8/8/4k3/8/8/8/2B1K3 w - - 0 1").isInsufficientMaterial());

        assertFalse(FENUtils.fromFen("2b5/8/8/4k3/8/8/8/2B1K3 w - - 0 1").isInsufficientMaterial());
        assertFalse(FENUtils.fromFen("8/8/8/4k3/8/8/8/2NNK3 w - - 0 1").isInsufficientMaterial());
        assertFalse(FENUtils.fromFen("8/8/8/4k3/8/8/4P3/4K3 w - - 0 1").isInsufficientMaterial());
    }
}
