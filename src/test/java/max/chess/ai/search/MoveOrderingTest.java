package max.chess.ai.search;

import max.chess.ai.common.PieceType;
import max.chess.ai.common.Square;
import max.chess.ai.game.Game;
import max.chess.ai.game.Move;
import max.chess.ai.game.notation.FENUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MoveOrderingTest {

    private static Move move(String from, String to, PieceType piece, PieceType captured) {
        return new Move(Square.parse(from), Square.parse(to), piece, captured, PieceType.NONE, from + to);
    }

    @Test
    public void mostValuableVictimThenLeastValuableAttacker() {
        Move quietQueen = move("d1", "d3", PieceType.QUEEN, PieceType.NONE);
        Move queenTakesPawn = move("d1", "d7", PieceType.QUEEN, PieceType.PAWN);
        Move quietPawn = move("a2", "a3", PieceType.PAWN, PieceType.NONE);
        Move knightTakesRook = move("c3", "b5", PieceType.KNIGHT, PieceType.ROOK);
        Move quietKnight = move("g1", "f3", PieceType.KNIGHT, PieceType.NONE);
        Move pawnTakesQueen = move("e4", "d5", PieceType.PAWN, PieceType.QUEEN);

        List<Move> ordered = MoveOrdering.order(
                List.of(quietQueen, queenTakesPawn, quietPawn, knightTakesRook, quietKnight, pawnTakesQueen));

        assertEquals(List.of(pawnTakesQueen, knightTakesRook, queenTakesPawn, quietPawn, quietKnight, quietQueen), ordered);
        assertEquals(8_900, MoveOrdering.score(pawnTakesQueen));
        assertEquals(-900, MoveOrdering.score(quietQueen));
    }

    @Test
    public void equalScoresKeepTheirOrder() {
        Move a = move("a2", "a3", PieceType.PAWN, PieceType.NONE);
        Move b = move("b2", "b3", PieceType.PAWN, PieceType.NONE);
        Move c = move("c2", "c3", PieceType.PAWN, PieceType.NONE);
        Move capture = move("d4", "e5", PieceType.PAWN, PieceType.KNIGHT);

        assertEquals(List.of(capture, a, b, c), MoveOrdering.order(List.of(a, b, c, capture)));
        assertEquals(List.of(capture, c, b, a), MoveOrdering.order(List.of(c, b, capture, a)));
    }

    @Test
    public void orderedLegalMovesArePermutationSortedByScore() {
        Game game = FENUtils.fromFen("r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1");
        List<Move> legal = game.legalMoves();

        List<Move> ordered = MoveOrdering.orderedLegalMoves(game);

        assertEquals(legal.size(), ordered.size());
        assertEquals(new HashSet<>(legal), new HashSet<>(ordered));
        for (int i = 1; i < ordered.size(); i++) {
            assertTrue(MoveOrdering.score(ordered.get(i - 1)) >= MoveOrdering.score(ordered.get(i)));
        }
        assertTrue(ordered.get(0).isCapture());
    }

    @Test
    public void inputIsLeftUntouched() {
        List<Move> moves = new ArrayList<>(List.of(
                move("a2", "a3", PieceType.PAWN, PieceType.NONE),
                move("d4", "e5", PieceType.PAWN, PieceType.KNIGHT)));
        List<Move> copy = List.copyOf(moves);

        MoveOrdering.order(moves);

        assertEquals(copy, moves);
    }
}
