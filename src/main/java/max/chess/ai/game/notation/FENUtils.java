package max.chess.ai.game.notation;

import max.chess.ai.common.Color;
import max.chess.ai.common.Piece;
import max.chess.ai.common.Square;
import max.chess.ai.game.Game;

// https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
public final class FENUtils {

    private FENUtils() {}

    public static Game fromFen(String fen) {
        if (fen == null) {
            throw new IllegalArgumentException("Invalid FEN record: null");
        }
        String[] fenFields = fen.trim().split("\\s+");
        // clock fields are optional in the wild, default them
        if (fenFields.length != 4 && fenFields.length != 6) {
            throw new IllegalArgumentException("Invalid FEN record: " + fen);
        }

        Game game = new Game();
        injectPiecePlacement(game, fenFields[0]);
        game.setSideToMove(Color.fromFenLetter(single(fenFields[1], fen)));
        game.setCastlingRights(parseCastlingRights(fenFields[2], fen));
        game.setEnPassantSquare("-".equals(fenFields[3]) ? Square.NONE : Square.parse(fenFields[3]));
        if (fenFields.length == 6) {
            game.setHalfMoveClock(parseNumber(fenFields[4], fen));
            game.setFullMoveNumber(parseNumber(fenFields[5], fen));
        }
        game.resetHistory();
        return game;
    }

    public static String toFen(Game game) {
        StringBuilder fen = new StringBuilder(90);
        appendPiecePlacement(game, fen);
        fen.append(' ').append(game.sideToMove().fenLetter);
        fen.append(' ').append(writeCastlingRights(game.castlingRights()));
        fen.append(' ').append(game.enPassantSquare() == Square.NONE ? "-" : Square.name(game.enPassantSquare()));
        fen.append(' ').append(game.halfMoveClock());
        fen.append(' ').append(game.fullMoveNumber());
        return fen.toString();
    }

    private static void injectPiecePlacement(Game game, String piecePlacement) {
        String[] ranks = piecePlacement.split("/");
        if (ranks.length != 8) {
            throw new IllegalArgumentException("Invalid FEN piece placement: " + piecePlacement);
        }
        for (int i = 0; i < 8; i++) {
            int rank = 7 - i;
            int file = 0;
            for (char c : ranks[i].toCharArray()) {
                if (Character.isDigit(c)) {
                    file += c - '0';
                } else {
                    if (file > 7) {
                        throw new IllegalArgumentException("Invalid FEN rank: " + ranks[i]);
                    }
                    game.put(Square.of(file, rank), Piece.fromFenLetter(c));
                    file++;
                }
            }
            if (file != 8) {
                throw new IllegalArgumentException("Invalid FEN rank: " + ranks[i]);
            }
        }
    }

    private static void appendPiecePlacement(Game game, StringBuilder fen) {
        for (int rank = 7; rank >= 0; rank--) {
            if (rank != 7) {
                fen.append('/');
            }
            int emptySpaceCounter = 0;
            for (int file = 0; file < 8; file++) {
                Piece piece = game.pieceAt(Square.of(file, rank));
                if (piece == null) {
                    emptySpaceCounter++;
                    continue;
                }
                if (emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(piece.fenLetter());
            }
            if (emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static int parseCastlingRights(String castlingRights, String fen) {
        if ("-".equals(castlingRights)) {
            return 0;
        }
        int rights = 0;
        for (char c : castlingRights.toCharArray()) {
            rights |= switch (c) {
                case 'K' -> Game.WHITE_KING_SIDE;
                case 'Q' -> Game.WHITE_QUEEN_SIDE;
                case 'k' -> Game.BLACK_KING_SIDE;
                case 'q' -> Game.BLACK_QUEEN_SIDE;
                default -> throw new IllegalArgumentException("Invalid castling rights in FEN: " + fen);
            };
        }
        return rights;
    }

    private static String writeCastlingRights(int rights) {
        StringBuilder castlingRights = new StringBuilder(4);
        if ((rights & Game.WHITE_KING_SIDE) != 0) {
            castlingRights.append('K');
        }
        if ((rights & Game.WHITE_QUEEN_SIDE) != 0) {
            castlingRights.append('Q');
        }
        if ((rights & Game.BLACK_KING_SIDE) != 0) {
            castlingRights.append('k');
        }
        if ((rights & Game.BLACK_QUEEN_SIDE) != 0) {
            castlingRights.append('q');
        }
        return castlingRights.length() == 0 ? "-" : castlingRights.toString();
    }

    private static char single(String field, String fen) {
        if (field.length() != 1) {
            throw new IllegalArgumentException("Invalid FEN record: " + fen);
        }
        return field.charAt(0);
    }

    private static int parseNumber(String field, String fen) {
        try {
            return Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid FEN clock '" + field + "' in " + fen, e);
        }
    }
}
