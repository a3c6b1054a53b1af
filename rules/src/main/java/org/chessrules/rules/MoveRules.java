package org.chessrules.rules;

import org.chessrules.board.BoardQuery;
import org.chessrules.model.Piece;
import org.chessrules.model.PieceType;
import org.chessrules.model.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point to the per-type rules. The rule objects hold no state and may be shared freely.
 */
public final class MoveRules {
    private static final MoveRule ROOK = new RookRule();
    private static final MoveRule KNIGHT = new KnightRule();
    private static final MoveRule BISHOP = new BishopRule();
    private static final MoveRule QUEEN = new QueenRule();
    private static final MoveRule KING = new KingRule();
    private static final MoveRule PAWN = new PawnRule();

    private MoveRules() {
    }

    static MoveRule forType(PieceType type) {
        return switch (type) {
            case ROOK -> ROOK;
            case KNIGHT -> KNIGHT;
            case BISHOP -> BISHOP;
            case QUEEN -> QUEEN;
            case KING -> KING;
            case PAWN -> PAWN;
        };
    }

    /**
     * Full validation of a single move: on the board, an actual displacement, not onto a piece
     * of the mover's color, and allowed by the piece's own rule.
     */
    public static boolean isValidMove(Piece piece, BoardQuery board, int targetX, int targetY) {
        return isValidMove(piece, board, targetX, targetY, true);
    }

    /**
     * @param rejectOwnColor when false, an otherwise reachable square holding a piece of the
     *                       mover's color is accepted, and the caller checks the target itself.
     *                       Pawns reject such squares either way.
     */
    public static boolean isValidMove(Piece piece, BoardQuery board, int targetX, int targetY,
                                      boolean rejectOwnColor) {
        if (!board.isValidPosition(targetX, targetY)) return false;
        if (!board.isValidPosition(piece.file(), piece.rank())) return false;
        if (piece.file() == targetX && piece.rank() == targetY) return false;
        if (rejectOwnColor && board.isOccupiedBy(targetX, targetY, piece.color())) return false;
        return forType(piece.type()).canReach(piece, board, targetX, targetY);
    }

    /**
     * Every legal destination of the piece, or an empty list when the piece itself is off the board.
     */
    public static List<Position> possibleMoves(Piece piece, BoardQuery board) {
        if (!board.isValidPosition(piece.file(), piece.rank())) {
            return new ArrayList<>();
        }
        return forType(piece.type()).possibleMoves(piece, board);
    }
}
