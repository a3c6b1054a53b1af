package org.chessrules.rules;

import org.chessrules.board.BoardQuery;
import org.chessrules.model.Piece;
import org.chessrules.model.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Pieces that jump to a fixed set of squares around them, with no blocking in between.
 */
abstract class OffsetRule implements MoveRule {
    private final int[][] offsets;

    OffsetRule(int[][] offsets) {
        this.offsets = offsets;
    }

    /**
     * Whether the absolute displacement is one of this piece's jumps.
     */
    abstract boolean isJump(int diffX, int diffY);

    @Override
    public final boolean canReach(Piece piece, BoardQuery board, int targetX, int targetY) {
        if (!board.isValidPosition(piece.position()) || !board.isValidPosition(targetX, targetY)) {
            return false;
        }
        return isJump(Math.abs(targetX - piece.file()), Math.abs(targetY - piece.rank()));
    }

    @Override
    public List<Position> possibleMoves(Piece piece, BoardQuery board) {
        List<Position> squares = new ArrayList<>();
        for (int[] offset : offsets) {
            int x = piece.file() + offset[0];
            int y = piece.rank() + offset[1];
            if (!board.isValidPosition(x, y)) continue;
            if (!board.isOccupied(x, y) || piece.isOpponentOf(board.getPiece(x, y))) {
                squares.add(new Position(x, y));
            }
        }
        return squares;
    }
}
