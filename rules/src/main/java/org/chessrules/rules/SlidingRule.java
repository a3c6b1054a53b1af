package org.chessrules.rules;

import org.chessrules.board.BoardQuery;
import org.chessrules.model.Piece;
import org.chessrules.model.Position;

import java.util.ArrayList;
import java.util.List;

abstract class SlidingRule implements MoveRule {
    private final List<Direction> directions;

    SlidingRule(List<Direction> directions) {
        this.directions = directions;
    }

    /**
     * Whether a displacement lies on one of this piece's lines.
     */
    abstract boolean isOnLine(int dx, int dy);

    @Override
    public boolean canReach(Piece piece, BoardQuery board, int targetX, int targetY) {
        Position from = piece.position();
        if (!isOnLine(targetX - from.file(), targetY - from.rank())) {
            return false;
        }
        return RayCaster.isPathClear(board, from, targetX, targetY);
    }

    @Override
    public List<Position> possibleMoves(Piece piece, BoardQuery board) {
        List<Position> squares = new ArrayList<>();
        for (Direction d : directions) {
            RayCaster.cast(piece, board, d, squares);
        }
        return squares;
    }
}
