package org.chessrules.rules;

import org.chessrules.board.BoardQuery;
import org.chessrules.model.Piece;
import org.chessrules.model.Position;

import java.util.List;

/**
 * Ray walking shared by the sliding pieces.
 */
final class RayCaster {

    private RayCaster() {
    }

    /**
     * Checks that every square strictly between the source and the target is empty.
     * False when either square is off the board or the two do not share a rank, file or diagonal.
     */
    static boolean isPathClear(BoardQuery board, Position from, int toX, int toY) {
        if (!board.isValidPosition(from) || !board.isValidPosition(toX, toY)) {
            return false;
        }
        Direction d = Direction.between(from.file(), from.rank(), toX, toY);
        if (d == null) {
            return false;
        }
        int x = from.file() + d.dx();
        int y = from.rank() + d.dy();
        while (x != toX || y != toY) {
            if (board.isOccupied(x, y)) {
                return false;
            }
            x += d.dx();
            y += d.dy();
        }
        return true;
    }

    /**
     * Walks outward from the piece until the edge or the first occupied square. Empty squares
     * are collected; the blocking square is collected only when it holds an opposing piece.
     */
    static void cast(Piece piece, BoardQuery board, Direction d, List<Position> out) {
        Position from = piece.position();
        int steps = d.maxSteps(from);
        for (int i = 1; i <= steps; i++) {
            int x = from.file() + i * d.dx();
            int y = from.rank() + i * d.dy();
            if (board.isOccupied(x, y)) {
                if (piece.isOpponentOf(board.getPiece(x, y))) {
                    out.add(new Position(x, y));
                }
                return;
            }
            out.add(new Position(x, y));
        }
    }
}
