package org.chessrules.rules;

import org.chessrules.board.BoardQuery;
import org.chessrules.model.Piece;
import org.chessrules.model.PieceColor;
import org.chessrules.model.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Single push, double push from the start rank, diagonal capture. No en passant or promotion.
 */
final class PawnRule implements MoveRule {
    // Every offset a pawn of either color could reach.
    private static final int[][] CANDIDATES = {
            {-1, 1}, {-1, -1}, {0, 1}, {0, 2},
            {0, -1}, {0, -2}, {1, 1}, {1, -1}
    };

    PawnRule() {
    }

    @Override
    public boolean canReach(Piece piece, BoardQuery board, int targetX, int targetY) {
        if (!board.isValidPosition(piece.position()) || !board.isValidPosition(targetX, targetY)) {
            return false;
        }
        PieceColor color = piece.color();
        int forward = color.pawnDirection();
        int dx = targetX - piece.file();
        int dy = targetY - piece.rank();

        if (dy == forward) {
            if (dx == 0) {
                return !board.isOccupied(targetX, targetY);
            }
            return Math.abs(dx) == 1 && board.isOccupiedBy(targetX, targetY, color.opposite());
        }
        if (dy == 2 * forward && dx == 0 && piece.rank() == color.pawnStartRank()) {
            return !board.isOccupied(targetX, piece.rank() + forward)
                    && !board.isOccupied(targetX, targetY);
        }
        return false;
    }

    @Override
    public List<Position> possibleMoves(Piece piece, BoardQuery board) {
        List<Position> squares = new ArrayList<>();
        for (int[] candidate : CANDIDATES) {
            int x = piece.file() + candidate[0];
            int y = piece.rank() + candidate[1];
            if (MoveRules.isValidMove(piece, board, x, y)) {
                squares.add(new Position(x, y));
            }
        }
        return squares;
    }
}
