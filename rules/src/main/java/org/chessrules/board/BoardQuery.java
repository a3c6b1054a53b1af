package org.chessrules.board;

import org.chessrules.model.Piece;
import org.chessrules.model.PieceColor;
import org.chessrules.model.Position;

/**
 * Read-only view of piece occupancy that the move rules consult.
 * Implementations own the pieces; rules never mutate them.
 */
public interface BoardQuery {

    /**
     * @return true if both coordinates lie in 0..7
     */
    boolean isValidPosition(int x, int y);

    /**
     * Whether a piece sits on the square. The square must be on the board.
     */
    boolean isOccupied(int x, int y);

    /**
     * The piece on the square. Only defined when {@link #isOccupied(int, int)} is true.
     */
    Piece getPiece(int x, int y);

    default boolean isValidPosition(Position position) {
        return isValidPosition(position.file(), position.rank());
    }

    default boolean isOccupied(Position position) {
        return isOccupied(position.file(), position.rank());
    }

    default Piece getPiece(Position position) {
        return getPiece(position.file(), position.rank());
    }

    /**
     * Bounds-safe check that the square holds a piece of the given color.
     */
    default boolean isOccupiedBy(int x, int y, PieceColor color) {
        return isValidPosition(x, y) && isOccupied(x, y) && getPiece(x, y).color() == color;
    }
}
