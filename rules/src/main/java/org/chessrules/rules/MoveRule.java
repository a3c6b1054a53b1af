package org.chessrules.rules;

import org.chessrules.board.BoardQuery;
import org.chessrules.model.Piece;
import org.chessrules.model.Position;

import java.util.List;

/**
 * Movement rules of one piece type.
 */
interface MoveRule {

    /**
     * Geometric reachability of a target: shape of the move and any blocking on the way.
     * False whenever the piece or the target is off the board. Whether the target holds a piece of the
     * mover's color is left to {@link MoveRules#isValidMove}, except where the rule itself
     * depends on the target's occupant.
     */
    boolean canReach(Piece piece, BoardQuery board, int targetX, int targetY);

    /**
     * All legal destinations, in a fixed order, without duplicates.
     */
    List<Position> possibleMoves(Piece piece, BoardQuery board);
}
