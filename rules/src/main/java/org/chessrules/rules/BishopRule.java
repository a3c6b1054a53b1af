package org.chessrules.rules;

/**
 * Along a diagonal, stopped by the first piece in the way.
 */
final class BishopRule extends SlidingRule {

    BishopRule() {
        super(Direction.DIAGONAL);
    }

    static boolean isDiagonal(int dx, int dy) {
        return dx != 0 && Math.abs(dx) == Math.abs(dy);
    }

    @Override
    boolean isOnLine(int dx, int dy) {
        return isDiagonal(dx, dy);
    }
}
