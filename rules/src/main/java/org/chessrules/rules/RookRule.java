package org.chessrules.rules;

/**
 * Straight along a rank or a file, stopped by the first piece in the way.
 */
final class RookRule extends SlidingRule {

    RookRule() {
        super(Direction.ORTHOGONAL);
    }

    static boolean isOrthogonal(int dx, int dy) {
        return (dx == 0) != (dy == 0);
    }

    @Override
    boolean isOnLine(int dx, int dy) {
        return isOrthogonal(dx, dy);
    }
}
