package org.chessrules.rules;

final class QueenRule extends SlidingRule {

    QueenRule() {
        super(Direction.ALL);
    }

    @Override
    boolean isOnLine(int dx, int dy) {
        return RookRule.isOrthogonal(dx, dy) || BishopRule.isDiagonal(dx, dy);
    }
}
