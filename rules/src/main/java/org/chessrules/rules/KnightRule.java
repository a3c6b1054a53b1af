package org.chessrules.rules;

final class KnightRule extends OffsetRule {
    private static final int[][] JUMPS = {
            {-2, -1}, {-2, 1}, {-1, -2}, {-1, 2},
            {1, -2}, {1, 2}, {2, -1}, {2, 1}
    };

    KnightRule() {
        super(JUMPS);
    }

    @Override
    boolean isJump(int diffX, int diffY) {
        return (diffX == 2 && diffY == 1) || (diffX == 1 && diffY == 2);
    }
}
