package org.chessrules.rules;

/**
 * One step in any direction. Castling is not generated.
 */
final class KingRule extends OffsetRule {
    private static final int[][] STEPS = {
            {-1, -1}, {-1, 0}, {-1, 1}, {0, -1},
            {0, 1}, {1, -1}, {1, 0}, {1, 1}
    };

    KingRule() {
        super(STEPS);
    }

    @Override
    boolean isJump(int diffX, int diffY) {
        return diffX < 2 && diffY < 2 && diffX + diffY > 0;
    }
}
