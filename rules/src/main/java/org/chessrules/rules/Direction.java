package org.chessrules.rules;

import org.chessrules.model.Position;

import java.util.List;

/**
 * The eight ray directions a sliding piece can travel, as (file, rank) steps.
 */
public enum Direction {
    NORTH(0, 1),
    NORTH_EAST(1, 1),
    EAST(1, 0),
    SOUTH_EAST(1, -1),
    SOUTH(0, -1),
    SOUTH_WEST(-1, -1),
    WEST(-1, 0),
    NORTH_WEST(-1, 1);

    public static final List<Direction> ORTHOGONAL = List.of(NORTH, EAST, SOUTH, WEST);
    public static final List<Direction> DIAGONAL = List.of(NORTH_EAST, SOUTH_EAST, SOUTH_WEST, NORTH_WEST);
    public static final List<Direction> ALL = List.of(values());

    private final int dx;
    private final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public int dx() {
        return dx;
    }

    public int dy() {
        return dy;
    }

    /**
     * How many squares a ray in this direction can travel from the given square before
     * leaving the board.
     */
    public int maxSteps(Position from) {
        return Math.min(stepsToEdge(from.file(), dx), stepsToEdge(from.rank(), dy));
    }

    private static int stepsToEdge(int coordinate, int step) {
        if (step > 0) {
            return Position.BOARD_SIZE - 1 - coordinate;
        }
        if (step < 0) {
            return coordinate;
        }
        return Integer.MAX_VALUE;
    }

    /**
     * The direction pointing from one square toward another on a shared rank, file or
     * diagonal, or null when the squares are not aligned that way.
     */
    public static Direction between(int fromX, int fromY, int toX, int toY) {
        int dx = toX - fromX;
        int dy = toY - fromY;
        if (dx == 0 && dy == 0) {
            return null;
        }
        if (dx != 0 && dy != 0 && Math.abs(dx) != Math.abs(dy)) {
            return null;
        }
        int sx = Integer.signum(dx);
        int sy = Integer.signum(dy);
        for (Direction d : values()) {
            if (d.dx == sx && d.dy == sy) {
                return d;
            }
        }
        return null;
    }
}
