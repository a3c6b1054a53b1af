package org.chessrules.rules;

import org.chessrules.model.Position;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DirectionTest {

    @Test
    void stepsAreBoundedByTheNearestEdge() {
        Position b3 = new Position(1, 2);

        assertEquals(5, Direction.NORTH.maxSteps(b3));
        assertEquals(6, Direction.EAST.maxSteps(b3));
        assertEquals(2, Direction.SOUTH.maxSteps(b3));
        assertEquals(1, Direction.WEST.maxSteps(b3));
        assertEquals(5, Direction.NORTH_EAST.maxSteps(b3));
        assertEquals(1, Direction.NORTH_WEST.maxSteps(b3));
        assertEquals(1, Direction.SOUTH_WEST.maxSteps(b3));
        assertEquals(2, Direction.SOUTH_EAST.maxSteps(b3));
    }

    @Test
    void betweenFindsLinesOnly() {
        assertEquals(Direction.NORTH, Direction.between(0, 0, 0, 5));
        assertEquals(Direction.WEST, Direction.between(7, 3, 2, 3));
        assertEquals(Direction.SOUTH_EAST, Direction.between(2, 5, 4, 3));
        assertNull(Direction.between(0, 0, 1, 2));
        assertNull(Direction.between(4, 4, 4, 4));
    }

    @Test
    void directionGroupsSplitTheCompass() {
        assertEquals(4, Direction.ORTHOGONAL.size());
        assertEquals(4, Direction.DIAGONAL.size());
        assertEquals(8, Direction.ALL.size());
        for (Direction d : Direction.ORTHOGONAL) {
            assertEquals(1, Math.abs(d.dx()) + Math.abs(d.dy()));
        }
        for (Direction d : Direction.DIAGONAL) {
            assertEquals(2, Math.abs(d.dx()) + Math.abs(d.dy()));
        }
    }
}
