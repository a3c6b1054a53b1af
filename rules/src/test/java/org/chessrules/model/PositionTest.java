package org.chessrules.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PositionTest {

    @Test
    void cornersMapToA1AndH8() {
        assertEquals("a1", new Position(0, 0).toChessNotation());
        assertEquals("h8", new Position(7, 7).toChessNotation());
        assertEquals("e4", new Position(4, 3).toChessNotation());
    }

    @Test
    void parsesNotation() {
        assertEquals(new Position(4, 3), Position.fromChessNotation("e4"));
        assertEquals(new Position(7, 0), Position.fromChessNotation("H1"));
    }

    @Test
    void rejectsMalformedNotation() {
        assertThrows(IllegalArgumentException.class, () -> Position.fromChessNotation(null));
        assertThrows(IllegalArgumentException.class, () -> Position.fromChessNotation("e"));
        assertThrows(IllegalArgumentException.class, () -> Position.fromChessNotation("i1"));
        assertThrows(IllegalArgumentException.class, () -> Position.fromChessNotation("a9"));
        assertThrows(IllegalArgumentException.class, () -> Position.fromChessNotation("a10"));
    }

    @Test
    void validityCoversOnlyTheBoard() {
        assertTrue(new Position(0, 7).isValid());
        assertFalse(new Position(-1, 0).isValid());
        assertFalse(new Position(0, 8).isValid());
        assertFalse(new Position(3, 3).offset(5, 0).isValid());
        assertEquals(new Position(5, 2), new Position(3, 3).offset(2, -1));
    }

    @Test
    void offBoardPositionsPrintAsCoordinates() {
        assertEquals("(8,0)", new Position(8, 0).toString());
        assertEquals("c2", new Position(2, 1).toString());
    }
}
