package org.chessrules.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MoveTest {

    @Test
    void notationForQuietMoves() {
        Piece knight = new Piece(PieceColor.WHITE, PieceType.KNIGHT, 6, 0);
        Piece pawn = new Piece(PieceColor.WHITE, PieceType.PAWN, 4, 1);

        assertEquals("Nf3", new Move(knight.position(), new Position(5, 2), knight, null).toNotation());
        assertEquals("e4", new Move(pawn.position(), new Position(4, 3), pawn, null).toNotation());
    }

    @Test
    void notationForCaptures() {
        Piece bishop = new Piece(PieceColor.BLACK, PieceType.BISHOP, 2, 6);
        Piece pawn = new Piece(PieceColor.WHITE, PieceType.PAWN, 4, 3);
        Piece blackPawn = new Piece(PieceColor.BLACK, PieceType.PAWN, 3, 4);

        Move bishopTakes = new Move(bishop.position(), new Position(4, 4), bishop, pawn.movedTo(new Position(4, 4)));
        Move pawnTakes = new Move(pawn.position(), blackPawn.position(), pawn, blackPawn);

        assertTrue(bishopTakes.isCapture());
        assertEquals("Bxe5", bishopTakes.toNotation());
        assertEquals("exd5", pawnTakes.toNotation());
        assertEquals("e4 x d5", pawnTakes.toString());
    }
}
