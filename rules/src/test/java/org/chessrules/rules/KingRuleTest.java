package org.chessrules.rules;

import org.chessrules.board.GridBoard;
import org.chessrules.model.Piece;
import org.chessrules.model.PieceColor;
import org.chessrules.model.PieceType;
import org.chessrules.model.Position;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KingRuleTest {

    @Test
    void cornerKingHasThreeMoves() {
        GridBoard board = GridBoard.empty();
        Piece king = new Piece(PieceColor.WHITE, PieceType.KING, 0, 0);
        board.place(king);

        assertEquals(Set.of(new Position(0, 1), new Position(1, 0), new Position(1, 1)),
                new HashSet<>(king.getPossibleMoves(board)));
        assertEquals(3, king.getPossibleMoves(board).size());
    }

    @Test
    void centralKingHasEightMoves() {
        GridBoard board = GridBoard.empty();
        Piece king = new Piece(PieceColor.BLACK, PieceType.KING, 4, 4);
        board.place(king);

        assertEquals(8, king.getPossibleMoves(board).size());
    }

    @Test
    void skipsOwnPiecesAndCapturesOthers() {
        GridBoard board = GridBoard.empty();
        Piece king = new Piece(PieceColor.WHITE, PieceType.KING, 4, 0);
        board.place(king);
        board.place(new Piece(PieceColor.WHITE, PieceType.PAWN, 4, 1));
        board.place(new Piece(PieceColor.BLACK, PieceType.PAWN, 3, 1));

        Set<Position> moves = new HashSet<>(king.getPossibleMoves(board));

        assertEquals(Set.of(new Position(3, 0), new Position(5, 0), new Position(3, 1), new Position(5, 1)), moves);
        assertFalse(king.isValidMove(board, 4, 1));
        assertTrue(king.isValidMove(board, 3, 1));
    }

    @Test
    void noCastlingOrLongSteps() {
        GridBoard board = GridBoard.fromFen("8/8/8/8/8/8/8/R3K2R");
        Piece king = board.getPiece(4, 0);

        assertFalse(king.isValidMove(board, 6, 0));
        assertFalse(king.isValidMove(board, 2, 0));
        assertFalse(king.isValidMove(board, 4, 2));
        assertFalse(king.isValidMove(board, 4, 0));
        assertFalse(king.getPossibleMoves(board).contains(new Position(6, 0)));
    }
}
