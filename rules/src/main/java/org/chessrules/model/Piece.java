package org.chessrules.model;

import org.chessrules.board.BoardQuery;
import org.chessrules.rules.MoveRules;

import java.util.List;

/**
 * A piece standing on a square. The board it is queried against is passed to each call;
 * keeping {@link #position()} in sync with the board is the board owner's job.
 */
public record Piece(PieceColor color, PieceType type, Position position) {

    public Piece(PieceColor color, PieceType type, int file, int rank) {
        this(color, type, new Position(file, rank));
    }

    public int file() {
        return position.file();
    }

    public int rank() {
        return position.rank();
    }

    public boolean isValidMove(BoardQuery board, int targetFile, int targetRank) {
        return MoveRules.isValidMove(this, board, targetFile, targetRank);
    }

    public boolean isValidMove(BoardQuery board, Position target) {
        return isValidMove(board, target.file(), target.rank());
    }

    /**
     * Every square this piece may move to on the given board, recomputed on each call.
     */
    public List<Position> getPossibleMoves(BoardQuery board) {
        return MoveRules.possibleMoves(this, board);
    }

    public boolean isOpponentOf(Piece other) {
        return other != null && other.color != color;
    }

    public Piece copy() {
        return new Piece(color, type, position);
    }

    public Piece movedTo(Position target) {
        return new Piece(color, type, target);
    }

    public String getSymbol() {
        return switch (type) {
            case KING -> color == PieceColor.WHITE ? "♔" : "♚";
            case QUEEN -> color == PieceColor.WHITE ? "♕" : "♛";
            case ROOK -> color == PieceColor.WHITE ? "♖" : "♜";
            case BISHOP -> color == PieceColor.WHITE ? "♗" : "♝";
            case KNIGHT -> color == PieceColor.WHITE ? "♘" : "♞";
            case PAWN -> color == PieceColor.WHITE ? "♙" : "♟";
        };
    }

    @Override
    public String toString() {
        return color.toNameString() + " " + type.toNameString() + " " + position;
    }
}
