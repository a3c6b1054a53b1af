package org.chessrules.model;

public record Move(Position from, Position to, Piece piece, Piece capturedPiece) {
    public boolean isCapture() {
        return capturedPiece != null;
    }

    public String toNotation() {
        String pieceSymbol = piece.type().notationSymbol();
        String capture = capturedPiece != null ? "x" : "";
        if (piece.type() == PieceType.PAWN && capturedPiece != null) {
            pieceSymbol = String.valueOf((char) ('a' + from.file()));
        }
        return pieceSymbol + capture + to.toChessNotation();
    }

    @Override
    public String toString() {
        if (capturedPiece != null) {
            return from.toChessNotation() + " x " + to.toChessNotation();
        }
        return from.toChessNotation() + " -> " + to.toChessNotation();
    }
}
