package org.chessrules.model;

import java.util.Locale;

public enum PieceColor {
    WHITE,
    BLACK;

    public PieceColor opposite() {
        return this == WHITE ? BLACK : WHITE;
    }

    /**
     * Rank step of a pawn of this color: White advances toward rank 7, Black toward rank 0.
     */
    public int pawnDirection() {
        return this == WHITE ? 1 : -1;
    }

    public int pawnStartRank() {
        return this == WHITE ? 1 : 6;
    }

    public String toNameString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
