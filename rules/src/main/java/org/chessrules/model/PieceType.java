package org.chessrules.model;

import java.util.Locale;

public enum PieceType {
    ROOK,
    KNIGHT,
    BISHOP,
    QUEEN,
    KING,
    PAWN;

    public boolean isSliding() {
        return switch (this) {
            case ROOK, BISHOP, QUEEN -> true;
            case KNIGHT, KING, PAWN -> false;
        };
    }

    /**
     * Letter used in algebraic notation, empty for pawns.
     */
    public String notationSymbol() {
        return switch (this) {
            case ROOK -> "R";
            case KNIGHT -> "N";
            case BISHOP -> "B";
            case QUEEN -> "Q";
            case KING -> "K";
            case PAWN -> "";
        };
    }

    public String toNameString() {
        String lower = name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
