package org.chessrules.model;

/**
 * A square on the board. File 0 is the a-file, rank 0 is the first rank, so (0,0) is a1
 * and (7,7) is h8. Values outside 0..7 are representable but never valid targets.
 */
public record Position(int file, int rank) {
    public static final int BOARD_SIZE = 8;

    public static boolean isValid(int file, int rank) {
        return file >= 0 && file < BOARD_SIZE && rank >= 0 && rank < BOARD_SIZE;
    }

    public boolean isValid() {
        return isValid(file, rank);
    }

    public Position offset(int dx, int dy) {
        return new Position(file + dx, rank + dy);
    }

    public String toChessNotation() {
        char fileChar = (char) ('a' + file);
        return "" + fileChar + (rank + 1);
    }

    public static Position fromChessNotation(String notation) {
        if (notation == null || notation.length() != 2) {
            throw new IllegalArgumentException("Bad square notation: " + notation);
        }
        int file = Character.toLowerCase(notation.charAt(0)) - 'a';
        int rank = notation.charAt(1) - '1';
        if (!isValid(file, rank)) {
            throw new IllegalArgumentException("Bad square notation: " + notation);
        }
        return new Position(file, rank);
    }

    @Override
    public String toString() {
        return isValid() ? toChessNotation() : "(" + file + "," + rank + ")";
    }
}
