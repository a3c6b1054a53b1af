package org.chessrules.board;

import org.chessrules.model.Piece;
import org.chessrules.model.PieceColor;
import org.chessrules.model.PieceType;
import org.chessrules.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Simple 8x8 array board. Not thread-safe: take a {@link #copy()} to query while another
 * thread keeps moving pieces.
 */
public class GridBoard implements BoardQuery {
    private static final Logger logger = LoggerFactory.getLogger(GridBoard.class);

    public static final String START_PLACEMENT = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR";

    // squares[rank][file]
    private final Piece[][] squares = new Piece[Position.BOARD_SIZE][Position.BOARD_SIZE];

    public static GridBoard empty() {
        return new GridBoard();
    }

    public static GridBoard startingPosition() {
        return fromFen(START_PLACEMENT);
    }

    /**
     * Reads the piece-placement field of a FEN string. Anything after the first space is ignored.
     */
    public static GridBoard fromFen(String fen) {
        if (fen == null || fen.isBlank()) {
            throw new IllegalArgumentException("FEN must not be empty");
        }
        String placement = fen.trim().split("\\s+")[0];
        String[] rows = placement.split("/", -1);
        if (rows.length != Position.BOARD_SIZE) {
            throw new IllegalArgumentException("FEN placement needs 8 ranks: " + placement);
        }

        GridBoard board = new GridBoard();
        for (int i = 0; i < rows.length; i++) {
            int rank = 7 - i;
            int file = 0;
            for (char c : rows[i].toCharArray()) {
                if (c >= '1' && c <= '8') {
                    file += c - '0';
                    continue;
                }
                if (file >= Position.BOARD_SIZE) {
                    throw new IllegalArgumentException("Too many squares on rank " + (rank + 1) + ": " + placement);
                }
                board.place(new Piece(colorOf(c), typeOf(c), file, rank));
                file++;
            }
            if (file != Position.BOARD_SIZE) {
                throw new IllegalArgumentException("Rank " + (rank + 1) + " does not cover 8 squares: " + placement);
            }
        }
        logger.debug("Loaded board from FEN placement {}", placement);
        return board;
    }

    private static PieceColor colorOf(char c) {
        return Character.isUpperCase(c) ? PieceColor.WHITE : PieceColor.BLACK;
    }

    private static PieceType typeOf(char c) {
        return switch (Character.toLowerCase(c)) {
            case 'r' -> PieceType.ROOK;
            case 'n' -> PieceType.KNIGHT;
            case 'b' -> PieceType.BISHOP;
            case 'q' -> PieceType.QUEEN;
            case 'k' -> PieceType.KING;
            case 'p' -> PieceType.PAWN;
            default -> throw new IllegalArgumentException("Unknown piece letter: " + c);
        };
    }

    private static char letterOf(Piece piece) {
        char c = switch (piece.type()) {
            case ROOK -> 'r';
            case KNIGHT -> 'n';
            case BISHOP -> 'b';
            case QUEEN -> 'q';
            case KING -> 'k';
            case PAWN -> 'p';
        };
        return piece.color() == PieceColor.WHITE ? Character.toUpperCase(c) : c;
    }

    @Override
    public boolean isValidPosition(int x, int y) {
        return Position.isValid(x, y);
    }

    @Override
    public boolean isOccupied(int x, int y) {
        return squares[y][x] != null;
    }

    @Override
    public Piece getPiece(int x, int y) {
        return squares[y][x];
    }

    /**
     * Puts the piece on the square it names, replacing whatever stood there.
     *
     * @return the replaced piece, or null
     */
    public Piece place(Piece piece) {
        Position pos = piece.position();
        if (!pos.isValid()) {
            throw new IllegalArgumentException("Cannot place piece off the board: " + piece);
        }
        Piece previous = squares[pos.rank()][pos.file()];
        squares[pos.rank()][pos.file()] = piece;
        return previous;
    }

    public Piece remove(Position pos) {
        if (!pos.isValid()) {
            return null;
        }
        Piece previous = squares[pos.rank()][pos.file()];
        squares[pos.rank()][pos.file()] = null;
        return previous;
    }

    public void clear() {
        for (Piece[] row : squares) {
            Arrays.fill(row, null);
        }
    }

    /**
     * All pieces in square order a1, b1, ... h8.
     */
    public List<Piece> pieces() {
        List<Piece> result = new ArrayList<>();
        for (Piece[] row : squares) {
            for (Piece piece : row) {
                if (piece != null) {
                    result.add(piece);
                }
            }
        }
        return result;
    }

    public List<Piece> pieces(PieceColor color) {
        List<Piece> result = new ArrayList<>();
        for (Piece piece : pieces()) {
            if (piece.color() == color) {
                result.add(piece);
            }
        }
        return result;
    }

    public GridBoard copy() {
        GridBoard copy = new GridBoard();
        for (int rank = 0; rank < Position.BOARD_SIZE; rank++) {
            System.arraycopy(squares[rank], 0, copy.squares[rank], 0, Position.BOARD_SIZE);
        }
        return copy;
    }

    public String toFenPlacement() {
        StringBuilder sb = new StringBuilder();
        for (int rank = 7; rank >= 0; rank--) {
            int empty = 0;
            for (int file = 0; file < Position.BOARD_SIZE; file++) {
                Piece p = squares[rank][file];
                if (p == null) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    sb.append(empty);
                    empty = 0;
                }
                sb.append(letterOf(p));
            }
            if (empty > 0) {
                sb.append(empty);
            }
            if (rank > 0) {
                sb.append('/');
            }
        }
        return sb.toString();
    }

    public String toAscii() {
        StringBuilder sb = new StringBuilder();
        for (int rank = 7; rank >= 0; rank--) {
            sb.append(rank + 1).append(' ');
            for (int file = 0; file < Position.BOARD_SIZE; file++) {
                Piece p = squares[rank][file];
                sb.append(p == null ? '.' : letterOf(p));
                sb.append(' ');
            }
            sb.append('\n');
        }
        sb.append("  a b c d e f g h\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return toFenPlacement();
    }
}
