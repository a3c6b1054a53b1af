package org.chessrules;

import org.chessrules.board.BoardQuery;
import org.chessrules.model.Move;
import org.chessrules.model.Piece;
import org.chessrules.model.PieceColor;
import org.chessrules.model.Position;
import org.chessrules.rules.MoveRules;
import org.chessrules.settings.RulesSettings;
import org.chessrules.settings.SettingsManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Answers move questions for the game layer. Only advises: applying a move, removing a
 * captured piece and checking king safety stay with the caller.
 */
public class MoveAdvisor {
    private static final Logger logger = LoggerFactory.getLogger(MoveAdvisor.class);

    private final RulesSettings settings;

    public MoveAdvisor() {
        this(new RulesSettings());
    }

    public MoveAdvisor(RulesSettings settings) {
        Objects.requireNonNull(settings, "settings");
        this.settings = settings.copy();
        logger.debug("MoveAdvisor created: rejectOwnColorTargets={}", this.settings.isRejectOwnColorTargets());
        if (!this.settings.isRejectOwnColorTargets()) {
            logger.info("Own-color targets are not rejected by validation; callers must check the target square");
        }
    }

    public static MoveAdvisor fromSettings(SettingsManager manager) {
        return new MoveAdvisor(manager.getSettings().getRules());
    }

    public RulesSettings getSettings() {
        return settings.copy();
    }

    public boolean isLegal(BoardQuery board, Piece piece, Position target) {
        boolean legal = MoveRules.isValidMove(piece, board, target.file(), target.rank(),
                settings.isRejectOwnColorTargets());
        if (settings.isLogQueries()) {
            logger.debug("isLegal {} -> {}: {}", piece, target, legal);
        }
        return legal;
    }

    public List<Position> legalMoves(BoardQuery board, Piece piece) {
        List<Position> moves = piece.getPossibleMoves(board);
        if (settings.isLogQueries()) {
            logger.debug("{} has {} moves: {}", piece, moves.size(), moves);
        }
        return moves;
    }

    /**
     * Moves of whatever stands on the square; empty when the square is off the board or empty.
     */
    public List<Position> legalMovesFrom(BoardQuery board, Position from) {
        if (!board.isValidPosition(from) || !board.isOccupied(from)) {
            if (settings.isLogQueries()) {
                logger.debug("No piece to move on {}", from);
            }
            return new ArrayList<>();
        }
        return legalMoves(board, board.getPiece(from));
    }

    public List<Move> moves(BoardQuery board, Piece piece) {
        List<Move> result = new ArrayList<>();
        for (Position to : legalMoves(board, piece)) {
            Piece captured = board.isOccupied(to) ? board.getPiece(to) : null;
            result.add(new Move(piece.position(), to, piece, captured));
        }
        return result;
    }

    /**
     * Every move available to one side, scanning squares a1, b1, ... h8.
     */
    public List<Move> allMoves(BoardQuery board, PieceColor color) {
        List<Move> result = new ArrayList<>();
        for (int rank = 0; rank < Position.BOARD_SIZE; rank++) {
            for (int file = 0; file < Position.BOARD_SIZE; file++) {
                if (board.isOccupiedBy(file, rank, color)) {
                    result.addAll(moves(board, board.getPiece(file, rank)));
                }
            }
        }
        if (settings.isLogQueries()) {
            logger.debug("{} has {} moves in total", color.toNameString(), result.size());
        }
        return result;
    }
}
