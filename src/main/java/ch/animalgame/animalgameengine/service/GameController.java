package ch.animalgame.animalgameengine.service;

import ch.animalgame.animalgameengine.domain.Board;
import ch.animalgame.animalgameengine.domain.Coordinate;
import ch.animalgame.animalgameengine.domain.MoveValidation;
import ch.animalgame.animalgameengine.domain.Piece;
import ch.animalgame.animalgameengine.domain.enums.GameState;
import ch.animalgame.animalgameengine.domain.enums.PieceType;
import ch.animalgame.animalgameengine.domain.enums.PlayerColor;
import ch.animalgame.animalgameengine.domain.exception.InvalidNotationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Runs a single game: owns the board, the player to move and the game state.
 *
 * <p>Each move request goes through validate, execute and win check. A rejected request returns
 * {@code false} and leaves board, turn and state untouched. The game is won by capturing the
 * opponent's {@link PieceType#CUTTLEFISH}; after that no further moves are accepted.
 *
 * <p>Instances are not thread-safe. Callers sharing a game must serialize calls to
 * {@link #makeMove(String, String)}.
 */
@Slf4j
public class GameController {

    /**
     * Board owned by this game. Only {@link #makeMove} changes it.
     */
    private final Board board;

    private final MoveValidator moveValidator;

    private final boolean logBoardAfterMove;

    @Getter
    private PlayerColor currentPlayer = PlayerColor.TANGERINE;

    @Getter
    private GameState gameState = GameState.UNFINISHED;

    /**
     * Creates a game on the given board with Tangerine to move.
     *
     * @param board             starting position; the game works on its own copy
     * @param moveValidator     rule checker
     * @param logBoardAfterMove if {@code true}, a board dump is logged at DEBUG after each accepted move
     */
    public GameController(Board board, MoveValidator moveValidator, boolean logBoardAfterMove) {
        this.board = Objects.requireNonNull(board, "board").copy();
        this.moveValidator = Objects.requireNonNull(moveValidator, "moveValidator");
        this.logBoardAfterMove = logBoardAfterMove;
    }

    public GameController(Board board, MoveValidator moveValidator) {
        this(board, moveValidator, false);
    }

    /**
     * Creates a game with the standard starting layout, Tangerine to move.
     *
     * @return new unfinished game
     */
    public static GameController newGame() {
        return new GameController(Board.standardLayout(), new MoveValidator());
    }

    /**
     * Returns a snapshot of the current position. Changes to the snapshot do not affect the game.
     *
     * @return copy of the board
     */
    public Board getBoard() {
        return board.copy();
    }

    /**
     * Counts the pieces a player still has on the board.
     */
    public int countPieces(PlayerColor player) {
        return board.countPieces(player);
    }

    /**
     * Looks up the piece on a square given in algebraic notation.
     *
     * @param notation square such as {@code "d1"}
     * @return the piece, or empty if the square is empty
     * @throws InvalidNotationException if the notation is malformed
     */
    public Optional<Piece> pieceAt(String notation) {
        return board.pieceAt(Coordinate.fromNotation(notation));
    }

    /**
     * Attempts to move the current player's piece.
     *
     * @param fromText start square, e.g. {@code "c1"}
     * @param toText   destination square, e.g. {@code "c5"}
     * @return {@code true} if the move was made, {@code false} if it was rejected for any reason
     */
    public boolean makeMove(String fromText, String toText) {
        Coordinate from;
        Coordinate to;
        try {
            from = Coordinate.fromNotation(fromText);
            to = Coordinate.fromNotation(toText);
        } catch (InvalidNotationException e) {
            log.debug("Rejected move {} -> {}: {}", fromText, toText, e.getMessage());
            return false;
        }

        if (gameState.isFinished()) {
            log.debug("Rejected move {} -> {}: game already finished ({})", from, to, gameState);
            return false;
        }

        MoveValidation validation = moveValidator.isLegal(board, currentPlayer, from, to);
        if (!validation.isLegal()) {
            log.debug("Rejected move {} -> {} by {}: {}", from, to, currentPlayer, validation.reason());
            return false;
        }

        Optional<Piece> captured = board.move(from, to);
        log.debug("{} moved {} -> {} ({} move{})", currentPlayer, from, to,
                validation.kind(), captured.map(p -> ", captured " + p).orElse(""));

        if (captured.map(p -> p.getType() == PieceType.CUTTLEFISH).orElse(false)) {
            gameState = GameState.wonBy(currentPlayer);
            log.info("{} captured the opposing cuttlefish on {}: {}", currentPlayer, to, gameState);
        } else {
            currentPlayer = currentPlayer.opposite();
        }

        if (logBoardAfterMove) {
            log.debug("Board after {} -> {}:\n{}", from, to, board.render());
        }
        return true;
    }
}
