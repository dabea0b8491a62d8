package ch.animalgame.animalgameengine.service;

import ch.animalgame.animalgameengine.domain.Board;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Creates new games wired with the shared {@link MoveValidator}.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code animalgame.log-board-after-move}: log a board dump at DEBUG after every accepted move
 *       (default: {@code false})</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameService {

    private final MoveValidator moveValidator;

    @Getter
    @Value("${animalgame.log-board-after-move:false}")
    private boolean logBoardAfterMove;

    /**
     * Starts a game with the standard layout, Tangerine to move.
     *
     * @return new unfinished game
     */
    public GameController newGame() {
        GameController game = new GameController(Board.standardLayout(), moveValidator, logBoardAfterMove);
        log.info("New game created, {} to move", game.getCurrentPlayer());
        return game;
    }
}
