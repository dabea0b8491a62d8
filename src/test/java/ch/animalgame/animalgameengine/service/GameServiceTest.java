package ch.animalgame.animalgameengine.service;

import ch.animalgame.animalgameengine.domain.Board;
import ch.animalgame.animalgameengine.domain.Coordinate;
import ch.animalgame.animalgameengine.domain.MoveValidation;
import ch.animalgame.animalgameengine.domain.enums.GameState;
import ch.animalgame.animalgameengine.domain.enums.IllegalReason;
import ch.animalgame.animalgameengine.domain.enums.MoveKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static ch.animalgame.animalgameengine.domain.enums.PlayerColor.AMETHYST;
import static ch.animalgame.animalgameengine.domain.enums.PlayerColor.TANGERINE;
import static ch.animalgame.animalgameengine.testutil.BoardFixtures.at;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameServiceTest {

    @Mock
    private MoveValidator moveValidator;

    @InjectMocks
    private GameService gameService;

    @Test
    void newGame_shouldReturnFreshGameWithStandardLayout() {
        // Act
        GameController game = gameService.newGame();

        // Assert
        assertThat(game.getGameState()).isEqualTo(GameState.UNFINISHED);
        assertThat(game.getCurrentPlayer()).isEqualTo(TANGERINE);
        assertThat(game.getBoard()).isEqualTo(Board.standardLayout());
        verifyNoInteractions(moveValidator);
    }

    @Test
    void newGame_shouldCreateIndependentBoards() {
        // Arrange
        when(moveValidator.isLegal(any(Board.class), eq(TANGERINE), eq(at("a1")), eq(at("a2"))))
                .thenReturn(MoveValidation.legal(MoveKind.SECONDARY, false));
        GameController first = gameService.newGame();
        GameController second = gameService.newGame();

        // Act
        first.makeMove("a1", "a2");

        // Assert
        assertThat(first.pieceAt("a1")).isEmpty();
        assertThat(second.pieceAt("a1")).isPresent();
        assertThat(second.getBoard()).isEqualTo(Board.standardLayout());
    }

    @Test
    void newGame_shouldUseInjectedValidator_andRejectWithoutMutation() {
        // Arrange
        when(moveValidator.isLegal(any(Board.class), eq(TANGERINE), any(Coordinate.class), any(Coordinate.class)))
                .thenReturn(MoveValidation.illegal(IllegalReason.BAD_GEOMETRY));
        GameController game = gameService.newGame();

        // Act
        boolean moved = game.makeMove("c1", "c5");

        // Assert
        assertThat(moved).isFalse();
        assertThat(game.getBoard()).isEqualTo(Board.standardLayout());
        assertThat(game.getCurrentPlayer()).isEqualTo(TANGERINE);
        verify(moveValidator, times(1)).isLegal(game.getBoard(), TANGERINE, at("c1"), at("c5"));
    }

    @Test
    void newGame_shouldExecuteMove_whenValidatorAccepts() {
        // Arrange
        when(moveValidator.isLegal(any(Board.class), eq(TANGERINE), eq(at("a1")), eq(at("a2"))))
                .thenReturn(MoveValidation.legal(MoveKind.SECONDARY, false));
        GameController game = gameService.newGame();

        // Act
        boolean moved = game.makeMove("a1", "a2");

        // Assert
        assertThat(moved).isTrue();
        assertThat(game.pieceAt("a2")).isPresent();
        assertThat(game.pieceAt("a1")).isEmpty();
        assertThat(game.getCurrentPlayer()).isEqualTo(AMETHYST);
    }

    @Test
    void newGame_shouldNotCallValidator_whenNotationIsInvalid() {
        // Arrange
        GameController game = gameService.newGame();

        // Act
        boolean moved = game.makeMove("x9", "a2");

        // Assert
        assertThat(moved).isFalse();
        verifyNoInteractions(moveValidator);
    }
}
