package ch.animalgame.animalgameengine.domain;

import ch.animalgame.animalgameengine.domain.enums.Axis;
import ch.animalgame.animalgameengine.domain.enums.MoveKind;
import ch.animalgame.animalgameengine.domain.enums.MovementMode;
import ch.animalgame.animalgameengine.domain.enums.PieceType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Geometry classification of {@link MovementProfile#canReach(int, int)} for every piece type.
 *
 * <p>Blocking and occupancy are covered by the validator tests.
 */
class MovementProfileTest {

    @Test
    void movementProfile_shouldMatchPieceTable() {
        // Act + Assert
        assertThat(PieceType.CHINCHILLA.movementProfile())
                .isEqualTo(new MovementProfile(Axis.DIAGONAL, 1, MovementMode.SLIDING));
        assertThat(PieceType.WOMBAT.movementProfile())
                .isEqualTo(new MovementProfile(Axis.ORTHOGONAL, 4, MovementMode.JUMPING));
        assertThat(PieceType.EMU.movementProfile())
                .isEqualTo(new MovementProfile(Axis.ORTHOGONAL, 3, MovementMode.SLIDING));
        assertThat(PieceType.CUTTLEFISH.movementProfile())
                .isEqualTo(new MovementProfile(Axis.DIAGONAL, 2, MovementMode.JUMPING));
    }

    @ParameterizedTest(name = "{0} ({1},{2}) -> {3}")
    @CsvSource({
            // Chinchilla: one square in any direction
            "CHINCHILLA,  1,  1, PRIMARY",
            "CHINCHILLA, -1,  1, PRIMARY",
            "CHINCHILLA,  1,  0, SECONDARY",
            "CHINCHILLA,  0, -1, SECONDARY",
            "CHINCHILLA,  2,  2, NONE",
            "CHINCHILLA,  2,  0, NONE",
            // Wombat: exactly four orthogonally, or one diagonally
            "WOMBAT,      4,  0, PRIMARY",
            "WOMBAT,      0, -4, PRIMARY",
            "WOMBAT,      3,  0, NONE",
            "WOMBAT,      1,  0, NONE",
            "WOMBAT,      5,  0, NONE",
            "WOMBAT,     -1,  1, SECONDARY",
            "WOMBAT,      2,  2, NONE",
            // Emu: up to three orthogonally, or one diagonally
            "EMU,         1,  0, PRIMARY",
            "EMU,         3,  0, PRIMARY",
            "EMU,         0, -2, PRIMARY",
            "EMU,         4,  0, NONE",
            "EMU,         1, -1, SECONDARY",
            "EMU,         2,  1, NONE",
            // Cuttlefish: exactly two diagonally, or one orthogonally
            "CUTTLEFISH,  2,  2, PRIMARY",
            "CUTTLEFISH, -2,  2, PRIMARY",
            "CUTTLEFISH,  1,  1, NONE",
            "CUTTLEFISH,  0,  1, SECONDARY",
            "CUTTLEFISH, -1,  0, SECONDARY",
            "CUTTLEFISH,  2,  0, NONE",
            "CUTTLEFISH,  3,  3, NONE"
    })
    void canReach_shouldClassifyDelta(PieceType type, int rowDelta, int colDelta, String expected) {
        // Arrange
        MovementProfile profile = type.movementProfile();

        // Act + Assert
        if ("NONE".equals(expected)) {
            assertThat(profile.canReach(rowDelta, colDelta)).isEmpty();
        } else {
            assertThat(profile.canReach(rowDelta, colDelta)).contains(MoveKind.valueOf(expected));
        }
    }

    @Test
    void canReach_shouldRejectZeroDelta() {
        // Act + Assert
        for (PieceType type : PieceType.values()) {
            assertThat(type.movementProfile().canReach(new Delta(0, 0))).isEmpty();
        }
    }

    @Test
    void constructor_shouldThrow_whenDistanceNotPositive() {
        // Act + Assert
        assertThatThrownBy(() -> new MovementProfile(Axis.DIAGONAL, 0, MovementMode.SLIDING))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
