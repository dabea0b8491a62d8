package ch.animalgame.animalgameengine.domain;

import ch.animalgame.animalgameengine.domain.enums.Axis;
import ch.animalgame.animalgameengine.domain.enums.MoveKind;
import ch.animalgame.animalgameengine.domain.enums.MovementMode;

import java.util.Optional;

/**
 * Movement capability of a piece type: primary axis, primary distance and primary mode.
 *
 * <p>The secondary step (one square on the perpendicular axis) is shared by all types and is
 * therefore derived here rather than stored.
 *
 * @param primaryAxis     axis of the primary move
 * @param primaryDistance maximum (sliding) or exact (jumping) distance of the primary move
 * @param primaryMode     sliding or jumping
 */
public record MovementProfile(Axis primaryAxis, int primaryDistance, MovementMode primaryMode) {

    public MovementProfile {
        if (primaryDistance < 1) {
            throw new IllegalArgumentException("Primary distance must be positive: " + primaryDistance);
        }
    }

    public boolean isSliding() {
        return primaryMode == MovementMode.SLIDING;
    }

    /**
     * Classifies a requested delta by geometry alone. Blocking and occupancy are not considered.
     *
     * <p>Rules:
     * <ul>
     *   <li>{@link MoveKind#PRIMARY}: the delta lies on the primary axis and its length is
     *       {@code 1..primaryDistance} when sliding, or exactly {@code primaryDistance} when jumping.</li>
     *   <li>{@link MoveKind#SECONDARY}: the delta lies on the perpendicular axis with length 1.</li>
     * </ul>
     *
     * @param rowDelta signed row offset
     * @param colDelta signed column offset
     * @return the move kind, or empty if the piece cannot make this move
     */
    public Optional<MoveKind> canReach(int rowDelta, int colDelta) {
        int distance = Math.max(Math.abs(rowDelta), Math.abs(colDelta));

        if (primaryAxis.contains(rowDelta, colDelta)) {
            boolean inRange = isSliding()
                    ? distance <= primaryDistance
                    : distance == primaryDistance;
            return inRange ? Optional.of(MoveKind.PRIMARY) : Optional.empty();
        }

        if (primaryAxis.perpendicular().contains(rowDelta, colDelta) && distance == 1) {
            return Optional.of(MoveKind.SECONDARY);
        }

        return Optional.empty();
    }

    /**
     * Convenience overload taking a {@link Delta}.
     *
     * @param delta signed offset between two squares
     * @return the move kind, or empty if the piece cannot make this move
     */
    public Optional<MoveKind> canReach(Delta delta) {
        return canReach(delta.rowDelta(), delta.colDelta());
    }
}
