package ch.animalgame.animalgameengine.service;

import ch.animalgame.animalgameengine.domain.Board;
import ch.animalgame.animalgameengine.domain.Coordinate;
import ch.animalgame.animalgameengine.domain.Delta;
import ch.animalgame.animalgameengine.domain.MoveValidation;
import ch.animalgame.animalgameengine.domain.MovementProfile;
import ch.animalgame.animalgameengine.domain.Piece;
import ch.animalgame.animalgameengine.domain.enums.IllegalReason;
import ch.animalgame.animalgameengine.domain.enums.MoveKind;
import ch.animalgame.animalgameengine.domain.enums.PlayerColor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether a move request is legal on a given board.
 *
 * <p>Rules implemented here:
 * <ul>
 *   <li>Start and destination must be two distinct squares.</li>
 *   <li>The start square must hold a piece of the moving player.</li>
 *   <li>The delta must match the piece's primary or secondary move.</li>
 *   <li>A sliding primary move needs every square in between to be empty, whoever occupies it.</li>
 *   <li>A jumping primary move ignores the squares in between.</li>
 *   <li>The destination must not hold one of the mover's own pieces.</li>
 * </ul>
 *
 * <p>The validator is stateless and never mutates the board.
 */
@Component
public class MoveValidator {

    /**
     * Validates a move for {@code mover}.
     *
     * @param board current board
     * @param mover player whose turn it is
     * @param from  start square
     * @param to    destination square
     * @return the move kind and capture flag, or the reason the move is illegal
     */
    public MoveValidation isLegal(Board board, PlayerColor mover, Coordinate from, Coordinate to) {
        // 1) Two distinct squares on the board
        if (from == null || to == null || from.equals(to)) {
            return MoveValidation.illegal(IllegalReason.SAME_OR_OUT_OF_BOUNDS);
        }

        // 2) Mover owns the piece on the start square
        Optional<Piece> moving = board.pieceAt(from);
        if (moving.isEmpty() || !moving.get().isOwnedBy(mover)) {
            return MoveValidation.illegal(IllegalReason.NO_OWNED_PIECE);
        }
        MovementProfile profile = moving.get().movementProfile();

        // 3) Geometry
        Delta delta = from.deltaTo(to);
        Optional<MoveKind> kind = profile.canReach(delta);
        if (kind.isEmpty()) {
            return MoveValidation.illegal(IllegalReason.BAD_GEOMETRY);
        }

        // 4) Path: only sliding primary moves can be blocked. Secondary steps have no squares in between.
        if (kind.get() == MoveKind.PRIMARY && profile.isSliding() && !isPathClear(board, from, delta)) {
            return MoveValidation.illegal(IllegalReason.BLOCKED);
        }

        // 5) Destination
        if (board.isOccupiedBy(to, mover)) {
            return MoveValidation.illegal(IllegalReason.FRIENDLY_OCCUPIED);
        }

        boolean capture = board.isOccupiedBy(to, mover.opposite());
        return MoveValidation.legal(kind.get(), capture);
    }

    /**
     * Walks the straight line from {@code from} towards the destination and checks every square
     * strictly in between.
     */
    private boolean isPathClear(Board board, Coordinate from, Delta delta) {
        int rowStep = delta.rowStep();
        int colStep = delta.colStep();

        for (int step = 1; step < delta.distance(); step++) {
            Coordinate between = from.offset(rowStep * step, colStep * step);
            if (board.isOccupied(between)) {
                return false;
            }
        }
        return true;
    }
}
