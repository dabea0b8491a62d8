package ch.animalgame.animalgameengine.domain.enums;

import ch.animalgame.animalgameengine.domain.MovementProfile;

/**
 * Defines the four piece types and their movement profiles.
 *
 * <p>Every type also has a one-square secondary step on the axis perpendicular to its primary axis;
 * see {@link MovementProfile#canReach(int, int)}.
 */
public enum PieceType {

    /**
     * Slides one square diagonally.
     */
    CHINCHILLA('C', Axis.DIAGONAL, 1, MovementMode.SLIDING),

    /**
     * Jumps exactly four squares orthogonally.
     */
    WOMBAT('W', Axis.ORTHOGONAL, 4, MovementMode.JUMPING),

    /**
     * Slides up to three squares orthogonally.
     */
    EMU('E', Axis.ORTHOGONAL, 3, MovementMode.SLIDING),

    /**
     * Jumps exactly two squares diagonally. Capturing it wins the game.
     */
    CUTTLEFISH('U', Axis.DIAGONAL, 2, MovementMode.JUMPING);

    /**
     * Single-letter symbol used in board dumps.
     */
    private final char symbol;

    private final MovementProfile profile;

    PieceType(char symbol, Axis primaryAxis, int primaryDistance, MovementMode primaryMode) {
        this.symbol = symbol;
        this.profile = new MovementProfile(primaryAxis, primaryDistance, primaryMode);
    }

    public char getSymbol() {
        return symbol;
    }

    /**
     * Returns the movement profile of this type. The profile never changes.
     *
     * @return movement profile
     */
    public MovementProfile movementProfile() {
        return profile;
    }
}
