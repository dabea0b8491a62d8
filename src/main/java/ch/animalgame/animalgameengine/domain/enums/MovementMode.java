package ch.animalgame.animalgameengine.domain.enums;

/**
 * How a piece travels along its primary axis.
 */
public enum MovementMode {

    /**
     * Moves any distance from 1 up to the maximum. Every square passed over must be empty.
     */
    SLIDING,

    /**
     * Moves exactly the fixed distance. Squares passed over are ignored.
     */
    JUMPING
}
