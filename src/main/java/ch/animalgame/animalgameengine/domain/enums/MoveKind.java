package ch.animalgame.animalgameengine.domain.enums;

/**
 * Classification of a geometrically possible move.
 */
public enum MoveKind {

    /**
     * Move along the piece's primary axis.
     */
    PRIMARY,

    /**
     * One-square step on the axis perpendicular to the primary axis.
     */
    SECONDARY
}
