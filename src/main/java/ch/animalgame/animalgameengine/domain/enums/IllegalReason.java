package ch.animalgame.animalgameengine.domain.enums;

/**
 * Why a requested move was rejected.
 */
public enum IllegalReason {

    /**
     * A square is missing or the start and destination are the same square.
     */
    SAME_OR_OUT_OF_BOUNDS,

    /**
     * The start square is empty or holds a piece of the other player.
     */
    NO_OWNED_PIECE,

    /**
     * The piece cannot cover this delta with either its primary or its secondary move.
     */
    BAD_GEOMETRY,

    /**
     * A sliding move passes over an occupied square.
     */
    BLOCKED,

    /**
     * The destination holds one of the mover's own pieces.
     */
    FRIENDLY_OCCUPIED
}
