package ch.animalgame.animalgameengine.domain.enums;

/**
 * Direction family of a move.
 */
public enum Axis {
    DIAGONAL,
    ORTHOGONAL;

    /**
     * Returns the axis a piece uses for its one-square secondary step.
     *
     * @return the other axis
     */
    public Axis perpendicular() {
        return this == DIAGONAL ? ORTHOGONAL : DIAGONAL;
    }

    /**
     * Checks whether a signed delta lies on this axis.
     *
     * @param rowDelta signed row offset
     * @param colDelta signed column offset
     * @return {@code true} if the delta is a straight line along this axis
     */
    public boolean contains(int rowDelta, int colDelta) {
        if (this == DIAGONAL) {
            return rowDelta != 0 && Math.abs(rowDelta) == Math.abs(colDelta);
        }
        return (rowDelta == 0) != (colDelta == 0);
    }
}
