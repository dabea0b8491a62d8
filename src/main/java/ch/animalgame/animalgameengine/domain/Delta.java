package ch.animalgame.animalgameengine.domain;

/**
 * Signed offset between two squares.
 *
 * @param rowDelta target row minus source row
 * @param colDelta target column minus source column
 */
public record Delta(int rowDelta, int colDelta) {

    /**
     * Number of squares covered by a straight-line move (Chebyshev distance).
     */
    public int distance() {
        return Math.max(Math.abs(rowDelta), Math.abs(colDelta));
    }

    /**
     * Unit row step towards the target: -1, 0 or 1.
     */
    public int rowStep() {
        return Integer.signum(rowDelta);
    }

    /**
     * Unit column step towards the target: -1, 0 or 1.
     */
    public int colStep() {
        return Integer.signum(colDelta);
    }
}
