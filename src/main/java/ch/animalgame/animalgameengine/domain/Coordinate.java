package ch.animalgame.animalgameengine.domain;

import ch.animalgame.animalgameengine.domain.exception.InvalidNotationException;
import lombok.Getter;

/**
 * Immutable value object representing a square on the 7x7 board.
 *
 * <p>Indices are 0-based. Row 0 is rank {@code 1} (Tangerine's home side) and row 6 is rank {@code 7};
 * column 0 is file {@code a}. Implements {@link #equals(Object)} and {@link #hashCode()} so coordinates
 * can be used as map keys.
 */
@Getter
public final class Coordinate {

    /**
     * Number of rows and columns on the board.
     */
    public static final int SIZE = 7;

    private static final char FIRST_FILE = 'a';
    private static final char FIRST_RANK = '1';

    /**
     * 0-based row (0..6), rank minus one.
     */
    private final int row;

    /**
     * 0-based column (0..6), file letter minus {@code 'a'}.
     */
    private final int column;

    /**
     * Creates a coordinate with 0-based indices.
     *
     * @param row    0-based row
     * @param column 0-based column
     * @throws IllegalArgumentException if either index is outside the board
     */
    public Coordinate(int row, int column) {
        if (!isInBounds(row, column)) {
            throw new IllegalArgumentException("Coordinate out of board bounds: (" + row + ", " + column + ")");
        }
        this.row = row;
        this.column = column;
    }

    /**
     * Checks whether a row/column pair lies on the board.
     *
     * @param row    0-based row
     * @param column 0-based column
     * @return {@code true} if both indices are within 0..6
     */
    public static boolean isInBounds(int row, int column) {
        return row >= 0 && row < SIZE && column >= 0 && column < SIZE;
    }

    /**
     * Parses algebraic notation such as {@code "c5"}.
     *
     * @param notation file letter {@code a}-{@code g} followed by rank digit {@code 1}-{@code 7}
     * @return the matching coordinate
     * @throws InvalidNotationException if the text is not exactly a valid square name
     */
    public static Coordinate fromNotation(String notation) {
        if (notation == null || notation.length() != 2) {
            throw new InvalidNotationException(notation);
        }

        int column = notation.charAt(0) - FIRST_FILE;
        int row = notation.charAt(1) - FIRST_RANK;

        if (!isInBounds(row, column)) {
            throw new InvalidNotationException(notation);
        }
        return new Coordinate(row, column);
    }

    /**
     * Returns the algebraic notation of this square.
     *
     * @return e.g. {@code "a1"} for (0, 0)
     */
    public String toNotation() {
        return String.valueOf((char) (FIRST_FILE + column)) + (char) (FIRST_RANK + row);
    }

    /**
     * Signed offset from this square to another.
     *
     * @param other target square
     * @return {@code other - this} per axis
     */
    public Delta deltaTo(Coordinate other) {
        return new Delta(other.row - row, other.column - column);
    }

    /**
     * Returns the square shifted by the given steps.
     *
     * @throws IllegalArgumentException if the result would leave the board
     */
    public Coordinate offset(int rowStep, int colStep) {
        return new Coordinate(row + rowStep, column + colStep);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinate other)) return false;
        return row == other.row && column == other.column;
    }

    @Override
    public int hashCode() {
        return 31 * row + column;
    }

    @Override
    public String toString() {
        return toNotation();
    }
}
