package ch.animalgame.animalgameengine.domain;

import ch.animalgame.animalgameengine.domain.enums.PieceType;
import ch.animalgame.animalgameengine.domain.enums.PlayerColor;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * The 7x7 playing grid. Each square holds at most one piece.
 *
 * <p>The board only stores state. It performs no rule checks: callers (see
 * {@link ch.animalgame.animalgameengine.service.MoveValidator}) decide whether a mutation is legal.
 */
public class Board {

    /**
     * Home squares of the starting layout, keyed by file. Tangerine uses rank 1 and Amethyst the
     * mirrored square on rank 7:
     * <pre>
     *   7  c . w u e . .
     *   1  C . W U E . .
     *      a b c d e f g
     * </pre>
     */
    private static final Map<Character, PieceType> HOME_FILES = Map.of(
            'a', PieceType.CHINCHILLA,
            'c', PieceType.WOMBAT,
            'd', PieceType.CUTTLEFISH,
            'e', PieceType.EMU
    );

    private static final int TANGERINE_HOME_ROW = 0;
    private static final int AMETHYST_HOME_ROW = Coordinate.SIZE - 1;

    private final Piece[][] cells = new Piece[Coordinate.SIZE][Coordinate.SIZE];

    private Board() {
    }

    /**
     * Creates a board without any pieces.
     *
     * @return empty board
     */
    public static Board empty() {
        return new Board();
    }

    /**
     * Creates a board with the fixed starting layout: one piece of each type per player.
     *
     * @return board ready for a new game
     */
    public static Board standardLayout() {
        Board board = new Board();
        HOME_FILES.forEach((file, type) -> {
            int column = file - 'a';
            board.place(new Coordinate(TANGERINE_HOME_ROW, column), new Piece(type, PlayerColor.TANGERINE));
            board.place(new Coordinate(AMETHYST_HOME_ROW, column), new Piece(type, PlayerColor.AMETHYST));
        });
        return board;
    }

    /**
     * Returns an independent board with the same pieces.
     *
     * @return deep copy (pieces are immutable and shared)
     */
    public Board copy() {
        Board copy = new Board();
        for (int row = 0; row < Coordinate.SIZE; row++) {
            System.arraycopy(cells[row], 0, copy.cells[row], 0, Coordinate.SIZE);
        }
        return copy;
    }

    public Optional<Piece> pieceAt(Coordinate coordinate) {
        return Optional.ofNullable(cells[coordinate.getRow()][coordinate.getColumn()]);
    }

    public boolean isOccupied(Coordinate coordinate) {
        return cells[coordinate.getRow()][coordinate.getColumn()] != null;
    }

    /**
     * Checks whether the square holds a piece of the given player.
     *
     * @param coordinate square to inspect
     * @param player     owner to test for
     * @return {@code true} if occupied by {@code player}
     */
    public boolean isOccupiedBy(Coordinate coordinate, PlayerColor player) {
        Piece piece = cells[coordinate.getRow()][coordinate.getColumn()];
        return piece != null && piece.isOwnedBy(player);
    }

    /**
     * Puts a piece on a square, replacing any previous occupant.
     *
     * @param coordinate target square
     * @param piece      piece to place
     */
    public void place(Coordinate coordinate, Piece piece) {
        if (piece == null) {
            throw new IllegalArgumentException("Cannot place a null piece at " + coordinate);
        }
        cells[coordinate.getRow()][coordinate.getColumn()] = piece;
    }

    /**
     * Clears a square.
     *
     * @param coordinate square to clear
     * @return the piece that was removed, if any
     */
    public Optional<Piece> remove(Coordinate coordinate) {
        Optional<Piece> removed = pieceAt(coordinate);
        cells[coordinate.getRow()][coordinate.getColumn()] = null;
        return removed;
    }

    /**
     * Moves the piece on {@code from} to {@code to}. Any occupant of {@code to} is removed, which is
     * how a capture happens.
     *
     * @param from source square
     * @param to   destination square
     * @return the captured piece, if {@code to} was occupied
     * @throws IllegalStateException if {@code from} is empty
     */
    public Optional<Piece> move(Coordinate from, Coordinate to) {
        Piece piece = remove(from)
                .orElseThrow(() -> new IllegalStateException("No piece to move at " + from));
        Optional<Piece> captured = remove(to);
        place(to, piece);
        return captured;
    }

    /**
     * Counts the pieces a player still has on the board.
     */
    public int countPieces(PlayerColor player) {
        int count = 0;
        for (Piece[] row : cells) {
            for (Piece piece : row) {
                if (piece != null && piece.isOwnedBy(player)) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Plain-text dump for logs and debugging. Rank 7 is printed first; Tangerine pieces are upper
     * case, Amethyst pieces lower case and empty squares are {@code .}.
     *
     * @return multi-line board picture ending with the file legend
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (int row = Coordinate.SIZE - 1; row >= 0; row--) {
            sb.append(row + 1).append(' ');
            for (int column = 0; column < Coordinate.SIZE; column++) {
                Piece piece = cells[row][column];
                sb.append(piece == null ? '.' : piece.symbol()).append(' ');
            }
            sb.append('\n');
        }
        sb.append("  a b c d e f g");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board other)) return false;
        return Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        return render();
    }
}
