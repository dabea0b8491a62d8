package ch.animalgame.animalgameengine.domain;

import ch.animalgame.animalgameengine.domain.enums.PieceType;
import ch.animalgame.animalgameengine.domain.enums.PlayerColor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * A piece on the board: its type and the player owning it.
 *
 * <p>Pieces are immutable. A captured piece is simply dropped from the board.
 */
@Getter
@EqualsAndHashCode
public final class Piece {

    private final PieceType type;

    private final PlayerColor owner;

    public Piece(PieceType type, PlayerColor owner) {
        this.type = Objects.requireNonNull(type, "type");
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public MovementProfile movementProfile() {
        return type.movementProfile();
    }

    public boolean isOwnedBy(PlayerColor player) {
        return owner == player;
    }

    /**
     * Board dump symbol: upper case for Tangerine, lower case for Amethyst.
     */
    public char symbol() {
        char symbol = type.getSymbol();
        return owner == PlayerColor.TANGERINE ? symbol : Character.toLowerCase(symbol);
    }

    @Override
    public String toString() {
        return owner + " " + type;
    }
}
