package ch.animalgame.animalgameengine.domain.enums;

/**
 * The two sides of a game. {@link #TANGERINE} always moves first.
 */
public enum PlayerColor {
    TANGERINE,
    AMETHYST;

    /**
     * Returns the opposing side.
     *
     * @return the other player color
     */
    public PlayerColor opposite() {
        return this == TANGERINE ? AMETHYST : TANGERINE;
    }
}
