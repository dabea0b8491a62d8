package ch.animalgame.animalgameengine.domain.enums;

/**
 * Lifecycle state of a game.
 *
 * <p>A game starts {@link #UNFINISHED}. Once one of the won states is reached it is terminal.
 */
public enum GameState {
    UNFINISHED,
    TANGERINE_WON,
    AMETHYST_WON;

    /**
     * Maps a player to the state in which that player has won.
     *
     * @param winner the winning side
     * @return {@link #TANGERINE_WON} or {@link #AMETHYST_WON}
     */
    public static GameState wonBy(PlayerColor winner) {
        return switch (winner) {
            case TANGERINE -> TANGERINE_WON;
            case AMETHYST -> AMETHYST_WON;
        };
    }

    public boolean isFinished() {
        return this != UNFINISHED;
    }
}
