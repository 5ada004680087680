package org.gambitpairing.comparison;

/**
 * Size classes used to break comparison results down by field size.
 */
public enum TournamentSize {
    SMALL(16),
    MEDIUM(32),
    LARGE(Integer.MAX_VALUE);

    private final int maxPlayers;

    TournamentSize(int maxPlayers) {
        this.maxPlayers = maxPlayers;
    }

    public int maxPlayers() {
        return maxPlayers;
    }

    public static TournamentSize of(int players) {
        for (TournamentSize size : values()) {
            if (players <= size.maxPlayers) {
                return size;
            }
        }
        return LARGE;
    }
}
