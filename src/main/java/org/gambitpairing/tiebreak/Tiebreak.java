package org.gambitpairing.tiebreak;

/**
 * Secondary ranking criteria. Higher values rank higher for every criterion.
 */
public enum Tiebreak {
    /** Sum of opponents' scores. Also known as Solkoff. */
    BUCHHOLZ("Buchholz"),
    /** Buchholz without the lowest opponent score. */
    BUCHHOLZ_CUT_1("Buchholz Cut-1"),
    /**
     * USCF modified median: drop the lowest opponent score above 50%, the highest
     * below 50%, and both at exactly 50%.
     */
    MEDIAN_BUCHHOLZ("Median"),
    /** Opponents' scores weighted by the points taken from them. */
    SONNEBORN_BERGER("Sonneborn-Berger"),
    /** Sum of the player's running score after each round. */
    PROGRESSIVE("Progressive"),
    /** Sum of opponents' running scores at the time each game was played. */
    CUMULATIVE_OPPONENTS("Cumulative Opp"),
    BLACK_GAMES("Games with Black"),
    WINS("Number of Wins"),
    BLACK_WINS("Wins with Black"),
    /** Mean rating of rated opponents; 0 when none are rated. */
    AVERAGE_RATING_OF_OPPONENTS("Avg Rating of Opp");

    private final String displayName;

    Tiebreak(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
