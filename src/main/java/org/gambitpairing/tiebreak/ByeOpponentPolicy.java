package org.gambitpairing.tiebreak;

/**
 * What an opponent-based tiebreak counts for a round in which the player had a bye.
 */
public enum ByeOpponentPolicy {
    /**
     * Counts a virtual opponent whose score is the player's score before the bye round
     * plus half a point for every completed round after it. Default.
     */
    VIRTUAL_OPPONENT,
    /** Counts the player's own current score as the opponent's. */
    OWN_SCORE,
    /** The bye round contributes nothing. */
    EXCLUDE
}
