package org.gambitpairing.comparison;

/**
 * Which engine scored better on a comparison.
 */
public enum Winner {
    ENGINE_A,
    ENGINE_B,
    /** Overall scores closer than {@link PairingComparisonEngine#TIE_THRESHOLD}. */
    TIE,
    /** Neither engine produced a pairing. */
    NONE
}
