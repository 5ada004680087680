package org.gambitpairing.comparison;

/**
 * Rules checked when scoring a round's pairings. Any hard violation drops the
 * compliance score to zero; soft ones reduce it proportionally.
 */
public enum PairingViolation {
    REMATCH(true),
    SELF_PAIRING(true),
    UNKNOWN_PLAYER(true),
    DUPLICATE_PLAYER(true),
    UNPAIRED_PLAYER(true),
    REPEATED_BYE(true),
    UNNEEDED_BYE(true),
    ABSOLUTE_COLOR(false),
    COLOR_PREFERENCE(false),
    SCORE_GROUP(false),
    SAME_FEDERATION(false),
    BYE_ORDER(false);

    private final boolean hard;

    PairingViolation(boolean hard) {
        this.hard = hard;
    }

    public boolean isHard() {
        return hard;
    }
}
