package org.gambitpairing.exception;

/**
 * No rule-compliant pairing exists for the requested round.
 *
 * <p>Recoverable only by relaxing the tournament configuration; the engine never
 * falls back to a pairing that breaks a hard rule.
 */
public class PairingInfeasibleException extends TournamentException {

    private final int roundNumber;

    public PairingInfeasibleException(int roundNumber, String message) {
        super("Round " + roundNumber + ": " + message);
        this.roundNumber = roundNumber;
    }

    public int getRoundNumber() {
        return roundNumber;
    }
}
