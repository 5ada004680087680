package org.gambitpairing.exception;

/**
 * Recorded results do not correspond one-to-one with the round's pairings.
 */
public class ResultMismatchException extends TournamentException {

    public ResultMismatchException(String message) {
        super(message);
    }
}
