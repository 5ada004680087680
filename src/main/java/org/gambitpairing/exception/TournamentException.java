package org.gambitpairing.exception;

/**
 * Base type for every failure the pairing engine reports to its callers.
 */
public class TournamentException extends RuntimeException {

    public TournamentException(String message) {
        super(message);
    }

    public TournamentException(String message, Throwable cause) {
        super(message, cause);
    }
}
