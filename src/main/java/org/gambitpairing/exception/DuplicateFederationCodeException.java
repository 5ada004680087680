package org.gambitpairing.exception;

public class DuplicateFederationCodeException extends TournamentException {

    private final String code;

    public DuplicateFederationCodeException(String code) {
        super("Federation '" + code + "' already registered");
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
