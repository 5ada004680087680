package org.gambitpairing.exception;

public class UnknownFederationCodeException extends TournamentException {

    private final String code;

    public UnknownFederationCodeException(String code) {
        super("Unknown federation code: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
