package org.gambitpairing.exception;

/**
 * A statistic was requested over fewer samples than it is defined for.
 */
public class InsufficientSamplesException extends TournamentException {

    private final long available;
    private final long required;

    public InsufficientSamplesException(String statistic, long available, long required) {
        super(statistic + " needs at least " + required + " samples, got " + available);
        this.available = available;
        this.required = required;
    }

    public long getAvailable() {
        return available;
    }

    public long getRequired() {
        return required;
    }
}
