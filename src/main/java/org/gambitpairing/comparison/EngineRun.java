package org.gambitpairing.comparison;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.gambitpairing.model.PairingResult;

import java.util.Optional;

/**
 * Outcome of one engine pairing one round: either a pairing with its metrics,
 * or the reason the engine could not pair.
 */
public record EngineRun(
    @JsonProperty("engineName") String engineName,
    @JsonProperty("pairing") Optional<PairingResult> pairing,
    @JsonProperty("metrics") Optional<EngineMetrics> metrics,
    @JsonProperty("failure") Optional<String> failure,
    @JsonProperty("elapsedMillis") double elapsedMillis
) {
    public static EngineRun success(String engineName, PairingResult pairing, EngineMetrics metrics,
                                    double elapsedMillis) {
        return new EngineRun(engineName, Optional.of(pairing), Optional.of(metrics), Optional.empty(), elapsedMillis);
    }

    public static EngineRun failed(String engineName, String message, double elapsedMillis) {
        return new EngineRun(engineName, Optional.empty(), Optional.empty(), Optional.of(message), elapsedMillis);
    }

    @JsonIgnore
    public boolean succeeded() {
        return pairing.isPresent();
    }
}
