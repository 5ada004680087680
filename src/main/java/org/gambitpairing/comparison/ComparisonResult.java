package org.gambitpairing.comparison;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Both engines' outputs for one round of one tournament, and how they differ.
 * The difference is only present when both engines produced a pairing.
 *
 * @param playerCount players registered in the tournament when the round was paired
 */
public record ComparisonResult(
    @JsonProperty("tournamentId") String tournamentId,
    @JsonProperty("roundNumber") int roundNumber,
    @JsonProperty("playerCount") int playerCount,
    @JsonProperty("runA") EngineRun runA,
    @JsonProperty("runB") EngineRun runB,
    @JsonProperty("difference") Optional<PairingDifference> difference,
    @JsonProperty("winner") Winner winner
) {
    /**
     * Engine A's overall score minus engine B's, only for rounds both engines paired.
     */
    @JsonIgnore
    public OptionalDouble scoreDifference() {
        if (!runA.succeeded() || !runB.succeeded()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(runA.metrics().get().overallScore() - runB.metrics().get().overallScore());
    }
}
