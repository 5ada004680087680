package org.gambitpairing.comparison;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Comparison counts for one slice of the results, such as a round number or a
 * tournament size, across all tournaments.
 */
public record OutcomeTally(
    @JsonProperty("comparisons") int comparisons,
    @JsonProperty("divergent") int divergent,
    @JsonProperty("winsA") int winsA,
    @JsonProperty("winsB") int winsB,
    @JsonProperty("ties") int ties,
    @JsonProperty("failuresA") int failuresA,
    @JsonProperty("failuresB") int failuresB
) {
    static final OutcomeTally EMPTY = new OutcomeTally(0, 0, 0, 0, 0, 0, 0);

    OutcomeTally add(ComparisonResult result) {
        boolean diverged = result.difference().map(d -> !d.isIdentical()).orElse(false);
        return new OutcomeTally(
            comparisons + 1,
            divergent + (diverged ? 1 : 0),
            winsA + (result.winner() == Winner.ENGINE_A ? 1 : 0),
            winsB + (result.winner() == Winner.ENGINE_B ? 1 : 0),
            ties + (result.winner() == Winner.TIE ? 1 : 0),
            failuresA + (result.runA().succeeded() ? 0 : 1),
            failuresB + (result.runB().succeeded() ? 0 : 1));
    }

    /** Share of this slice's comparisons won by engine A. */
    public double winRateA() {
        return comparisons == 0 ? 0.0 : (double) winsA / comparisons;
    }

    public double winRateB() {
        return comparisons == 0 ? 0.0 : (double) winsB / comparisons;
    }
}
