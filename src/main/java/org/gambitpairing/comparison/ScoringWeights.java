package org.gambitpairing.comparison;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * Blend of rules compliance and pairing quality used for the overall score.
 * Weights are normalised on construction so they always sum to 1.
 */
public record ScoringWeights(
    @JsonProperty("fide") double fide,
    @JsonProperty("quality") double quality
) {
    public static final ScoringWeights DEFAULT = new ScoringWeights(0.7, 0.3);

    public ScoringWeights {
        Preconditions.checkArgument(fide >= 0 && quality >= 0, "weights must not be negative");
        double total = fide + quality;
        Preconditions.checkArgument(total > 0, "at least one weight must be positive");
        fide = fide / total;
        quality = quality / total;
    }
}
