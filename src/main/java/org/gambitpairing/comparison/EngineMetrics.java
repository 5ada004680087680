package org.gambitpairing.comparison;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

/**
 * Scores of one engine's pairing for one round, all on a 0..1 scale.
 *
 * @param fideScore    rules compliance; 0 on any hard violation
 * @param qualityScore pairing quality
 * @param overallScore weighted blend of the two
 * @param violations   number of violations per rule, zero counts omitted
 */
public record EngineMetrics(
    @JsonProperty("fideScore") double fideScore,
    @JsonProperty("qualityScore") double qualityScore,
    @JsonProperty("overallScore") double overallScore,
    @JsonProperty("violations") ImmutableMap<PairingViolation, Integer> violations
) {
    public boolean hasHardViolation() {
        return violations.keySet().stream().anyMatch(PairingViolation::isHard);
    }
}
