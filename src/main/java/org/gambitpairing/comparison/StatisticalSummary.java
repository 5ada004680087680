package org.gambitpairing.comparison;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Aggregate of many {@link ComparisonResult}s.
 *
 * <p>Metric keys are {@code engineA.*} / {@code engineB.*} ({@code fide}, {@code quality},
 * {@code overall}, {@code elapsedMillis}) plus {@code divergentPairs},
 * {@code colorDivergentPairs} and {@code overallDifference}. Engine metrics only count
 * rounds the engine paired; the difference only counts rounds both engines paired.
 *
 * @param significance    0..1, how far engine A's win rate is from an even split, scaled by
 *                        sample size; 0 below the analyzer's minimum sample count
 * @param confidenceLevel 0.5..0.99, confidence in the engine with more wins
 */
public record StatisticalSummary(
    @JsonProperty("engineA") String engineA,
    @JsonProperty("engineB") String engineB,
    @JsonProperty("comparisons") long comparisons,
    @JsonProperty("metrics") ImmutableMap<String, MetricSummary> metrics,
    @JsonProperty("winsA") long winsA,
    @JsonProperty("winsB") long winsB,
    @JsonProperty("ties") long ties,
    @JsonProperty("undecided") long undecided,
    @JsonProperty("failuresA") long failuresA,
    @JsonProperty("failuresB") long failuresB,
    @JsonProperty("medianScoreDifference") OptionalDouble medianScoreDifference,
    @JsonProperty("significance") double significance,
    @JsonProperty("confidenceLevel") double confidenceLevel,
    @JsonProperty("rounds") ImmutableSortedMap<Integer, OutcomeTally> rounds,
    @JsonProperty("sizes") ImmutableSortedMap<TournamentSize, OutcomeTally> sizes,
    @JsonProperty("violationsA") ImmutableMap<PairingViolation, Long> violationsA,
    @JsonProperty("violationsB") ImmutableMap<PairingViolation, Long> violationsB
) {
    public static final String FIDE = "fide";
    public static final String QUALITY = "quality";
    public static final String OVERALL = "overall";
    public static final String ELAPSED = "elapsedMillis";
    public static final String DIVERGENT_PAIRS = "divergentPairs";
    public static final String COLOR_DIVERGENT_PAIRS = "colorDivergentPairs";
    /** Engine A's overall score minus engine B's, over rounds both engines paired. */
    public static final String SCORE_DIFFERENCE = "overallDifference";

    public static String keyA(String metric) {
        return "engineA." + metric;
    }

    public static String keyB(String metric) {
        return "engineB." + metric;
    }

    public Optional<MetricSummary> metric(String key) {
        return Optional.ofNullable(metrics.get(key));
    }

    @JsonIgnore
    public Optional<MetricSummary> scoreDifference() {
        return metric(SCORE_DIFFERENCE);
    }

    /** Share of decided comparisons (a winner or a tie) won by engine A. */
    @JsonIgnore
    public double winRateA() {
        return rate(winsA);
    }

    @JsonIgnore
    public double winRateB() {
        return rate(winsB);
    }

    @JsonIgnore
    public double tieRate() {
        return rate(ties);
    }

    private double rate(long count) {
        long decided = winsA + winsB + ties;
        return decided == 0 ? 0.0 : (double) count / decided;
    }
}
