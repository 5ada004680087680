package org.gambitpairing.comparison;

import com.google.common.collect.ImmutableMap;
import org.gambitpairing.exception.InsufficientSamplesException;
import org.gambitpairing.model.Pairing;
import org.gambitpairing.model.PairingResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatisticalAnalyzerTest {

    private static final double DELTA = 1e-12;

    static final PairingResult ROUND = PairingResult.of(1, List.of(new Pairing("a", "b")), Optional.empty());

    static EngineRun success(String engine, double overall, ImmutableMap<PairingViolation, Integer> violations) {
        return EngineRun.success(engine, ROUND, new EngineMetrics(1.0, overall, overall, violations), 2.0);
    }

    static EngineRun success(String engine, double overall) {
        return success(engine, overall, ImmutableMap.of());
    }

    static ComparisonResult result(int round, EngineRun a, EngineRun b, Optional<PairingDifference> difference) {
        return result(round, 8, a, b, difference);
    }

    static ComparisonResult result(int round, int players, EngineRun a, EngineRun b,
                                   Optional<PairingDifference> difference) {
        return new ComparisonResult("t", round, players, a, b, difference,
            PairingComparisonEngine.decideWinner(a, b));
    }

    static ComparisonResult result(EngineRun a, EngineRun b) {
        return result(1, a, b, Optional.empty());
    }

    static List<ComparisonResult> sample() {
        PairingResult other = PairingResult.of(1, List.of(new Pairing("b", "a")), Optional.empty());
        return List.of(
            result(1, success("swiss", 0.9), success("monrad", 0.8,
                    ImmutableMap.of(PairingViolation.SCORE_GROUP, 2)),
                Optional.of(PairingDifference.between(ROUND, other))),
            result(1, EngineRun.failed("swiss", "Round 1: stuck", 3.0), success("monrad", 0.75), Optional.empty()),
            result(2, success("swiss", 0.85), success("monrad", 0.85),
                Optional.of(PairingDifference.between(ROUND, ROUND))));
    }

    @Test
    void summarize_countsOutcomes() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(sample());

        assertEquals("swiss", summary.engineA());
        assertEquals("monrad", summary.engineB());
        assertEquals(3, summary.comparisons());
        assertEquals(1, summary.winsA());
        assertEquals(1, summary.winsB());
        assertEquals(1, summary.ties());
        assertEquals(0, summary.undecided());
        assertEquals(1, summary.failuresA());
        assertEquals(0, summary.failuresB());
        assertEquals(1.0 / 3, summary.winRateA(), DELTA);
    }

    @Test
    void summarize_excludesFailedRunsFromEngineMetrics() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(sample());

        MetricSummary overallA = summary.metric(StatisticalSummary.keyA(StatisticalSummary.OVERALL)).get();
        MetricSummary overallB = summary.metric(StatisticalSummary.keyB(StatisticalSummary.OVERALL)).get();
        assertEquals(2, overallA.count());
        assertEquals(0.875, overallA.mean(), DELTA);
        assertEquals(3, overallB.count());
        assertEquals(0.8, overallB.mean(), DELTA);
    }

    @Test
    void summarize_aggregatesDivergenceRoundsAndViolations() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(sample());

        MetricSummary colour = summary.metric(StatisticalSummary.COLOR_DIVERGENT_PAIRS).get();
        assertEquals(2, colour.count(), "Only rounds both engines paired have a difference");
        assertEquals(0.5, colour.mean(), DELTA);
        assertEquals(0.0, summary.metric(StatisticalSummary.DIVERGENT_PAIRS).get().mean(), DELTA);

        assertEquals(List.of(1, 2), List.copyOf(summary.rounds().keySet()));
        OutcomeTally first = summary.rounds().get(1);
        assertEquals(2, first.comparisons());
        assertEquals(1, first.divergent());
        assertEquals(1, first.failuresA());
        assertEquals(1, summary.rounds().get(2).ties());

        assertEquals(ImmutableMap.of(PairingViolation.SCORE_GROUP, 2L), summary.violationsB());
        assertFalse(summary.violationsA().containsKey(PairingViolation.SCORE_GROUP));
    }

    @Test
    void summarize_computesMeanVarianceAndRangeOfOverallScores() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(List.of(
            result(success("swiss", 0.80), success("monrad", 0.80)),
            result(success("swiss", 0.90), success("monrad", 0.80)),
            result(success("swiss", 1.00), success("monrad", 0.80))));

        MetricSummary overall = summary.metric(StatisticalSummary.keyA(StatisticalSummary.OVERALL)).get();
        assertEquals(3, overall.count());
        assertEquals(0.9, overall.mean(), DELTA);
        assertEquals(0.01, overall.variance().getAsDouble(), DELTA);
        assertEquals(0.8, overall.min(), DELTA);
        assertEquals(1.0, overall.max(), DELTA);
    }

    @Test
    void summarize_scoreDifferenceOnlyCountsRoundsBothEnginesPaired() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(List.of(
            result(success("swiss", 0.90), success("monrad", 0.80)),
            result(success("swiss", 0.80), success("monrad", 0.80)),
            result(success("swiss", 0.90), success("monrad", 0.60)),
            result(EngineRun.failed("swiss", "stuck", 1.0), success("monrad", 0.10))));

        MetricSummary difference = summary.scoreDifference().get();
        assertEquals(3, difference.count());
        assertEquals(0.4 / 3, difference.mean(), DELTA);
        assertEquals(0.1, summary.medianScoreDifference().getAsDouble(), DELTA);
        // deviations from 2/15: -1/30, -4/30, 5/30; sum of squares 42/900 over 2
        assertEquals(Math.sqrt(21.0 / 900), difference.standardDeviation().getAsDouble(), 1e-9);
        assertEquals(0.0, difference.min(), DELTA);
        assertEquals(0.3, difference.max(), 1e-9);
    }

    @Test
    void summarize_hasNoScoreDifferenceWithoutJointlyPairedRounds() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(List.of(
            result(EngineRun.failed("swiss", "stuck", 1.0), success("monrad", 0.9))));

        assertTrue(summary.scoreDifference().isEmpty());
        assertTrue(summary.medianScoreDifference().isEmpty());
    }

    @Test
    void summarize_isNotSignificantBelowMinimumSamples() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(sample());

        assertEquals(0.0, summary.significance(), DELTA);
        assertEquals(0.5, summary.confidenceLevel(), DELTA);
    }

    @Test
    void summarize_scalesSignificanceAndConfidenceWithSampleSize() {
        List<ComparisonResult> results = List.of(
            result(success("swiss", 0.9), success("monrad", 0.5)),
            result(success("swiss", 0.9), success("monrad", 0.5)),
            result(success("swiss", 0.9), success("monrad", 0.5)),
            result(success("swiss", 0.5), success("monrad", 0.9)));

        StatisticalSummary summary = StatisticalAnalyzer.summarize(results, 2);

        // win rate 0.75: deviation 0.25 * 2 * 4/2 = 1.0 (capped)
        assertEquals(1.0, summary.significance(), DELTA);
        // 0.5 + 0.25 * min(1, 4/6)
        assertEquals(0.5 + 0.25 * 4 / 6, summary.confidenceLevel(), DELTA);
    }

    @Test
    void significance_growsWithSamplesUntilCapped() {
        assertEquals(0.0, StatisticalAnalyzer.significance(29, 29, 30), DELTA);
        assertEquals(0.2, StatisticalAnalyzer.significance(30, 18, 30), DELTA);
        assertEquals(0.4, StatisticalAnalyzer.significance(60, 36, 30), DELTA);
        assertEquals(1.0, StatisticalAnalyzer.significance(300, 300, 30), DELTA);
    }

    @Test
    void confidenceLevel_staysWithinBounds() {
        assertEquals(0.5, StatisticalAnalyzer.confidenceLevel(10, 10, 0, 30), DELTA);
        assertEquals(0.99, StatisticalAnalyzer.confidenceLevel(900, 900, 0, 30), DELTA);
        assertEquals(0.5, StatisticalAnalyzer.confidenceLevel(90, 10, 10, 30), DELTA,
            "Mostly ties never drop below an even split");
        assertEquals(0.8, StatisticalAnalyzer.confidenceLevel(90, 18, 72, 30), DELTA);
    }

    @Test
    void summarize_talliesByTournamentSize() {
        StatisticalSummary summary = StatisticalAnalyzer.summarize(List.of(
            result(1, 8, success("swiss", 0.9), success("monrad", 0.5), Optional.empty()),
            result(1, 16, success("swiss", 0.5), success("monrad", 0.9), Optional.empty()),
            result(1, 17, success("swiss", 0.9), success("monrad", 0.5), Optional.empty()),
            result(1, 64, success("swiss", 0.7), success("monrad", 0.7), Optional.empty())));

        assertEquals(List.of(TournamentSize.SMALL, TournamentSize.MEDIUM, TournamentSize.LARGE),
            List.copyOf(summary.sizes().keySet()));
        OutcomeTally small = summary.sizes().get(TournamentSize.SMALL);
        assertEquals(2, small.comparisons());
        assertEquals(1, small.winsA());
        assertEquals(1, small.winsB());
        assertEquals(0.5, small.winRateA(), DELTA);
        assertEquals(1, summary.sizes().get(TournamentSize.MEDIUM).winsA());
        assertEquals(1, summary.sizes().get(TournamentSize.LARGE).ties());
    }

    @Test
    void summarize_rejectsEmptyInput() {
        assertThrows(InsufficientSamplesException.class, () -> StatisticalAnalyzer.summarize(List.of()));
    }
}
