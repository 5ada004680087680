package org.gambitpairing.comparison;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.math.Quantiles;
import org.gambitpairing.exception.InsufficientSamplesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Aggregates comparison results into a {@link StatisticalSummary}.
 */
public final class StatisticalAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(StatisticalAnalyzer.class);

    /** Comparisons needed before win rates count as significant. */
    public static final int DEFAULT_MIN_SIGNIFICANCE_SAMPLES = 30;

    private StatisticalAnalyzer() {}

    /**
     * @throws InsufficientSamplesException if {@code results} is empty
     */
    public static StatisticalSummary summarize(List<ComparisonResult> results) {
        return summarize(results, DEFAULT_MIN_SIGNIFICANCE_SAMPLES);
    }

    /**
     * @param minSignificanceSamples comparisons below which significance is 0 and
     *                               confidence stays at 0.5
     * @throws InsufficientSamplesException if {@code results} is empty
     */
    public static StatisticalSummary summarize(List<ComparisonResult> results, int minSignificanceSamples) {
        Preconditions.checkArgument(minSignificanceSamples >= 1, "minSignificanceSamples must be positive");
        if (results.isEmpty()) {
            throw new InsufficientSamplesException("summary", 0, 1);
        }
        Map<String, RunningStatistics> stats = new LinkedHashMap<>();
        Map<PairingViolation, Long> violationsA = new EnumMap<>(PairingViolation.class);
        Map<PairingViolation, Long> violationsB = new EnumMap<>(PairingViolation.class);
        Map<Integer, OutcomeTally> rounds = new TreeMap<>();
        Map<TournamentSize, OutcomeTally> sizes = new EnumMap<>(TournamentSize.class);
        List<Double> differences = new ArrayList<>();
        long winsA = 0;
        long winsB = 0;
        long ties = 0;
        long undecided = 0;
        long failuresA = 0;
        long failuresB = 0;

        for (ComparisonResult result : results) {
            if (accumulate(result.runA(), stats, violationsA, StatisticalSummary::keyA)) {
                failuresA++;
            }
            if (accumulate(result.runB(), stats, violationsB, StatisticalSummary::keyB)) {
                failuresB++;
            }
            OptionalDouble difference = result.scoreDifference();
            if (difference.isPresent()) {
                differences.add(difference.getAsDouble());
                sample(stats, StatisticalSummary.SCORE_DIFFERENCE, difference.getAsDouble());
            }
            result.difference().ifPresent(d -> {
                sample(stats, StatisticalSummary.DIVERGENT_PAIRS, d.divergentCount());
                sample(stats, StatisticalSummary.COLOR_DIVERGENT_PAIRS, d.colorDivergent().size());
            });
            switch (result.winner()) {
                case ENGINE_A -> winsA++;
                case ENGINE_B -> winsB++;
                case TIE -> ties++;
                case NONE -> undecided++;
            }
            rounds.merge(result.roundNumber(), OutcomeTally.EMPTY.add(result), (old, ignored) -> old.add(result));
            sizes.merge(TournamentSize.of(result.playerCount()), OutcomeTally.EMPTY.add(result),
                (old, ignored) -> old.add(result));
        }

        ImmutableMap.Builder<String, MetricSummary> metrics = ImmutableMap.builder();
        stats.forEach((key, s) -> metrics.put(key, s.summary()));

        ComparisonResult first = results.get(0);
        StatisticalSummary summary = new StatisticalSummary(
            first.runA().engineName(), first.runB().engineName(), results.size(), metrics.buildOrThrow(),
            winsA, winsB, ties, undecided, failuresA, failuresB,
            differences.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(Quantiles.median().compute(differences)),
            significance(results.size(), winsA, minSignificanceSamples),
            confidenceLevel(results.size(), winsA, winsB, minSignificanceSamples),
            ImmutableSortedMap.copyOf(rounds),
            ImmutableSortedMap.copyOf(sizes),
            ImmutableMap.copyOf(violationsA), ImmutableMap.copyOf(violationsB));
        log.info("Summarized {} comparisons: {} wins {}, {} wins {}, {} ties",
            results.size(), summary.engineA(), winsA, summary.engineB(), winsB, ties);
        return summary;
    }

    /**
     * How far engine A's win rate is from 50%, doubled and scaled by the sample size
     * relative to {@code minSamples}, capped at 1.
     */
    static double significance(long comparisons, long winsA, int minSamples) {
        if (comparisons < minSamples) {
            return 0.0;
        }
        double deviation = Math.abs((double) winsA / comparisons - 0.5);
        return Math.min(1.0, deviation * 2 * comparisons / minSamples);
    }

    /**
     * Confidence in the engine with more wins: 0.5 plus its win-rate margin over 50%,
     * reaching full weight at three times {@code minSamples}; kept within [0.5, 0.99].
     */
    static double confidenceLevel(long comparisons, long winsA, long winsB, int minSamples) {
        if (comparisons < minSamples) {
            return 0.5;
        }
        double winShare = (double) Math.max(winsA, winsB) / comparisons;
        double sampleFactor = Math.min(1.0, comparisons / (minSamples * 3.0));
        return Math.min(0.99, Math.max(0.5, 0.5 + (winShare - 0.5) * sampleFactor));
    }

    /**
     * Adds a run's metrics; failed runs contribute nothing but the failure count.
     *
     * @return true if the run failed
     */
    private static boolean accumulate(EngineRun run, Map<String, RunningStatistics> stats,
                                      Map<PairingViolation, Long> violations,
                                      UnaryOperator<String> key) {
        if (!run.succeeded()) {
            return true;
        }
        EngineMetrics m = run.metrics().get();
        sample(stats, key.apply(StatisticalSummary.FIDE), m.fideScore());
        sample(stats, key.apply(StatisticalSummary.QUALITY), m.qualityScore());
        sample(stats, key.apply(StatisticalSummary.OVERALL), m.overallScore());
        sample(stats, key.apply(StatisticalSummary.ELAPSED), run.elapsedMillis());
        m.violations().forEach((rule, count) -> violations.merge(rule, (long) count, Long::sum));
        return false;
    }

    private static void sample(Map<String, RunningStatistics> stats, String key, double value) {
        stats.computeIfAbsent(key, k -> new RunningStatistics()).add(value);
    }
}
