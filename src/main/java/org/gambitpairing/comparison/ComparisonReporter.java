package org.gambitpairing.comparison;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.gambitpairing.json.ObjectMapperFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Formats a {@link StatisticalSummary} as plain text or as a JSON tree.
 */
public class ComparisonReporter {

    private final ObjectMapper objectMapper;
    private final ScoringWeights weights;

    public ComparisonReporter(ScoringWeights weights) {
        this.objectMapper = ObjectMapperFactory.create();
        this.weights = weights;
    }

    public ObjectNode jsonReport(StatisticalSummary summary) {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("engineA", summary.engineA());
        metadata.put("engineB", summary.engineB());
        metadata.put("comparisons", summary.comparisons());
        metadata.set("weights", objectMapper.valueToTree(weights));

        ObjectNode overall = root.putObject("overall");
        overall.put("winsA", summary.winsA());
        overall.put("winsB", summary.winsB());
        overall.put("ties", summary.ties());
        overall.put("undecided", summary.undecided());
        overall.put("winRateA", summary.winRateA());
        overall.put("winRateB", summary.winRateB());
        overall.put("tieRate", summary.tieRate());
        overall.put("failuresA", summary.failuresA());
        overall.put("failuresB", summary.failuresB());
        overall.put("significance", summary.significance());
        overall.put("confidenceLevel", summary.confidenceLevel());
        overall.put("recommendation", recommendation(summary));

        ObjectNode difference = overall.putObject("scoreDifference");
        Optional<MetricSummary> diff = summary.scoreDifference();
        difference.put("pairedRounds", diff.map(MetricSummary::count).orElse(0L));
        putOptional(difference, "mean", diff.map(m -> OptionalDouble.of(m.mean())).orElse(OptionalDouble.empty()));
        putOptional(difference, "median", summary.medianScoreDifference());
        putOptional(difference, "standardDeviation",
            diff.map(MetricSummary::standardDeviation).orElse(OptionalDouble.empty()));

        ObjectNode metrics = root.putObject("metrics");
        summary.metrics().forEach((key, m) -> metrics.set(key, metricNode(m)));

        root.set("rounds", objectMapper.valueToTree(summary.rounds()));
        root.set("sizes", objectMapper.valueToTree(summary.sizes()));
        ObjectNode violations = root.putObject("violations");
        violations.set("engineA", objectMapper.valueToTree(summary.violationsA()));
        violations.set("engineB", objectMapper.valueToTree(summary.violationsB()));
        return root;
    }

    public String textReport(StatisticalSummary summary) {
        StringBuilder out = new StringBuilder();
        out.append("Pairing engine comparison: ").append(summary.engineA())
            .append(" (A) vs ").append(summary.engineB()).append(" (B)\n");
        out.append(String.format(Locale.ROOT, "Comparisons: %d, weights fide %.2f / quality %.2f%n",
            summary.comparisons(), weights.fide(), weights.quality()));
        out.append(String.format(Locale.ROOT, "Wins A %d (%.1f%%), wins B %d (%.1f%%), ties %d (%.1f%%), undecided %d%n",
            summary.winsA(), summary.winRateA() * 100, summary.winsB(), summary.winRateB() * 100,
            summary.ties(), summary.tieRate() * 100, summary.undecided()));
        out.append(String.format(Locale.ROOT, "Failures A %d, failures B %d%n", summary.failuresA(), summary.failuresB()));
        Optional<MetricSummary> diff = summary.scoreDifference();
        if (diff.isPresent()) {
            out.append(String.format(Locale.ROOT,
                "Overall A - B over %d rounds both paired: mean %.4f, median %.4f, std dev %s%n",
                diff.get().count(), diff.get().mean(), summary.medianScoreDifference().getAsDouble(),
                format(diff.get().standardDeviation())));
        }
        out.append(String.format(Locale.ROOT, "Significance %.4f, confidence %.4f%n",
            summary.significance(), summary.confidenceLevel()));
        out.append("Recommendation: ").append(recommendation(summary)).append('\n');

        out.append('\n').append(String.format(Locale.ROOT, "%-28s %7s %9s %11s %9s %9s %11s%n",
            "metric", "n", "mean", "variance", "min", "max", "95% CI +/-"));
        for (Map.Entry<String, MetricSummary> e : summary.metrics().entrySet()) {
            MetricSummary m = e.getValue();
            out.append(String.format(Locale.ROOT, "%-28s %7d %9.4f %11s %9.4f %9.4f %11s%n",
                e.getKey(), m.count(), m.mean(), format(m.variance()), m.min(), m.max(),
                format(m.confidenceHalfWidth())));
        }

        out.append('\n').append("Per round (comparisons / divergent / A / B / ties / failed A / failed B):\n");
        summary.rounds().forEach((round, t) -> out.append(String.format(Locale.ROOT,
            "  round %2d: %d / %d / %d / %d / %d / %d / %d%n",
            round, t.comparisons(), t.divergent(), t.winsA(), t.winsB(), t.ties(), t.failuresA(), t.failuresB())));
        out.append("Per tournament size (comparisons / A / B / ties):\n");
        summary.sizes().forEach((size, t) -> out.append(String.format(Locale.ROOT,
            "  %-6s (<= %s players): %d / %d / %d / %d%n",
            size, size == TournamentSize.LARGE ? "any" : String.valueOf(size.maxPlayers()),
            t.comparisons(), t.winsA(), t.winsB(), t.ties())));

        if (!summary.violationsA().isEmpty() || !summary.violationsB().isEmpty()) {
            out.append('\n').append("Violations:\n");
            summary.violationsA().forEach((rule, n) -> out.append("  A ").append(rule).append(": ").append(n).append('\n'));
            summary.violationsB().forEach((rule, n) -> out.append("  B ").append(rule).append(": ").append(n).append('\n'));
        }
        return out.toString();
    }

    /**
     * An engine that failed to pair rounds the other one paired is never recommended.
     * With equal failure counts, the mean of overall A minus overall B over the rounds
     * both engines paired decides, within the winner threshold.
     */
    static String recommendation(StatisticalSummary summary) {
        boolean pairedA = summary.metric(StatisticalSummary.keyA(StatisticalSummary.OVERALL)).isPresent();
        boolean pairedB = summary.metric(StatisticalSummary.keyB(StatisticalSummary.OVERALL)).isPresent();
        if (!pairedA && !pairedB) {
            return "no engine produced a pairing";
        }
        if (summary.failuresA() != summary.failuresB()) {
            return summary.failuresA() < summary.failuresB() ? summary.engineA() : summary.engineB();
        }
        Optional<MetricSummary> difference = summary.scoreDifference();
        if (difference.isEmpty() || Math.abs(difference.get().mean()) < PairingComparisonEngine.TIE_THRESHOLD) {
            return "equivalent";
        }
        return difference.get().mean() > 0 ? summary.engineA() : summary.engineB();
    }

    private static void putOptional(ObjectNode node, String field, OptionalDouble value) {
        if (value.isPresent()) {
            node.put(field, value.getAsDouble());
        } else {
            node.putNull(field);
        }
    }

    private ObjectNode metricNode(MetricSummary m) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("count", m.count());
        node.put("mean", m.mean());
        node.put("min", m.min());
        node.put("max", m.max());
        if (m.variance().isPresent()) {
            node.put("variance", m.variance().getAsDouble());
            node.put("confidenceHalfWidth", m.confidenceHalfWidth().getAsDouble());
        } else {
            node.putNull("variance");
            node.putNull("confidenceHalfWidth");
        }
        return node;
    }

    private static String format(OptionalDouble value) {
        return value.isPresent() ? String.format(Locale.ROOT, "%.6f", value.getAsDouble()) : "undefined";
    }
}
