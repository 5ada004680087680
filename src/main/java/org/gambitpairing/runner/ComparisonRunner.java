package org.gambitpairing.runner;

import org.gambitpairing.comparison.ComparisonReporter;
import org.gambitpairing.comparison.ComparisonResult;
import org.gambitpairing.comparison.PairingComparisonEngine;
import org.gambitpairing.comparison.ScoringWeights;
import org.gambitpairing.comparison.StatisticalAnalyzer;
import org.gambitpairing.comparison.StatisticalSummary;
import org.gambitpairing.pairing.MonradPairingEngine;
import org.gambitpairing.pairing.PairingEngine;
import org.gambitpairing.pairing.SwissPairingEngine;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Command-line entry point: simulates tournaments, compares two pairing engines on
 * every round and prints the statistical report.
 *
 * <p>Invocation:
 * <pre>
 * java -jar gambit-pairing-engine.jar \
 *   --tournaments 50 --players 24 --rounds 7 --seed 2025 \
 *   --engine-a swiss --engine-b monrad \
 *   --output ./reports
 * </pre>
 */
public class ComparisonRunner {

    public static void main(String[] args) {
        if (args.length == 1 && ("--help".equals(args[0]) || "-h".equals(args[0]))) {
            printUsage();
            System.exit(0);
        }

        SimulationConfig config;
        ScoringWeights weights;
        try {
            config = parseArgs(args);
            weights = parseWeights(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(1);
            return;
        }

        try {
            run(config, weights, parseOutputDir(args));
        } catch (Exception e) {
            System.err.println("Comparison failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    static StatisticalSummary run(SimulationConfig config, ScoringWeights weights, Optional<Path> outputDir)
            throws Exception {
        System.out.printf("Simulating %d tournaments (%d players, %d rounds): %s vs %s%n",
            config.tournaments(), config.players(), config.rounds(), config.engineA(), config.engineB());

        TournamentSimulator simulator = new TournamentSimulator(config, new PairingComparisonEngine(weights),
            engineByName(config.engineA()), engineByName(config.engineB()));
        ExecutorService threadPool = Executors.newFixedThreadPool(config.threads());
        List<ComparisonResult> results;
        try {
            results = simulator.runAll(threadPool);
        } finally {
            threadPool.shutdown();
        }

        StatisticalSummary summary = StatisticalAnalyzer.summarize(results);
        ComparisonReporter reporter = new ComparisonReporter(weights);
        String text = reporter.textReport(summary);
        System.out.println(text);

        if (outputDir.isPresent()) {
            ReportWriter writer = new ReportWriter(outputDir.get());
            writer.writeText(text);
            Path json = writer.writeJson(reporter.jsonReport(summary));
            System.out.printf("Report written to %s%n", json);
        }
        return summary;
    }

    static PairingEngine engineByName(String name) {
        return switch (name.toLowerCase()) {
            case "swiss" -> new SwissPairingEngine();
            case "monrad" -> new MonradPairingEngine();
            default -> throw new IllegalArgumentException("Unknown engine: " + name + " (expected swiss or monrad)");
        };
    }

    /**
     * Parses CLI arguments into a SimulationConfig, starting from the defaults.
     *
     * @throws IllegalArgumentException on an unknown flag or a bad value
     */
    static SimulationConfig parseArgs(String[] args) {
        SimulationConfig defaults = SimulationConfig.defaults();
        int tournaments = defaults.tournaments();
        int players = defaults.players();
        int rounds = defaults.rounds();
        long seed = defaults.seed();
        double drawRate = defaults.drawRate();
        int threads = defaults.threads();
        int minRating = defaults.minRating();
        int maxRating = defaults.maxRating();
        String engineA = defaults.engineA();
        String engineB = defaults.engineB();

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "--tournaments" -> tournaments = Integer.parseInt(value(args, ++i, flag));
                case "--players" -> players = Integer.parseInt(value(args, ++i, flag));
                case "--rounds" -> rounds = Integer.parseInt(value(args, ++i, flag));
                case "--seed" -> seed = Long.parseLong(value(args, ++i, flag));
                case "--draw-rate" -> drawRate = Double.parseDouble(value(args, ++i, flag));
                case "--threads" -> threads = Integer.parseInt(value(args, ++i, flag));
                case "--min-rating" -> minRating = Integer.parseInt(value(args, ++i, flag));
                case "--max-rating" -> maxRating = Integer.parseInt(value(args, ++i, flag));
                case "--engine-a" -> engineA = value(args, ++i, flag);
                case "--engine-b" -> engineB = value(args, ++i, flag);
                case "--output", "--fide-weight", "--quality-weight" -> value(args, ++i, flag); // parsed separately
                default -> throw new IllegalArgumentException("Unknown argument: " + flag);
            }
        }
        engineByName(engineA);
        engineByName(engineB);
        return new SimulationConfig(tournaments, players, rounds, seed, drawRate, threads,
            minRating, maxRating, engineA, engineB);
    }

    static ScoringWeights parseWeights(String[] args) {
        double fide = ScoringWeights.DEFAULT.fide();
        double quality = ScoringWeights.DEFAULT.quality();
        for (int i = 0; i < args.length - 1; i++) {
            if ("--fide-weight".equals(args[i])) {
                fide = Double.parseDouble(args[i + 1]);
            } else if ("--quality-weight".equals(args[i])) {
                quality = Double.parseDouble(args[i + 1]);
            }
        }
        return new ScoringWeights(fide, quality);
    }

    static Optional<Path> parseOutputDir(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--output".equals(args[i])) {
                return Optional.of(Path.of(args[i + 1]));
            }
        }
        return Optional.empty();
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar gambit-pairing-engine.jar [options]");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --tournaments <n>       Tournaments to simulate (default: 10)");
        System.err.println("  --players <n>           Players per tournament (default: 16)");
        System.err.println("  --rounds <n>            Rounds per tournament (default: 5)");
        System.err.println("  --seed <n>              Base random seed (default: 42)");
        System.err.println("  --draw-rate <p>         Maximum draw probability, 0..1 (default: 0.3)");
        System.err.println("  --threads <n>           Tournaments run in parallel (default: CPUs, max 8)");
        System.err.println("  --min-rating <n>        Lowest generated rating (default: 1000)");
        System.err.println("  --max-rating <n>        Highest generated rating (default: 2400)");
        System.err.println("  --engine-a <name>       First engine: swiss or monrad (default: swiss)");
        System.err.println("  --engine-b <name>       Second engine: swiss or monrad (default: monrad)");
        System.err.println("  --fide-weight <w>       Weight of rules compliance (default: 0.7)");
        System.err.println("  --quality-weight <w>    Weight of pairing quality (default: 0.3)");
        System.err.println("  --output <dir>          Also write comparison-report.json and .txt to <dir>");
        System.err.println();
        System.err.println("Example:");
        System.err.println("  java -jar gambit-pairing-engine.jar --tournaments 50 --players 24 --rounds 7 --output ./reports");
    }
}
