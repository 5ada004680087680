package org.gambitpairing.comparison;

import org.gambitpairing.exception.TournamentException;
import org.gambitpairing.model.PairingResult;
import org.gambitpairing.model.RegistrySnapshot;
import org.gambitpairing.model.TournamentState;
import org.gambitpairing.pairing.PairingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs two pairing engines on the same tournament state and reports how their
 * pairings differ.
 *
 * <p>Both engines receive the same {@link RegistrySnapshot}. Snapshots are immutable, so
 * neither engine can influence the other, and running them in parallel gives the same
 * result as running them one after the other.
 */
public class PairingComparisonEngine {

    private static final Logger log = LoggerFactory.getLogger(PairingComparisonEngine.class);

    /** Overall scores closer than this count as a tie. */
    public static final double TIE_THRESHOLD = 0.01;

    private final ScoringWeights weights;
    private final Optional<ExecutorService> executor;

    public PairingComparisonEngine() {
        this(ScoringWeights.DEFAULT);
    }

    public PairingComparisonEngine(ScoringWeights weights) {
        this.weights = weights;
        this.executor = Optional.empty();
    }

    /**
     * @param executor runs engine A while the calling thread runs engine B; owned by the caller
     */
    public PairingComparisonEngine(ScoringWeights weights, ExecutorService executor) {
        this.weights = weights;
        this.executor = Optional.of(executor);
    }

    public ComparisonResult compare(TournamentState state, PairingEngine engineA, PairingEngine engineB) {
        EngineRun runA;
        EngineRun runB;
        if (executor.isPresent()) {
            CompletableFuture<EngineRun> futureA =
                CompletableFuture.supplyAsync(() -> run(engineA, state), executor.get());
            runB = run(engineB, state);
            runA = join(futureA);
        } else {
            runA = run(engineA, state);
            runB = run(engineB, state);
        }

        Optional<PairingDifference> difference = Optional.empty();
        if (runA.succeeded() && runB.succeeded()) {
            difference = Optional.of(PairingDifference.between(runA.pairing().get(), runB.pairing().get()));
        }
        Winner winner = decideWinner(runA, runB);
        log.info("{} round {}: {} vs {} -> {} ({} divergent pairs)",
            state.tournamentId(), state.roundNumber(), engineA.name(), engineB.name(), winner,
            difference.map(d -> String.valueOf(d.divergentCount())).orElse("n/a"));
        return new ComparisonResult(state.tournamentId(), state.roundNumber(), state.snapshot().size(),
            runA, runB, difference, winner);
    }

    /**
     * The engine with the higher overall score wins; an engine that produced a pairing
     * beats one that failed.
     */
    static Winner decideWinner(EngineRun runA, EngineRun runB) {
        if (!runA.succeeded() && !runB.succeeded()) {
            return Winner.NONE;
        }
        if (!runB.succeeded()) {
            return Winner.ENGINE_A;
        }
        if (!runA.succeeded()) {
            return Winner.ENGINE_B;
        }
        double a = runA.metrics().get().overallScore();
        double b = runB.metrics().get().overallScore();
        if (Math.abs(a - b) < TIE_THRESHOLD) {
            return Winner.TIE;
        }
        return a > b ? Winner.ENGINE_A : Winner.ENGINE_B;
    }

    private EngineRun run(PairingEngine engine, TournamentState state) {
        long start = System.nanoTime();
        try {
            PairingResult pairing = engine.pairRound(state.snapshot(), state.config(), state.roundNumber());
            double elapsed = elapsedMillis(start);
            EngineMetrics metrics = PairingMetrics.evaluate(pairing, state.snapshot(), state.config(), weights);
            log.debug("{} paired round {} in {} ms", engine.name(), state.roundNumber(), elapsed);
            return EngineRun.success(engine.name(), pairing, metrics, elapsed);
        } catch (TournamentException e) {
            log.warn("{} failed on {} round {}: {}",
                engine.name(), state.tournamentId(), state.roundNumber(), e.getMessage());
            return EngineRun.failed(engine.name(), e.getMessage(), elapsedMillis(start));
        }
    }

    private static EngineRun join(CompletableFuture<EngineRun> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
