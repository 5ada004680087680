package org.gambitpairing.runner;

import com.google.common.collect.ImmutableList;
import org.gambitpairing.comparison.ComparisonResult;
import org.gambitpairing.comparison.EngineRun;
import org.gambitpairing.comparison.PairingComparisonEngine;
import org.gambitpairing.model.PairingResult;
import org.gambitpairing.model.PlayerRegistry;
import org.gambitpairing.model.TournamentConfig;
import org.gambitpairing.model.TournamentState;
import org.gambitpairing.pairing.PairingEngine;
import org.gambitpairing.results.ResultRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Plays simulated tournaments, comparing both engines on every round.
 *
 * <p>Each round is paired by both engines from the same state; the tournament then
 * continues with engine A's pairing, or engine B's when A failed. It stops early when
 * neither engine can pair. Tournaments share nothing but read-only settings, so they
 * can run in parallel.
 */
public class TournamentSimulator {

    private static final Logger log = LoggerFactory.getLogger(TournamentSimulator.class);

    private final SimulationConfig config;
    private final PairingComparisonEngine comparisonEngine;
    private final PairingEngine engineA;
    private final PairingEngine engineB;

    public TournamentSimulator(SimulationConfig config, PairingComparisonEngine comparisonEngine,
                               PairingEngine engineA, PairingEngine engineB) {
        this.config = config;
        this.comparisonEngine = comparisonEngine;
        this.engineA = engineA;
        this.engineB = engineB;
    }

    /**
     * Simulates tournament {@code index} (0-based). Deterministic for a given config and index.
     */
    public List<ComparisonResult> runTournament(int index) {
        String tournamentId = String.format("sim-%03d", index + 1);
        Random random = new Random(config.seed() + index);
        PlayerFactory playerFactory = new PlayerFactory(config.minRating(), config.maxRating(), random);
        ResultSimulator resultSimulator = new ResultSimulator(config.drawRate(), random);
        ResultRecorder recorder = new ResultRecorder();

        PlayerRegistry registry = new PlayerRegistry(playerFactory.createPlayers(config.players()));
        TournamentConfig tournamentConfig = TournamentConfig.defaults(tournamentId, config.rounds());

        List<ComparisonResult> results = new ArrayList<>();
        for (int round = 1; round <= config.rounds(); round++) {
            TournamentState state = TournamentState.nextRound(tournamentId, registry, tournamentConfig);
            ComparisonResult comparison = comparisonEngine.compare(state, engineA, engineB);
            results.add(comparison);

            Optional<PairingResult> next = chosenPairing(comparison);
            if (next.isEmpty()) {
                log.warn("{}: neither engine could pair round {}, stopping", tournamentId, round);
                break;
            }
            recorder.applyResults(registry, next.get(),
                resultSimulator.simulateRound(next.get(), state.snapshot()));
        }
        log.info("{} finished after {} rounds", tournamentId, registry.roundsCompleted());
        return results;
    }

    /**
     * Runs every tournament on {@code pool} and returns all comparisons in tournament order.
     */
    public ImmutableList<ComparisonResult> runAll(ExecutorService pool) throws InterruptedException, ExecutionException {
        List<Future<List<ComparisonResult>>> futures = new ArrayList<>();
        for (int i = 0; i < config.tournaments(); i++) {
            final int index = i;
            futures.add(pool.submit(() -> runTournament(index)));
        }
        ImmutableList.Builder<ComparisonResult> all = ImmutableList.builder();
        for (Future<List<ComparisonResult>> future : futures) {
            all.addAll(future.get());
        }
        return all.build();
    }

    static Optional<PairingResult> chosenPairing(ComparisonResult comparison) {
        EngineRun a = comparison.runA();
        return a.succeeded() ? a.pairing() : comparison.runB().pairing();
    }
}
