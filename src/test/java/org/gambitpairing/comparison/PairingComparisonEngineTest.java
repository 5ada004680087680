package org.gambitpairing.comparison;

import com.google.common.collect.ImmutableMap;
import org.gambitpairing.Fixtures;
import org.gambitpairing.exception.PairingInfeasibleException;
import org.gambitpairing.model.PairingResult;
import org.gambitpairing.model.RegistrySnapshot;
import org.gambitpairing.model.TournamentConfig;
import org.gambitpairing.model.TournamentState;
import org.gambitpairing.pairing.MonradPairingEngine;
import org.gambitpairing.pairing.PairingEngine;
import org.gambitpairing.pairing.SwissPairingEngine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PairingComparisonEngineTest {

    private static final TournamentConfig CONFIG = TournamentConfig.defaults("t", 5);

    private static TournamentState firstRound(int players) {
        return TournamentState.nextRound("t-1", Fixtures.registry(players), CONFIG);
    }

    @Test
    void sameEngineOnBothSides_isIdenticalAndTied() {
        ComparisonResult result = new PairingComparisonEngine()
            .compare(firstRound(8), new SwissPairingEngine(), new SwissPairingEngine());

        assertTrue(result.difference().isPresent());
        assertTrue(result.difference().get().isIdentical());
        assertEquals(0, result.difference().get().divergentCount());
        assertEquals(Winner.TIE, result.winner());
        assertEquals("t-1", result.tournamentId());
        assertEquals(1, result.roundNumber());
    }

    @Test
    void differentEngines_reportDivergentPairs() {
        ComparisonResult result = new PairingComparisonEngine()
            .compare(firstRound(8), new SwissPairingEngine(), new MonradPairingEngine());

        PairingDifference difference = result.difference().get();
        assertEquals("swiss", result.runA().engineName());
        assertEquals("monrad", result.runB().engineName());
        assertTrue(difference.common().isEmpty(), "Swiss folds the field, Monrad pairs neighbours");
        assertEquals(8, difference.divergentCount());
        assertFalse(difference.byeDivergent());
    }

    @Test
    void failingEngine_losesToEngineThatPaired() {
        PairingEngine failing = mock(PairingEngine.class);
        when(failing.name()).thenReturn("broken");
        when(failing.pairRound(any(RegistrySnapshot.class), any(TournamentConfig.class), anyInt()))
            .thenThrow(new PairingInfeasibleException(1, "no pairing"));

        ComparisonResult result = new PairingComparisonEngine()
            .compare(firstRound(6), new SwissPairingEngine(), failing);

        assertTrue(result.runA().succeeded());
        assertFalse(result.runB().succeeded());
        assertEquals(Optional.of("Round 1: no pairing"), result.runB().failure());
        assertEquals(Optional.empty(), result.difference());
        assertEquals(Winner.ENGINE_A, result.winner());
    }

    @Test
    void parallelComparison_matchesSequentialComparison() {
        TournamentState state = firstRound(10);
        ComparisonResult sequential = new PairingComparisonEngine()
            .compare(state, new SwissPairingEngine(), new MonradPairingEngine());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        ComparisonResult parallel;
        try {
            parallel = new PairingComparisonEngine(ScoringWeights.DEFAULT, pool)
                .compare(state, new SwissPairingEngine(), new MonradPairingEngine());
        } finally {
            pool.shutdown();
        }

        assertEquals(sequential.difference(), parallel.difference());
        assertEquals(sequential.runA().pairing(), parallel.runA().pairing());
        assertEquals(sequential.runB().metrics(), parallel.runB().metrics());
        assertEquals(sequential.winner(), parallel.winner());
    }

    @Test
    void decideWinner_treatsCloseScoresAsTie() {
        assertEquals(Winner.TIE, PairingComparisonEngine.decideWinner(run("a", 0.900), run("b", 0.895)));
        assertEquals(Winner.ENGINE_A, PairingComparisonEngine.decideWinner(run("a", 0.90), run("b", 0.80)));
        assertEquals(Winner.ENGINE_B, PairingComparisonEngine.decideWinner(run("a", 0.70), run("b", 0.80)));
        assertEquals(Winner.ENGINE_B,
            PairingComparisonEngine.decideWinner(EngineRun.failed("a", "x", 1.0), run("b", 0.1)));
        assertEquals(Winner.NONE, PairingComparisonEngine.decideWinner(
            EngineRun.failed("a", "x", 1.0), EngineRun.failed("b", "y", 1.0)));
    }

    static EngineRun run(String engine, double overall) {
        EngineMetrics metrics = new EngineMetrics(overall, overall, overall, ImmutableMap.of());
        return EngineRun.success(engine, PairingResult.of(1, List.of(), Optional.empty()), metrics, 1.0);
    }
}
