package org.gambitpairing.pairing;

import org.gambitpairing.exception.PairingInfeasibleException;
import org.gambitpairing.model.PairingResult;
import org.gambitpairing.model.Player;
import org.gambitpairing.model.RegistrySnapshot;
import org.gambitpairing.model.TournamentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Baseline Monrad pairing: walk the ranking top to bottom and pair each player with the
 * next player below them they have not met. Backtracks only on rematches and ignores
 * score-group boundaries, so it serves as an independent second engine for comparisons.
 */
public class MonradPairingEngine implements PairingEngine {

    private static final Logger log = LoggerFactory.getLogger(MonradPairingEngine.class);

    private final long searchBudget;

    public MonradPairingEngine() {
        this(SwissPairingEngine.DEFAULT_SEARCH_BUDGET);
    }

    public MonradPairingEngine(long searchBudget) {
        if (searchBudget <= 0) {
            throw new IllegalArgumentException("searchBudget must be positive");
        }
        this.searchBudget = searchBudget;
    }

    @Override
    public String name() {
        return "monrad";
    }

    @Override
    public PairingResult pairRound(RegistrySnapshot snapshot, TournamentConfig config, int roundNumber) {
        PairingSupport.checkRound(snapshot, config, roundNumber);
        if (snapshot.size() == 0) {
            throw PairingSupport.noPlayers(roundNumber);
        }
        List<Player> ranked = PairingSupport.rank(snapshot, config);

        List<Player> toPair = new ArrayList<>(ranked);
        Optional<Player> bye = Optional.empty();
        if (ranked.size() % 2 == 1) {
            List<Player> candidates = PairingSupport.byeCandidates(ranked, snapshot);
            if (candidates.isEmpty()) {
                throw new PairingInfeasibleException(roundNumber,
                    "odd player count and every player has already had a bye");
            }
            // Monrad gives the bye up front and never revisits it
            bye = Optional.of(candidates.get(0));
            toPair.remove(bye.get());
        }

        long[] steps = {0};
        List<Player[]> pairs = new ArrayList<>();
        if (!pairDown(toPair, new boolean[toPair.size()], pairs, steps, roundNumber)) {
            throw new PairingInfeasibleException(roundNumber, "every Monrad order repeats an earlier game");
        }
        PairingResult result = PairingSupport.buildResult(roundNumber, pairs, ranked, bye, config);
        log.info("Round {} paired by Monrad: {} boards, bye {}",
            roundNumber, result.pairings().size(), result.byePlayerId().orElse("none"));
        return result;
    }

    private boolean pairDown(List<Player> players, boolean[] used, List<Player[]> pairs,
                             long[] steps, int roundNumber) {
        if (++steps[0] > searchBudget) {
            throw new PairingInfeasibleException(roundNumber,
                "pairing search gave up after " + searchBudget + " steps");
        }
        int top = -1;
        for (int i = 0; i < used.length; i++) {
            if (!used[i]) {
                top = i;
                break;
            }
        }
        if (top < 0) {
            return true;
        }
        Player higher = players.get(top);
        used[top] = true;
        for (int i = top + 1; i < used.length; i++) {
            Player lower = players.get(i);
            if (used[i] || higher.hasPlayed(lower.id())) {
                continue;
            }
            used[i] = true;
            pairs.add(new Player[] {higher, lower});
            if (pairDown(players, used, pairs, steps, roundNumber)) {
                return true;
            }
            pairs.remove(pairs.size() - 1);
            used[i] = false;
        }
        used[top] = false;
        return false;
    }
}
