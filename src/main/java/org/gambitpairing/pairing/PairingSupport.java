package org.gambitpairing.pairing;

import com.google.common.collect.ImmutableList;
import org.gambitpairing.exception.PairingInfeasibleException;
import org.gambitpairing.model.Pairing;
import org.gambitpairing.model.PairingResult;
import org.gambitpairing.model.Player;
import org.gambitpairing.model.RegistrySnapshot;
import org.gambitpairing.model.TournamentConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ranking, bye selection and board building shared by the pairing engines.
 */
final class PairingSupport {

    private PairingSupport() {}

    static void checkRound(RegistrySnapshot snapshot, TournamentConfig config, int roundNumber) {
        if (roundNumber > config.totalRounds()) {
            throw new IllegalStateException(
                "Cannot pair round " + roundNumber + " of a " + config.totalRounds() + "-round tournament");
        }
        if (roundNumber != snapshot.roundsCompleted() + 1) {
            throw new IllegalArgumentException("Round " + roundNumber + " requested but "
                + snapshot.roundsCompleted() + " rounds are recorded");
        }
    }

    /**
     * Pairing order: score descending, then rating descending when seeding by rating,
     * then registration order.
     */
    static List<Player> rank(RegistrySnapshot snapshot, TournamentConfig config) {
        Map<String, Integer> order = registrationOrder(snapshot);
        Comparator<Player> comparator = Comparator.comparingDouble(Player::score).reversed();
        if (config.ratingSeeding()) {
            comparator = comparator.thenComparing(Comparator.comparingInt(PairingSupport::ratingOrZero).reversed());
        }
        comparator = comparator.thenComparingInt(p -> order.get(p.id()));
        List<Player> ranked = new ArrayList<>(snapshot.playerList());
        ranked.sort(comparator);
        return ranked;
    }

    /**
     * Players who may receive the bye, most deserving first: lowest score, then lowest
     * rating, then latest registration. Anyone who already had a bye is excluded.
     */
    static List<Player> byeCandidates(List<Player> ranked, RegistrySnapshot snapshot) {
        Map<String, Integer> order = registrationOrder(snapshot);
        List<Player> eligible = new ArrayList<>();
        for (Player p : ranked) {
            if (!p.hasHadBye()) {
                eligible.add(p);
            }
        }
        eligible.sort(Comparator.comparingDouble(Player::score)
            .thenComparingInt(PairingSupport::ratingOrZero)
            .thenComparing(Comparator.comparingInt((Player p) -> order.get(p.id())).reversed()));
        return eligible;
    }

    static int ratingOrZero(Player player) {
        return player.rating().orElse(0);
    }

    /**
     * Orders the pairs by their higher-ranked player and allocates colours board by board.
     */
    static PairingResult buildResult(int roundNumber, List<Player[]> pairs, List<Player> ranked,
                                     Optional<Player> bye, TournamentConfig config) {
        Map<String, Integer> rankIndex = new HashMap<>();
        for (int i = 0; i < ranked.size(); i++) {
            rankIndex.put(ranked.get(i).id(), i);
        }
        List<Player[]> ordered = new ArrayList<>();
        for (Player[] pair : pairs) {
            boolean firstHigher = rankIndex.get(pair[0].id()) < rankIndex.get(pair[1].id());
            ordered.add(firstHigher ? pair : new Player[] {pair[1], pair[0]});
        }
        ordered.sort(Comparator.comparingInt(pair -> rankIndex.get(pair[0].id())));

        ImmutableList.Builder<Pairing> boards = ImmutableList.builder();
        for (int board = 0; board < ordered.size(); board++) {
            Player[] pair = ordered.get(board);
            boards.add(ColorAllocator.allocate(pair[0], pair[1], board, config.colorPolicy()));
        }
        return PairingResult.of(roundNumber, boards.build(), bye.map(Player::id));
    }

    static PairingInfeasibleException noPlayers(int roundNumber) {
        return new PairingInfeasibleException(roundNumber, "no players registered");
    }

    private static Map<String, Integer> registrationOrder(RegistrySnapshot snapshot) {
        Map<String, Integer> order = new HashMap<>();
        int i = 0;
        for (String id : snapshot.players().keySet()) {
            order.put(id, i++);
        }
        return order;
    }
}
