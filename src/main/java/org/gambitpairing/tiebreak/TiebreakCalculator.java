package org.gambitpairing.tiebreak;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.gambitpairing.model.Color;
import org.gambitpairing.model.Player;
import org.gambitpairing.model.RegistrySnapshot;
import org.gambitpairing.model.RoundRecord;
import org.gambitpairing.model.Scores;
import org.gambitpairing.model.TournamentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Computes tiebreak values and the final standings from a registry snapshot.
 *
 * <p>Opponent-based tiebreaks (Buchholz and its variants, Sonneborn-Berger) count a bye
 * round according to the configured {@link ByeOpponentPolicy}.
 */
public final class TiebreakCalculator {

    private static final Logger log = LoggerFactory.getLogger(TiebreakCalculator.class);

    private TiebreakCalculator() {}

    /**
     * Tiebreak values per player id, in the order of {@link TournamentConfig#tiebreaks()}.
     * Map iteration follows registration order.
     */
    public static ImmutableMap<String, ImmutableList<Double>> compute(RegistrySnapshot snapshot,
                                                                     TournamentConfig config) {
        ImmutableMap.Builder<String, ImmutableList<Double>> values = ImmutableMap.builder();
        for (Player player : snapshot.playerList()) {
            ImmutableList.Builder<Double> row = ImmutableList.builder();
            for (Tiebreak tiebreak : config.tiebreaks()) {
                row.add(value(tiebreak, player, snapshot, config.byeOpponentPolicy()));
            }
            values.put(player.id(), row.build());
        }
        return values.buildOrThrow();
    }

    /**
     * Final ranking: score, then each configured tiebreak, then rating (unrated last),
     * then id. No two players ever compare equal.
     */
    public static ImmutableList<StandingsEntry> rank(RegistrySnapshot snapshot, TournamentConfig config) {
        Map<String, ImmutableList<Double>> tiebreaks = compute(snapshot, config);
        List<Player> players = new ArrayList<>(snapshot.playerList());
        players.sort(standingsOrder(tiebreaks));

        ImmutableList.Builder<StandingsEntry> standings = ImmutableList.builder();
        for (int i = 0; i < players.size(); i++) {
            Player p = players.get(i);
            standings.add(new StandingsEntry(i + 1, p.id(), p.score(), tiebreaks.get(p.id())));
        }
        log.debug("Ranked {} players after {} rounds", players.size(), snapshot.roundsCompleted());
        return standings.build();
    }

    /**
     * Points {@code playerId} scored against {@code opponentId} over all their games,
     * or empty if they never met.
     */
    public static OptionalDouble headToHead(RegistrySnapshot snapshot, String playerId, String opponentId) {
        Player player = snapshot.require(playerId);
        snapshot.require(opponentId);
        double points = 0.0;
        boolean met = false;
        for (RoundRecord r : player.history()) {
            if (r.opponentId().filter(opponentId::equals).isPresent()) {
                points += r.points();
                met = true;
            }
        }
        return met ? OptionalDouble.of(points) : OptionalDouble.empty();
    }

    static Comparator<Player> standingsOrder(Map<String, ImmutableList<Double>> tiebreaks) {
        Comparator<Player> byScore = Comparator.comparingDouble(Player::score).reversed();
        Comparator<Player> byTiebreaks = (a, b) -> {
            List<Double> ta = tiebreaks.get(a.id());
            List<Double> tb = tiebreaks.get(b.id());
            for (int i = 0; i < ta.size(); i++) {
                int cmp = Double.compare(tb.get(i), ta.get(i));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
        Comparator<Player> byRating = Comparator.comparingInt(
            (Player p) -> p.rating().orElse(Integer.MIN_VALUE)).reversed();
        return byScore.thenComparing(byTiebreaks).thenComparing(byRating).thenComparing(Player::id);
    }

    static double value(Tiebreak tiebreak, Player player, RegistrySnapshot snapshot, ByeOpponentPolicy policy) {
        return switch (tiebreak) {
            case BUCHHOLZ -> sum(opponentScores(player, snapshot, policy));
            case BUCHHOLZ_CUT_1 -> {
                List<Double> scores = opponentScores(player, snapshot, policy);
                yield scores.isEmpty() ? 0.0 : sum(scores) - Collections.min(scores);
            }
            case MEDIAN_BUCHHOLZ -> median(player, opponentScores(player, snapshot, policy));
            case SONNEBORN_BERGER -> sonnebornBerger(player, snapshot, policy);
            case PROGRESSIVE -> progressive(player);
            case CUMULATIVE_OPPONENTS -> cumulativeOpponents(player, snapshot);
            case BLACK_GAMES -> player.colorCount(Color.BLACK);
            case WINS -> countWins(player, false);
            case BLACK_WINS -> countWins(player, true);
            case AVERAGE_RATING_OF_OPPONENTS -> averageOpponentRating(player, snapshot);
        };
    }

    /**
     * Score to credit for the opponent of round {@code roundIndex} (0-based), bye placeholder
     * included; NaN when the round does not count.
     */
    private static double opponentScore(Player player, int roundIndex, RegistrySnapshot snapshot,
                                        ByeOpponentPolicy policy) {
        RoundRecord record = player.history().get(roundIndex);
        if (!record.isBye()) {
            return snapshot.scoreOf(record.opponentId().get());
        }
        return switch (policy) {
            case VIRTUAL_OPPONENT -> player.scoreAfter(roundIndex)
                + Scores.DRAW * Math.max(snapshot.roundsCompleted() - (roundIndex + 1), 0);
            case OWN_SCORE -> player.score();
            case EXCLUDE -> Double.NaN;
        };
    }

    private static List<Double> opponentScores(Player player, RegistrySnapshot snapshot, ByeOpponentPolicy policy) {
        List<Double> scores = new ArrayList<>();
        for (int i = 0; i < player.roundsPlayed(); i++) {
            double score = opponentScore(player, i, snapshot, policy);
            if (!Double.isNaN(score)) {
                scores.add(score);
            }
        }
        return scores;
    }

    /**
     * USCF modified median. The plus/minus/even split is judged on games actually
     * played, so a bye does not push a player over 50%.
     */
    private static double median(Player player, List<Double> scores) {
        if (scores.isEmpty()) {
            return 0.0;
        }
        if (scores.size() == 1) {
            return scores.get(0);
        }
        double gamePoints = 0.0;
        int games = 0;
        for (RoundRecord r : player.history()) {
            if (!r.isBye()) {
                gamePoints += r.points();
                games++;
            }
        }
        if (games == 0) {
            return sum(scores);
        }
        List<Double> sorted = new ArrayList<>(scores);
        Collections.sort(sorted);
        double percentage = gamePoints / games;
        if (percentage > 0.5) {
            return sum(sorted.subList(1, sorted.size()));
        }
        if (percentage < 0.5) {
            return sum(sorted.subList(0, sorted.size() - 1));
        }
        return sorted.size() >= 3 ? sum(sorted.subList(1, sorted.size() - 1)) : 0.0;
    }

    private static double sonnebornBerger(Player player, RegistrySnapshot snapshot, ByeOpponentPolicy policy) {
        double total = 0.0;
        for (int i = 0; i < player.roundsPlayed(); i++) {
            double opponent = opponentScore(player, i, snapshot, policy);
            if (!Double.isNaN(opponent)) {
                total += player.history().get(i).points() * opponent;
            }
        }
        return total;
    }

    private static double progressive(Player player) {
        double running = 0.0;
        double total = 0.0;
        for (RoundRecord r : player.history()) {
            running += r.points();
            total += running;
        }
        return total;
    }

    private static double cumulativeOpponents(Player player, RegistrySnapshot snapshot) {
        double total = 0.0;
        for (int i = 0; i < player.roundsPlayed(); i++) {
            RoundRecord r = player.history().get(i);
            if (!r.isBye()) {
                total += snapshot.require(r.opponentId().get()).scoreAfter(i);
            }
        }
        return total;
    }

    private static double countWins(Player player, boolean blackOnly) {
        int wins = 0;
        for (RoundRecord r : player.history()) {
            boolean counted = blackOnly ? r.color().filter(c -> c == Color.BLACK).isPresent() : !r.isBye();
            if (counted && r.points() == Scores.WIN) {
                wins++;
            }
        }
        return wins;
    }

    private static double averageOpponentRating(Player player, RegistrySnapshot snapshot) {
        long total = 0;
        int rated = 0;
        for (String id : player.opponentIds()) {
            Player opponent = snapshot.require(id);
            if (opponent.rating().isPresent()) {
                total += opponent.rating().getAsInt();
                rated++;
            }
        }
        return rated == 0 ? 0.0 : (double) total / rated;
    }

    private static double sum(List<Double> values) {
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total;
    }
}
