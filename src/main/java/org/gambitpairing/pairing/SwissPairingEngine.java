package org.gambitpairing.pairing;

import org.gambitpairing.exception.PairingInfeasibleException;
import org.gambitpairing.model.PairingResult;
import org.gambitpairing.model.Player;
import org.gambitpairing.model.RegistrySnapshot;
import org.gambitpairing.model.TournamentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Round manager for Swiss tournaments, paired score group by score group.
 *
 * <p>Key rules, in priority order:
 * <ul>
 *   <li>No player meets the same opponent twice (hard).</li>
 *   <li>Nobody is denied an absolute colour preference unless every alternative
 *       pairing of the bracket would break a harder rule.</li>
 *   <li>At most one bye, never to a player who already had one, given to the
 *       lowest-scoring, lowest-rated eligible player that still leaves the rest pairable.</li>
 *   <li>A score group is paired internally before it takes in players floated down
 *       from above; such floaters move on to the next group unless they are needed to
 *       complete it. Residents float from the bottom of the group first, and every
 *       alternative float is tried before the round is declared infeasible.</li>
 * </ul>
 *
 * <p>Inside a bracket the top half meets the bottom half (1 vs n/2+1, 2 vs n/2+2, ...).
 * Collisions are resolved by trying the bottom half's players in order for each top-half
 * player, then exchanges with the top half.
 */
public class SwissPairingEngine implements PairingEngine {

    private static final Logger log = LoggerFactory.getLogger(SwissPairingEngine.class);

    /** Upper bound on search steps before a round is given up as infeasible. */
    public static final long DEFAULT_SEARCH_BUDGET = 2_000_000L;

    private final long searchBudget;

    public SwissPairingEngine() {
        this(DEFAULT_SEARCH_BUDGET);
    }

    public SwissPairingEngine(long searchBudget) {
        if (searchBudget <= 0) {
            throw new IllegalArgumentException("searchBudget must be positive");
        }
        this.searchBudget = searchBudget;
    }

    @Override
    public String name() {
        return "swiss";
    }

    @Override
    public PairingResult pairRound(RegistrySnapshot snapshot, TournamentConfig config, int roundNumber) {
        PairingSupport.checkRound(snapshot, config, roundNumber);
        if (snapshot.size() == 0) {
            throw PairingSupport.noPlayers(roundNumber);
        }
        List<Player> ranked = PairingSupport.rank(snapshot, config);
        Search search = new Search(roundNumber);

        Optional<Player> bye = Optional.empty();
        List<Player[]> pairs;
        if (ranked.size() % 2 == 0) {
            pairs = search.pairAll(ranked);
            if (pairs == null) {
                throw new PairingInfeasibleException(roundNumber,
                    "every pairing of the score groups repeats an earlier game");
            }
        } else {
            pairs = null;
            List<Player> candidates = PairingSupport.byeCandidates(ranked, snapshot);
            if (candidates.isEmpty()) {
                throw new PairingInfeasibleException(roundNumber,
                    "odd player count and every player has already had a bye");
            }
            for (Player candidate : candidates) {
                List<Player> rest = new ArrayList<>(ranked);
                rest.remove(candidate);
                pairs = search.pairAll(rest);
                if (pairs != null) {
                    bye = Optional.of(candidate);
                    break;
                }
                log.debug("Round {}: bye to {} leaves the rest unpairable", roundNumber, candidate.id());
            }
            if (pairs == null) {
                throw new PairingInfeasibleException(roundNumber,
                    "no eligible bye leaves the remaining players pairable");
            }
        }

        PairingResult result = PairingSupport.buildResult(roundNumber, pairs, ranked, bye, config);
        log.info("Round {} paired: {} boards, bye {} ({} search steps)",
            roundNumber, result.pairings().size(), result.byePlayerId().orElse("none"), search.steps);
        return result;
    }

    private enum ColorMode {
        /** Absolute colour conflicts are forbidden. */
        STRICT,
        /** Only matchings with at least one absolute colour conflict (the rest were seen in STRICT). */
        RELAXED
    }

    /**
     * Backtracking search over one round. Pairs are accumulated in {@link #pairs}; a
     * successful path returns straight up the call chain and leaves them in place.
     */
    private final class Search {

        private final int roundNumber;
        private final List<Player[]> pairs = new ArrayList<>();
        private List<List<Player>> groups;
        private long steps;

        Search(int roundNumber) {
            this.roundNumber = roundNumber;
        }

        /**
         * @return the pairs, or null if the players cannot all be paired
         */
        List<Player[]> pairAll(List<Player> ranked) {
            groups = scoreGroups(ranked);
            pairs.clear();
            return pairBracket(0, List.of()) ? new ArrayList<>(pairs) : null;
        }

        /**
         * Pairs score group {@code groupIndex} together with the players floated into it.
         *
         * <p>Options are tried by the number of players sent on to the next group, fewest
         * first. Among options with the same count, the group's own players are paired
         * among themselves before an incoming floater is absorbed; absorbing one then
         * pushes out residents from the bottom of the group.
         */
        private boolean pairBracket(int groupIndex, List<Player> incoming) {
            if (groupIndex == groups.size()) {
                return incoming.isEmpty();
            }
            List<Player> residents = groups.get(groupIndex);
            boolean lastGroup = groupIndex == groups.size() - 1;
            int maxOut = lastGroup ? 0 : incoming.size() + residents.size();

            for (int out = 0; out <= maxOut; out++) {
                for (int absorbed = 0; absorbed <= incoming.size(); absorbed++) {
                    int residentFloats = out - (incoming.size() - absorbed);
                    if (residentFloats < 0 || residentFloats > residents.size()) {
                        continue;
                    }
                    if ((absorbed + residents.size() - residentFloats) % 2 != 0) {
                        continue;
                    }
                    if (tryBracket(groupIndex, incoming, residents, absorbed, residentFloats)) {
                        return true;
                    }
                }
            }
            return false;
        }

        /**
         * Tries every choice of absorbed floaters (highest-ranked first) and of residents
         * to float down (lowest-ranked first) for the given counts.
         */
        private boolean tryBracket(int groupIndex, List<Player> incoming, List<Player> residents,
                                   int absorbed, int residentFloats) {
            List<Player> bottomUp = new ArrayList<>(residents);
            Collections.reverse(bottomUp);
            List<Player> absorbedPlayers = new ArrayList<>();
            List<Player> floatedResidents = new ArrayList<>();
            return choose(incoming, 0, absorbed, absorbedPlayers,
                () -> choose(bottomUp, 0, residentFloats, floatedResidents,
                    () -> matchAndDescend(groupIndex, incoming, residents, absorbedPlayers, floatedResidents)));
        }

        private boolean matchAndDescend(int groupIndex, List<Player> incoming, List<Player> residents,
                                        List<Player> absorbedPlayers, List<Player> floatedResidents) {
            List<Player> bracket = new ArrayList<>(absorbedPlayers);
            List<Player> down = new ArrayList<>();
            for (Player p : incoming) {
                if (!absorbedPlayers.contains(p)) {
                    down.add(p);
                }
            }
            for (Player p : residents) {
                if (floatedResidents.contains(p)) {
                    down.add(p);
                } else {
                    bracket.add(p);
                }
            }
            for (ColorMode mode : ColorMode.values()) {
                if (matchBracket(bracket, new boolean[bracket.size()], mode, 0,
                        () -> pairBracket(groupIndex + 1, down))) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Picks {@code remaining} players from {@code pool} in pool order, calling
         * {@code next} for each combination until it succeeds.
         */
        private boolean choose(List<Player> pool, int from, int remaining, List<Player> chosen,
                               Continuation next) {
            tick();
            if (remaining == 0) {
                return next.proceed();
            }
            for (int i = from; i <= pool.size() - remaining; i++) {
                chosen.add(pool.get(i));
                if (choose(pool, i + 1, remaining - 1, chosen, next)) {
                    return true;
                }
                chosen.remove(chosen.size() - 1);
            }
            return false;
        }

        /**
         * Perfect matching of {@code residents} in Dutch preference order, calling
         * {@code next} for each complete matching until it succeeds.
         */
        private boolean matchBracket(List<Player> residents, boolean[] used, ColorMode mode,
                                     int conflicts, Continuation next) {
            tick();
            int top = firstUnused(used);
            if (top < 0) {
                if (mode == ColorMode.RELAXED && conflicts == 0) {
                    return false;
                }
                return next.proceed();
            }
            Player higher = residents.get(top);
            used[top] = true;
            for (int candidate : candidateOrder(top, used, residents.size() / 2)) {
                Player lower = residents.get(candidate);
                if (higher.hasPlayed(lower.id())) {
                    continue;
                }
                boolean conflict = ColorAllocator.hasAbsoluteConflict(higher, lower);
                if (conflict && mode == ColorMode.STRICT) {
                    continue;
                }
                used[candidate] = true;
                pairs.add(new Player[] {higher, lower});
                if (matchBracket(residents, used, mode, conflicts + (conflict ? 1 : 0), next)) {
                    return true;
                }
                pairs.remove(pairs.size() - 1);
                used[candidate] = false;
            }
            used[top] = false;
            return false;
        }

        /**
         * Opponents for the player at {@code top}: the unused bottom half in order, then
         * unused top-half players from the bottom of the top half upwards.
         */
        private List<Integer> candidateOrder(int top, boolean[] used, int half) {
            List<Integer> order = new ArrayList<>();
            int bottomStart = Math.max(half, top + 1);
            for (int i = bottomStart; i < used.length; i++) {
                if (!used[i]) {
                    order.add(i);
                }
            }
            for (int i = bottomStart - 1; i > top; i--) {
                if (!used[i]) {
                    order.add(i);
                }
            }
            return order;
        }

        private int firstUnused(boolean[] used) {
            for (int i = 0; i < used.length; i++) {
                if (!used[i]) {
                    return i;
                }
            }
            return -1;
        }

        private void tick() {
            if (++steps > searchBudget) {
                throw new PairingInfeasibleException(roundNumber,
                    "pairing search gave up after " + searchBudget + " steps");
            }
        }
    }

    @FunctionalInterface
    private interface Continuation {
        boolean proceed();
    }

    /**
     * Splits a ranked list into runs of equal score, highest first.
     */
    static List<List<Player>> scoreGroups(List<Player> ranked) {
        List<List<Player>> groups = new ArrayList<>();
        List<Player> current = new ArrayList<>();
        for (Player p : ranked) {
            if (!current.isEmpty() && current.get(0).score() != p.score()) {
                groups.add(current);
                current = new ArrayList<>();
            }
            current.add(p);
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }
}
