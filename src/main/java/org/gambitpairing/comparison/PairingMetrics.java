package org.gambitpairing.comparison;

import com.google.common.collect.ImmutableMap;
import org.gambitpairing.model.Color;
import org.gambitpairing.model.ColorPreference;
import org.gambitpairing.model.FederationProfile;
import org.gambitpairing.model.Pairing;
import org.gambitpairing.model.PairingResult;
import org.gambitpairing.model.Player;
import org.gambitpairing.model.RegistrySnapshot;
import org.gambitpairing.model.TournamentConfig;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scoring functions for a single round's pairings, evaluated against the registry state
 * the round was paired from. Every function is total: a component that cannot be
 * computed (no boards, no ratings) contributes {@link #NEUTRAL}.
 */
public final class PairingMetrics {

    public static final double NEUTRAL = 1.0;

    static final double PSD_WEIGHT = 0.35;
    static final double COLOR_WEIGHT = 0.25;
    static final double BRACKET_WEIGHT = 0.20;
    static final double RATING_GAP_WEIGHT = 0.10;
    static final double REMATCH_WEIGHT = 0.10;

    /** Mean score difference at which the PSD component reaches zero. */
    static final double PSD_SCALE = 2.0;
    /** Mean rating gap at which the rating component reaches zero. */
    static final double RATING_GAP_SCALE = 800.0;
    /** Share of same-score boards considered fully compliant; floats below it are expected. */
    static final double BRACKET_TARGET = 0.7;

    private PairingMetrics() {}

    /**
     * Pairing quality in [0, 1]: small score differences, honoured colour preferences,
     * boards inside score groups, small rating gaps, no rematches.
     */
    public static double qualityScore(PairingResult round, RegistrySnapshot snapshot) {
        double psdTotal = 0.0;
        double colorTotal = 0.0;
        int sameGroup = 0;
        int boards = 0;
        int rematches = 0;
        double gapTotal = 0.0;
        int ratedBoards = 0;

        for (Pairing board : round.pairings()) {
            Optional<Player> white = snapshot.find(board.whiteId());
            Optional<Player> black = snapshot.find(board.blackId());
            if (white.isEmpty() || black.isEmpty()) {
                continue;
            }
            Player w = white.get();
            Player b = black.get();
            boards++;
            psdTotal += Math.abs(w.score() - b.score());
            if (w.score() == b.score()) {
                sameGroup++;
            }
            colorTotal += boardColorScore(w, b);
            if (w.hasPlayed(b.id())) {
                rematches++;
            }
            if (w.rating().isPresent() && b.rating().isPresent()) {
                gapTotal += Math.abs(w.rating().getAsInt() - b.rating().getAsInt());
                ratedBoards++;
            }
        }

        double psd = boards == 0 ? NEUTRAL : Math.max(0.0, 1.0 - (psdTotal / boards) / PSD_SCALE);
        double color = boards == 0 ? NEUTRAL : colorTotal / boards;
        double bracket = boards == 0 ? NEUTRAL : bracketCompliance((double) sameGroup / boards);
        double ratingGap = ratedBoards == 0
            ? NEUTRAL : Math.max(0.0, 1.0 - (gapTotal / ratedBoards) / RATING_GAP_SCALE);
        double rematchFree = boards == 0 ? NEUTRAL : 1.0 - (double) rematches / boards;

        return clamp(psd * PSD_WEIGHT
            + color * COLOR_WEIGHT
            + bracket * BRACKET_WEIGHT
            + ratingGap * RATING_GAP_WEIGHT
            + rematchFree * REMATCH_WEIGHT);
    }

    /**
     * Rules compliance in [0, 1]: 0 on any hard violation, otherwise the fraction of
     * soft checks passed.
     */
    public static double fideScore(PairingResult round, RegistrySnapshot snapshot, TournamentConfig config) {
        return check(round, snapshot, config).score();
    }

    public static double overallScore(double fideScore, double qualityScore, ScoringWeights weights) {
        return clamp(fideScore * weights.fide() + qualityScore * weights.quality());
    }

    public static ImmutableMap<PairingViolation, Integer> violations(PairingResult round, RegistrySnapshot snapshot,
                                                                     TournamentConfig config) {
        return ImmutableMap.copyOf(check(round, snapshot, config).violations);
    }

    public static EngineMetrics evaluate(PairingResult round, RegistrySnapshot snapshot, TournamentConfig config,
                                         ScoringWeights weights) {
        Compliance compliance = check(round, snapshot, config);
        double fide = compliance.score();
        double quality = qualityScore(round, snapshot);
        return new EngineMetrics(fide, quality, overallScore(fide, quality, weights),
            ImmutableMap.copyOf(compliance.violations));
    }

    private static double boardColorScore(Player white, Player black) {
        double score = 1.0;
        score -= colorPenalty(white.colorPreference(), Color.WHITE);
        score -= colorPenalty(black.colorPreference(), Color.BLACK);
        return Math.max(0.0, score);
    }

    private static double colorPenalty(ColorPreference preference, Color given) {
        if (preference.color().isEmpty()) {
            return 0.10;
        }
        return preference.accepts(given) ? 0.0 : 0.25;
    }

    private static double bracketCompliance(double sameGroupShare) {
        return sameGroupShare >= BRACKET_TARGET ? 1.0 : sameGroupShare / BRACKET_TARGET;
    }

    private static Compliance check(PairingResult round, RegistrySnapshot snapshot, TournamentConfig config) {
        Compliance c = new Compliance();
        Set<String> seated = new HashSet<>();

        for (Pairing board : round.pairings()) {
            if (board.whiteId().equals(board.blackId())) {
                c.hard(PairingViolation.SELF_PAIRING);
                continue;
            }
            seat(board.whiteId(), seated, c);
            seat(board.blackId(), seated, c);
            Optional<Player> white = snapshot.find(board.whiteId());
            Optional<Player> black = snapshot.find(board.blackId());
            if (white.isEmpty() || black.isEmpty()) {
                c.hard(PairingViolation.UNKNOWN_PLAYER);
                continue;
            }
            Player w = white.get();
            Player b = black.get();
            if (w.hasPlayed(b.id())) {
                c.hard(PairingViolation.REMATCH);
            }
            checkColor(w, Color.WHITE, c);
            checkColor(b, Color.BLACK, c);
            c.soft(w.score() == b.score(), PairingViolation.SCORE_GROUP);
            if (config.avoidSameFederation()) {
                Optional<String> wf = w.federationProfile().map(FederationProfile::federationCode);
                Optional<String> bf = b.federationProfile().map(FederationProfile::federationCode);
                if (wf.isPresent() && bf.isPresent()) {
                    c.soft(!wf.get().equalsIgnoreCase(bf.get()), PairingViolation.SAME_FEDERATION);
                }
            }
        }

        if (round.byePlayerId().isPresent()) {
            String byeId = round.byePlayerId().get();
            seat(byeId, seated, c);
            Optional<Player> bye = snapshot.find(byeId);
            if (bye.isEmpty()) {
                c.hard(PairingViolation.UNKNOWN_PLAYER);
            } else {
                if (bye.get().hasHadBye()) {
                    c.hard(PairingViolation.REPEATED_BYE);
                }
                if (snapshot.size() % 2 == 0) {
                    c.hard(PairingViolation.UNNEEDED_BYE);
                }
                double lowest = snapshot.playerList().stream()
                    .filter(p -> !p.hasHadBye())
                    .mapToDouble(Player::score)
                    .min()
                    .orElse(bye.get().score());
                c.soft(bye.get().score() <= lowest, PairingViolation.BYE_ORDER);
            }
        }

        for (String id : snapshot.players().keySet()) {
            if (!seated.contains(id)) {
                c.hard(PairingViolation.UNPAIRED_PLAYER);
            }
        }
        return c;
    }

    private static void seat(String id, Set<String> seated, Compliance c) {
        if (!seated.add(id)) {
            c.hard(PairingViolation.DUPLICATE_PLAYER);
        }
    }

    private static void checkColor(Player player, Color given, Compliance c) {
        ColorPreference preference = player.colorPreference();
        if (preference.color().isEmpty()) {
            return;
        }
        c.soft(preference.accepts(given),
            preference.isAbsolute() ? PairingViolation.ABSOLUTE_COLOR : PairingViolation.COLOR_PREFERENCE);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /** Running tally of one round's checks. */
    private static final class Compliance {
        final Map<PairingViolation, Integer> violations = new EnumMap<>(PairingViolation.class);
        boolean hardViolation;
        int softChecks;
        int softPassed;

        void hard(PairingViolation violation) {
            hardViolation = true;
            violations.merge(violation, 1, Integer::sum);
        }

        void soft(boolean passed, PairingViolation violation) {
            softChecks++;
            if (passed) {
                softPassed++;
            } else {
                violations.merge(violation, 1, Integer::sum);
            }
        }

        double score() {
            if (hardViolation) {
                return 0.0;
            }
            return softChecks == 0 ? NEUTRAL : (double) softPassed / softChecks;
        }
    }
}
