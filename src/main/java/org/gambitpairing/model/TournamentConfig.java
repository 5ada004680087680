package org.gambitpairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.gambitpairing.tiebreak.ByeOpponentPolicy;
import org.gambitpairing.tiebreak.Tiebreak;

/**
 * Settings fixed for the whole run of a tournament.
 *
 * @param name               tournament name
 * @param totalRounds        number of rounds to be paired
 * @param tiebreaks          tiebreaks in priority order
 * @param colorPolicy        colour of the top board when nobody has a preference
 * @param ratingSeeding      order players inside a score group by rating
 * @param byeOpponentPolicy  how tiebreaks count a bye round
 * @param avoidSameFederation treat same-federation pairings as a soft rule violation
 */
public record TournamentConfig(
    @JsonProperty("name") String name,
    @JsonProperty("totalRounds") int totalRounds,
    @JsonProperty("tiebreaks") ImmutableList<Tiebreak> tiebreaks,
    @JsonProperty("colorPolicy") ColorPolicy colorPolicy,
    @JsonProperty("ratingSeeding") boolean ratingSeeding,
    @JsonProperty("byeOpponentPolicy") ByeOpponentPolicy byeOpponentPolicy,
    @JsonProperty("avoidSameFederation") boolean avoidSameFederation
) {
    public static final ImmutableList<Tiebreak> DEFAULT_TIEBREAKS = ImmutableList.of(
        Tiebreak.BUCHHOLZ_CUT_1,
        Tiebreak.BUCHHOLZ,
        Tiebreak.SONNEBORN_BERGER,
        Tiebreak.PROGRESSIVE,
        Tiebreak.WINS);

    public TournamentConfig {
        Preconditions.checkArgument(totalRounds >= 1, "a tournament needs at least one round");
        name = name == null ? "Untitled Tournament" : name;
        tiebreaks = tiebreaks == null ? DEFAULT_TIEBREAKS : tiebreaks;
        colorPolicy = colorPolicy == null ? ColorPolicy.WHITE_FIRST : colorPolicy;
        byeOpponentPolicy = byeOpponentPolicy == null ? ByeOpponentPolicy.VIRTUAL_OPPONENT : byeOpponentPolicy;
    }

    /**
     * Default settings: FIDE-style tiebreak order, white first, rating seeding on,
     * virtual-opponent bye handling, no federation rule.
     */
    public static TournamentConfig defaults(String name, int totalRounds) {
        return new TournamentConfig(name, totalRounds, DEFAULT_TIEBREAKS, ColorPolicy.WHITE_FIRST,
            true, ByeOpponentPolicy.VIRTUAL_OPPONENT, false);
    }

    public TournamentConfig withTiebreaks(ImmutableList<Tiebreak> order) {
        return new TournamentConfig(name, totalRounds, order, colorPolicy, ratingSeeding,
            byeOpponentPolicy, avoidSameFederation);
    }

    public TournamentConfig withByeOpponentPolicy(ByeOpponentPolicy policy) {
        return new TournamentConfig(name, totalRounds, tiebreaks, colorPolicy, ratingSeeding,
            policy, avoidSameFederation);
    }

    public TournamentConfig withColorPolicy(ColorPolicy policy) {
        return new TournamentConfig(name, totalRounds, tiebreaks, policy, ratingSeeding,
            byeOpponentPolicy, avoidSameFederation);
    }

    public TournamentConfig withAvoidSameFederation(boolean avoid) {
        return new TournamentConfig(name, totalRounds, tiebreaks, colorPolicy, ratingSeeding,
            byeOpponentPolicy, avoid);
    }
}
