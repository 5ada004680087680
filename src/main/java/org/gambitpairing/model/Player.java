package org.gambitpairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * A registered player and their tournament history.
 *
 * <p>The cumulative score is never stored: it is always the sum of the points in
 * {@link #history()}, so it cannot drift from the recorded rounds. Instances are
 * immutable; the {@link PlayerRegistry} replaces them as rounds are recorded.
 */
public record Player(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("rating") OptionalInt rating,
    @JsonProperty("history") ImmutableList<RoundRecord> history,
    @JsonProperty("federationProfile") Optional<FederationProfile> federationProfile
) {
    public Player {
        Preconditions.checkArgument(id != null && !id.isBlank(), "player id is required");
        name = name == null ? id : name;
        rating = rating == null ? OptionalInt.empty() : rating;
        history = history == null ? ImmutableList.of() : history;
        federationProfile = federationProfile == null ? Optional.empty() : federationProfile;
    }

    public static Player of(String id, String name, int rating) {
        return new Player(id, name, OptionalInt.of(rating), ImmutableList.of(), Optional.empty());
    }

    public static Player unrated(String id, String name) {
        return new Player(id, name, OptionalInt.empty(), ImmutableList.of(), Optional.empty());
    }

    public Player withFederationProfile(FederationProfile profile) {
        return new Player(id, name, rating, history, Optional.of(profile));
    }

    public Player withRound(RoundRecord record) {
        return new Player(id, name, rating,
            ImmutableList.<RoundRecord>builder().addAll(history).add(record).build(),
            federationProfile);
    }

    public Player withoutLastRound() {
        Preconditions.checkState(!history.isEmpty(), "%s has no recorded rounds", id);
        return new Player(id, name, rating, history.subList(0, history.size() - 1), federationProfile);
    }

    public double score() {
        double total = 0.0;
        for (RoundRecord r : history) {
            total += r.points();
        }
        return total;
    }

    /**
     * Score after the first {@code rounds} rounds.
     */
    public double scoreAfter(int rounds) {
        double total = 0.0;
        for (int i = 0; i < Math.min(rounds, history.size()); i++) {
            total += history.get(i).points();
        }
        return total;
    }

    public int roundsPlayed() {
        return history.size();
    }

    public int byeCount() {
        return (int) history.stream().filter(RoundRecord::isBye).count();
    }

    public boolean hasHadBye() {
        return byeCount() > 0;
    }

    public boolean hasPlayed(String opponentId) {
        return history.stream().anyMatch(r -> r.opponentId().filter(opponentId::equals).isPresent());
    }

    public ImmutableSet<String> opponentIds() {
        ImmutableSet.Builder<String> ids = ImmutableSet.builder();
        history.forEach(r -> r.opponentId().ifPresent(ids::add));
        return ids.build();
    }

    public ImmutableList<Color> playedColors() {
        ImmutableList.Builder<Color> colors = ImmutableList.builder();
        history.forEach(r -> r.color().ifPresent(colors::add));
        return colors.build();
    }

    public int colorCount(Color color) {
        return (int) playedColors().stream().filter(c -> c == color).count();
    }

    /**
     * Colour preference for the next round, following the usual Swiss rules: two games
     * in a row with one colour, or a colour surplus of two, makes the other colour
     * absolute; a surplus of one is strong; balanced colours ask to alternate.
     */
    public ColorPreference colorPreference() {
        ImmutableList<Color> played = playedColors();
        if (played.isEmpty()) {
            return ColorPreference.NONE;
        }
        int difference = colorCount(Color.WHITE) - colorCount(Color.BLACK);
        Color last = played.get(played.size() - 1);
        if (difference >= 2) {
            return ColorPreference.of(Color.BLACK, ColorPreference.Strength.ABSOLUTE);
        }
        if (difference <= -2) {
            return ColorPreference.of(Color.WHITE, ColorPreference.Strength.ABSOLUTE);
        }
        if (played.size() >= 2 && played.get(played.size() - 2) == last) {
            return ColorPreference.of(last.opposite(), ColorPreference.Strength.ABSOLUTE);
        }
        if (difference == 1) {
            return ColorPreference.of(Color.BLACK, ColorPreference.Strength.STRONG);
        }
        if (difference == -1) {
            return ColorPreference.of(Color.WHITE, ColorPreference.Strength.STRONG);
        }
        return ColorPreference.of(last.opposite(), ColorPreference.Strength.MILD);
    }
}
