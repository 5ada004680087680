package org.gambitpairing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.Optional;

/**
 * One round of a player's history: who they met, with which colour, and what they scored.
 * A bye has neither opponent nor colour.
 */
public record RoundRecord(
    @JsonProperty("opponentId") Optional<String> opponentId,
    @JsonProperty("color") Optional<Color> color,
    @JsonProperty("points") double points
) {
    public RoundRecord {
        Preconditions.checkArgument(opponentId != null && color != null, "use Optional.empty() for a bye");
        Preconditions.checkArgument(opponentId.isPresent() == color.isPresent(),
            "a game needs both an opponent and a colour");
        Preconditions.checkArgument(Scores.isValid(points), "invalid points: %s", points);
    }

    public static RoundRecord game(String opponentId, Color color, double points) {
        return new RoundRecord(Optional.of(opponentId), Optional.of(color), points);
    }

    public static RoundRecord bye() {
        return new RoundRecord(Optional.empty(), Optional.empty(), Scores.BYE);
    }

    @JsonIgnore
    public boolean isBye() {
        return opponentId.isEmpty();
    }
}
