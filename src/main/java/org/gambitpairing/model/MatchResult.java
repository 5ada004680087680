package org.gambitpairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Result of one game. Black's score is always {@code 1.0 - whiteScore} and is never stored.
 */
public record MatchResult(
    @JsonProperty("whiteId") String whiteId,
    @JsonProperty("blackId") String blackId,
    @JsonProperty("whiteScore") double whiteScore
) {
    public MatchResult {
        Preconditions.checkArgument(whiteId != null && blackId != null, "both player ids are required");
        Preconditions.checkArgument(!whiteId.equals(blackId), "a player cannot meet themselves: %s", whiteId);
        Preconditions.checkArgument(Scores.isValid(whiteScore),
            "white score must be 0.0, 0.5 or 1.0, got %s", whiteScore);
    }

    public static MatchResult whiteWins(String whiteId, String blackId) {
        return new MatchResult(whiteId, blackId, Scores.WIN);
    }

    public static MatchResult draw(String whiteId, String blackId) {
        return new MatchResult(whiteId, blackId, Scores.DRAW);
    }

    public static MatchResult blackWins(String whiteId, String blackId) {
        return new MatchResult(whiteId, blackId, Scores.LOSS);
    }

    public double blackScore() {
        return Scores.WIN - whiteScore;
    }

    public Pairing pairing() {
        return new Pairing(whiteId, blackId);
    }

    /**
     * Plain dictionary form for persistence layers that do not bind records directly.
     */
    public Map<String, Object> toMap() {
        return ImmutableMap.of(
            "whiteId", whiteId,
            "blackId", blackId,
            "whiteScore", whiteScore);
    }

    public static MatchResult fromMap(Map<String, ?> map) {
        Object whiteScore = map.get("whiteScore");
        Preconditions.checkArgument(whiteScore instanceof Number, "whiteScore missing or not a number");
        return new MatchResult(
            (String) map.get("whiteId"),
            (String) map.get("blackId"),
            ((Number) whiteScore).doubleValue());
    }
}
