package org.gambitpairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * One board of a round: white and black player ids.
 */
public record Pairing(
    @JsonProperty("whiteId") String whiteId,
    @JsonProperty("blackId") String blackId
) {
    public Pairing {
        Preconditions.checkArgument(whiteId != null && blackId != null, "both player ids are required");
    }

    public boolean involves(String playerId) {
        return whiteId.equals(playerId) || blackId.equals(playerId);
    }

    public String opponentOf(String playerId) {
        if (whiteId.equals(playerId)) {
            return blackId;
        }
        if (blackId.equals(playerId)) {
            return whiteId;
        }
        throw new IllegalArgumentException(playerId + " is not part of " + this);
    }

    /**
     * The pair with colours ignored, for comparisons that do not care who has white.
     */
    public PlayerPair unordered() {
        return PlayerPair.of(whiteId, blackId);
    }
}
