package org.gambitpairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pairings of a single round in board order, the optional bye, and one traceable id per board.
 */
public record PairingResult(
    @JsonProperty("roundNumber") int roundNumber,
    @JsonProperty("pairings") ImmutableList<Pairing> pairings,
    @JsonProperty("byePlayerId") Optional<String> byePlayerId,
    @JsonProperty("pairingIds") ImmutableList<String> pairingIds
) {
    public PairingResult {
        Preconditions.checkArgument(roundNumber >= 1, "round numbers start at 1");
        pairings = pairings == null ? ImmutableList.of() : pairings;
        byePlayerId = byePlayerId == null ? Optional.empty() : byePlayerId;
        pairingIds = pairingIds == null ? ImmutableList.of() : pairingIds;
        Preconditions.checkArgument(pairingIds.size() == pairings.size(),
            "one pairing id per board expected (%s boards, %s ids)", pairings.size(), pairingIds.size());
    }

    /**
     * Builds a result with ids of the form {@code R03-B01}.
     */
    public static PairingResult of(int roundNumber, List<Pairing> pairings, Optional<String> byePlayerId) {
        ImmutableList.Builder<String> ids = ImmutableList.builder();
        for (int board = 1; board <= pairings.size(); board++) {
            ids.add(pairingId(roundNumber, board));
        }
        return new PairingResult(roundNumber, ImmutableList.copyOf(pairings), byePlayerId, ids.build());
    }

    public static String pairingId(int roundNumber, int board) {
        return String.format("R%02d-B%02d", roundNumber, board);
    }

    /**
     * Every player id in the round, bye included. Duplicates collapse, so a size check
     * against {@code 2 * pairings + bye} detects a player listed twice.
     */
    public Set<String> playerIds() {
        Set<String> ids = new HashSet<>();
        for (Pairing p : pairings) {
            ids.add(p.whiteId());
            ids.add(p.blackId());
        }
        byePlayerId.ifPresent(ids::add);
        return ids;
    }

    public int seatCount() {
        return pairings.size() * 2 + (byePlayerId.isPresent() ? 1 : 0);
    }

    public ImmutableSet<PlayerPair> unorderedPairs() {
        return pairings.stream().map(Pairing::unordered).collect(ImmutableSet.toImmutableSet());
    }

    public Optional<Pairing> find(String whiteId, String blackId) {
        return pairings.stream()
            .filter(p -> p.whiteId().equals(whiteId) && p.blackId().equals(blackId))
            .findFirst();
    }
}
