package org.gambitpairing.comparison;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import org.gambitpairing.model.Pairing;
import org.gambitpairing.model.PairingResult;
import org.gambitpairing.model.PlayerPair;

/**
 * Where two pairings of the same round differ. Pairs are compared without colour;
 * colour disagreements on pairs both engines chose are reported separately.
 *
 * @param common         pairs produced by both engines
 * @param onlyA          pairs only engine A produced
 * @param onlyB          pairs only engine B produced
 * @param colorDivergent common pairs where the engines gave white to different players
 * @param byeDivergent   the engines chose different bye players (or only one gave a bye)
 */
public record PairingDifference(
    @JsonProperty("common") ImmutableSortedSet<PlayerPair> common,
    @JsonProperty("onlyA") ImmutableSortedSet<PlayerPair> onlyA,
    @JsonProperty("onlyB") ImmutableSortedSet<PlayerPair> onlyB,
    @JsonProperty("colorDivergent") ImmutableSortedSet<PlayerPair> colorDivergent,
    @JsonProperty("byeDivergent") boolean byeDivergent
) {
    public static PairingDifference between(PairingResult a, PairingResult b) {
        ImmutableSortedSet<PlayerPair> pairsA = ImmutableSortedSet.copyOf(a.unorderedPairs());
        ImmutableSortedSet<PlayerPair> pairsB = ImmutableSortedSet.copyOf(b.unorderedPairs());

        ImmutableSortedSet.Builder<PlayerPair> colorDivergent = ImmutableSortedSet.naturalOrder();
        for (Pairing board : a.pairings()) {
            if (b.find(board.blackId(), board.whiteId()).isPresent()) {
                colorDivergent.add(board.unordered());
            }
        }
        return new PairingDifference(
            ImmutableSortedSet.copyOf(Sets.intersection(pairsA, pairsB)),
            ImmutableSortedSet.copyOf(Sets.difference(pairsA, pairsB)),
            ImmutableSortedSet.copyOf(Sets.difference(pairsB, pairsA)),
            colorDivergent.build(),
            !a.byePlayerId().equals(b.byePlayerId()));
    }

    /**
     * Symmetric difference of the two pair sets.
     */
    public ImmutableSortedSet<PlayerPair> divergentPairs() {
        return ImmutableSortedSet.<PlayerPair>naturalOrder().addAll(onlyA).addAll(onlyB).build();
    }

    public int divergentCount() {
        return onlyA.size() + onlyB.size();
    }

    @JsonIgnore
    public boolean isIdentical() {
        return onlyA.isEmpty() && onlyB.isEmpty() && colorDivergent.isEmpty() && !byeDivergent;
    }
}
