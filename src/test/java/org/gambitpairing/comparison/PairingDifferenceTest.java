package org.gambitpairing.comparison;

import org.gambitpairing.model.Pairing;
import org.gambitpairing.model.PairingResult;
import org.gambitpairing.model.PlayerPair;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PairingDifferenceTest {

    @Test
    void identicalRounds_haveNoDifference() {
        PairingResult round = PairingResult.of(1,
            List.of(new Pairing("a", "b"), new Pairing("c", "d")), Optional.of("e"));

        PairingDifference difference = PairingDifference.between(round, round);

        assertTrue(difference.isIdentical());
        assertEquals(2, difference.common().size());
        assertEquals(0, difference.divergentCount());
    }

    @Test
    void swappedColours_areCommonButColourDivergent() {
        PairingResult a = PairingResult.of(1, List.of(new Pairing("a", "b"), new Pairing("c", "d")), Optional.empty());
        PairingResult b = PairingResult.of(1, List.of(new Pairing("b", "a"), new Pairing("c", "d")), Optional.empty());

        PairingDifference difference = PairingDifference.between(a, b);

        assertEquals(0, difference.divergentCount());
        assertEquals(Set.of(PlayerPair.of("a", "b")), difference.colorDivergent());
        assertFalse(difference.isIdentical());
    }

    @Test
    void differentPairs_andByes_areReportedPerSide() {
        PairingResult a = PairingResult.of(2, List.of(new Pairing("a", "b"), new Pairing("c", "d")), Optional.of("e"));
        PairingResult b = PairingResult.of(2, List.of(new Pairing("a", "c"), new Pairing("e", "d")), Optional.of("b"));

        PairingDifference difference = PairingDifference.between(a, b);

        assertTrue(difference.common().isEmpty());
        assertEquals(Set.of(PlayerPair.of("a", "b"), PlayerPair.of("c", "d")), difference.onlyA());
        assertEquals(Set.of(PlayerPair.of("a", "c"), PlayerPair.of("d", "e")), difference.onlyB());
        assertEquals(4, difference.divergentPairs().size());
        assertTrue(difference.byeDivergent());
    }
}
