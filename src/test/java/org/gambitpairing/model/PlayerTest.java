package org.gambitpairing.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.gambitpairing.json.ObjectMapperFactory;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.OptionalLong;

import static org.gambitpairing.Fixtures.drew;
import static org.gambitpairing.Fixtures.lost;
import static org.gambitpairing.Fixtures.player;
import static org.gambitpairing.Fixtures.won;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlayerTest {

    @Test
    void score_isSumOfRecordedPoints() {
        Player p = player("a", 1500,
            won("b", Color.WHITE), drew("c", Color.BLACK), RoundRecord.bye(), lost("d", Color.WHITE));

        assertEquals(2.5, p.score());
        assertEquals(1.5, p.scoreAfter(2));
        assertEquals(4, p.roundsPlayed());
        assertEquals(1, p.byeCount());
        assertTrue(p.hasPlayed("c"));
        assertFalse(p.hasPlayed("e"));
    }

    @Test
    void withoutLastRound_dropsOnlyTheLastEntry() {
        Player p = player("a", 1500, won("b", Color.WHITE), drew("c", Color.BLACK));

        Player undone = p.withoutLastRound();

        assertEquals(1, undone.roundsPlayed());
        assertEquals(1.0, undone.score());
        assertFalse(undone.hasPlayed("c"));
    }

    @Test
    void colorPreference_noneWithoutGames() {
        assertEquals(ColorPreference.NONE, Player.of("a", "A", 1500).colorPreference());
        assertEquals(ColorPreference.NONE, player("a", 1500, RoundRecord.bye()).colorPreference());
    }

    @Test
    void colorPreference_mildAlternationWhenBalanced() {
        ColorPreference pref = player("a", 1500, won("b", Color.WHITE), won("c", Color.BLACK)).colorPreference();

        assertEquals(Optional.of(Color.WHITE), pref.color());
        assertEquals(ColorPreference.Strength.MILD, pref.strength());
    }

    @Test
    void colorPreference_strongWhenOneColourAhead() {
        ColorPreference pref = player("a", 1500, won("b", Color.WHITE)).colorPreference();

        assertEquals(Optional.of(Color.BLACK), pref.color());
        assertEquals(ColorPreference.Strength.STRONG, pref.strength());
    }

    @Test
    void colorPreference_absoluteAfterSameColourTwice() {
        ColorPreference pref = player("a", 1500,
            won("b", Color.WHITE), won("c", Color.BLACK), won("d", Color.BLACK)).colorPreference();

        assertEquals(Optional.of(Color.WHITE), pref.color());
        assertTrue(pref.isAbsolute());
    }

    @Test
    void colorPreference_absoluteWhenTwoAhead() {
        ColorPreference pref = player("a", 1500,
            won("b", Color.BLACK), won("c", Color.WHITE), RoundRecord.bye(), won("d", Color.BLACK),
            won("e", Color.WHITE), won("f", Color.BLACK), won("g", Color.BLACK)).colorPreference();

        assertEquals(Optional.of(Color.WHITE), pref.color());
        assertTrue(pref.isAbsolute());
    }

    @Test
    void jsonRoundTrip_keepsHistoryAndFederationProfile() throws Exception {
        ObjectMapper mapper = ObjectMapperFactory.create();
        Player p = player("a", 1850, won("b", Color.WHITE), RoundRecord.bye())
            .withFederationProfile(new FederationProfile("CFC", Optional.of("FM"), OptionalLong.of(123456L)));

        Player restored = mapper.readValue(mapper.writeValueAsString(p), Player.class);

        assertEquals(p, restored);
        assertEquals(2.0, restored.score());
    }

    @Test
    void constructor_requiresId() {
        assertThrows(IllegalArgumentException.class, () -> Player.unrated(" ", "Nobody"));
    }
}
