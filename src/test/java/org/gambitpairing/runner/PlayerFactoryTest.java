package org.gambitpairing.runner;

import org.gambitpairing.model.Player;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlayerFactoryTest {

    @Test
    void createPlayers_numbersPlayersAndKeepsRatingsInRange() {
        List<Player> players = new PlayerFactory(1200, 1800, new Random(4)).createPlayers(200);

        assertEquals(200, players.size());
        assertEquals("P001", players.get(0).id());
        assertEquals("P200", players.get(199).id());
        assertTrue(players.stream().allMatch(p -> p.rating().getAsInt() >= 1200 && p.rating().getAsInt() <= 1800));
    }

    @Test
    void sameSeed_givesSameRatings() {
        assertEquals(new PlayerFactory(1000, 2400, new Random(8)).createPlayers(20),
            new PlayerFactory(1000, 2400, new Random(8)).createPlayers(20));
    }

    @Test
    void singleRatingRange_isConstant() {
        PlayerFactory factory = new PlayerFactory(1500, 1500, new Random(1));

        assertEquals(1500, factory.nextRating());
        assertEquals(1500, factory.nextRating());
    }
}
