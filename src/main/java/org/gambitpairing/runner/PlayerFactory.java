package org.gambitpairing.runner;

import org.gambitpairing.model.Player;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Creates simulated players with normally distributed ratings: mean at the middle of
 * the rating range, six standard deviations across it, clamped to the range.
 */
public class PlayerFactory {

    private final int minRating;
    private final int maxRating;
    private final Random random;

    public PlayerFactory(int minRating, int maxRating, Random random) {
        this.minRating = minRating;
        this.maxRating = maxRating;
        this.random = random;
    }

    public List<Player> createPlayers(int count) {
        List<Player> players = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            players.add(Player.of(String.format("P%03d", i), "Player " + i, nextRating()));
        }
        return players;
    }

    int nextRating() {
        double mean = (minRating + maxRating) / 2.0;
        double stdDev = (maxRating - minRating) / 6.0;
        int rating = (int) Math.round(mean + random.nextGaussian() * stdDev);
        return Math.max(minRating, Math.min(maxRating, rating));
    }
}
