package org.gambitpairing.runner;

import com.google.common.collect.ImmutableList;
import org.gambitpairing.model.MatchResult;
import org.gambitpairing.model.Pairing;
import org.gambitpairing.model.PairingResult;
import org.gambitpairing.model.Player;
import org.gambitpairing.model.RegistrySnapshot;
import org.gambitpairing.model.Scores;

import java.util.Random;

/**
 * Draws game results from the Elo expectation of the stronger player. The draw
 * probability is the configured rate, capped so the stronger player's expected score
 * is still met. Unrated players count as 1500.
 */
public class ResultSimulator {

    static final int UNRATED = 1500;

    private final double drawRate;
    private final Random random;

    public ResultSimulator(double drawRate, Random random) {
        this.drawRate = drawRate;
        this.random = random;
    }

    public ImmutableList<MatchResult> simulateRound(PairingResult round, RegistrySnapshot snapshot) {
        ImmutableList.Builder<MatchResult> results = ImmutableList.builder();
        for (Pairing board : round.pairings()) {
            results.add(simulate(board, snapshot));
        }
        return results.build();
    }

    public MatchResult simulate(Pairing board, RegistrySnapshot snapshot) {
        int white = rating(snapshot.require(board.whiteId()));
        int black = rating(snapshot.require(board.blackId()));
        boolean whiteStronger = white >= black;
        double expected = expectedScore(Math.abs(white - black));
        double draw = Math.min(drawRate, 2.0 - 2.0 * expected);

        double roll = random.nextDouble();
        if (roll < draw) {
            return MatchResult.draw(board.whiteId(), board.blackId());
        }
        boolean strongerWins = roll < expected + draw / 2.0;
        boolean whiteWins = strongerWins == whiteStronger;
        return new MatchResult(board.whiteId(), board.blackId(), whiteWins ? Scores.WIN : Scores.LOSS);
    }

    /**
     * Expected score of the stronger player for a non-negative rating difference.
     */
    static double expectedScore(int ratingDifference) {
        return 1.0 / (1.0 + Math.pow(10.0, -ratingDifference / 400.0));
    }

    private static int rating(Player player) {
        return player.rating().orElse(UNRATED);
    }
}
