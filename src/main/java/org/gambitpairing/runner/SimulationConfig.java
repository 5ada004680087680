package org.gambitpairing.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * Settings for a batch of simulated tournaments.
 *
 * @param tournaments number of independent tournaments
 * @param players     players per tournament
 * @param rounds      rounds per tournament
 * @param seed        base seed; tournament {@code i} uses {@code seed + i}
 * @param drawRate    upper bound on the probability of a draw, 0..1
 * @param threads     tournaments simulated in parallel
 * @param minRating   lowest generated rating
 * @param maxRating   highest generated rating
 * @param engineA     name of the first engine
 * @param engineB     name of the second engine
 */
public record SimulationConfig(
    @JsonProperty("tournaments") int tournaments,
    @JsonProperty("players") int players,
    @JsonProperty("rounds") int rounds,
    @JsonProperty("seed") long seed,
    @JsonProperty("drawRate") double drawRate,
    @JsonProperty("threads") int threads,
    @JsonProperty("minRating") int minRating,
    @JsonProperty("maxRating") int maxRating,
    @JsonProperty("engineA") String engineA,
    @JsonProperty("engineB") String engineB
) {
    public static final int DEFAULT_MIN_RATING = 1000;
    public static final int DEFAULT_MAX_RATING = 2400;
    public static final double DEFAULT_DRAW_RATE = 0.3;

    public SimulationConfig {
        Preconditions.checkArgument(tournaments >= 1, "tournaments must be at least 1");
        Preconditions.checkArgument(players >= 2, "players must be at least 2");
        Preconditions.checkArgument(rounds >= 1, "rounds must be at least 1");
        Preconditions.checkArgument(drawRate >= 0.0 && drawRate <= 1.0, "drawRate must be within [0, 1]");
        Preconditions.checkArgument(threads >= 1, "threads must be at least 1");
        Preconditions.checkArgument(minRating <= maxRating, "minRating must not exceed maxRating");
        engineA = engineA == null ? "swiss" : engineA;
        engineB = engineB == null ? "monrad" : engineB;
    }

    public static SimulationConfig defaults() {
        return new SimulationConfig(10, 16, 5, 42L, DEFAULT_DRAW_RATE,
            Math.min(8, Math.max(1, Runtime.getRuntime().availableProcessors())),
            DEFAULT_MIN_RATING, DEFAULT_MAX_RATING, "swiss", "monrad");
    }
}
