package org.gambitpairing.model;

/**
 * Point values for a single round.
 */
public final class Scores {

    public static final double WIN = 1.0;
    public static final double DRAW = 0.5;
    public static final double LOSS = 0.0;
    public static final double BYE = WIN;

    private Scores() {}

    public static boolean isValid(double points) {
        return points == WIN || points == DRAW || points == LOSS;
    }
}
