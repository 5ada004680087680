package org.gambitpairing.model;

import java.util.Optional;

/**
 * A player's wish for the next round's colour.
 */
public record ColorPreference(Optional<Color> color, Strength strength) {

    public enum Strength {
        /** No games played yet. */
        NONE,
        /** Colours balanced; alternate from the last game. */
        MILD,
        /** One colour ahead of the other. */
        STRONG,
        /** Two or more ahead, or the same colour twice in a row. */
        ABSOLUTE
    }

    public static final ColorPreference NONE = new ColorPreference(Optional.empty(), Strength.NONE);

    public static ColorPreference of(Color color, Strength strength) {
        return new ColorPreference(Optional.of(color), strength);
    }

    public boolean isAbsolute() {
        return strength == Strength.ABSOLUTE;
    }

    public boolean accepts(Color assigned) {
        return color.map(c -> c == assigned).orElse(true);
    }
}
