package org.gambitpairing.model;

/**
 * Colour given to the higher-ranked player of the top board when neither player
 * of a pair has a colour preference. Lower boards alternate from there.
 */
public enum ColorPolicy {
    WHITE_FIRST(Color.WHITE),
    BLACK_FIRST(Color.BLACK);

    private final Color initialColor;

    ColorPolicy(Color initialColor) {
        this.initialColor = initialColor;
    }

    public Color colorForBoard(int boardIndex) {
        return boardIndex % 2 == 0 ? initialColor : initialColor.opposite();
    }
}
