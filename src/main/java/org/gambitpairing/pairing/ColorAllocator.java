package org.gambitpairing.pairing;

import org.gambitpairing.model.Color;
import org.gambitpairing.model.ColorPolicy;
import org.gambitpairing.model.ColorPreference;
import org.gambitpairing.model.Pairing;
import org.gambitpairing.model.Player;

/**
 * Decides who gets white on a board.
 *
 * <p>Both preferences are honoured when they are compatible. When both players want the
 * same colour the stronger preference wins, and the higher-ranked player wins a tie.
 * With no preference on either side the board's colour comes from the {@link ColorPolicy}.
 */
public final class ColorAllocator {

    private ColorAllocator() {}

    /**
     * @param higher     the higher-ranked player of the pair
     * @param lower      the lower-ranked player
     * @param boardIndex 0-based board number
     * @param policy     colour policy for preference-free boards
     */
    public static Pairing allocate(Player higher, Player lower, int boardIndex, ColorPolicy policy) {
        Color higherColor = colorForHigher(higher.colorPreference(), lower.colorPreference(), boardIndex, policy);
        return higherColor == Color.WHITE
            ? new Pairing(higher.id(), lower.id())
            : new Pairing(lower.id(), higher.id());
    }

    static Color colorForHigher(ColorPreference higher, ColorPreference lower, int boardIndex, ColorPolicy policy) {
        if (higher.color().isEmpty() && lower.color().isEmpty()) {
            return policy.colorForBoard(boardIndex);
        }
        if (higher.color().isEmpty()) {
            return lower.color().get().opposite();
        }
        if (lower.color().isEmpty()) {
            return higher.color().get();
        }
        Color wanted = higher.color().get();
        if (wanted != lower.color().get()) {
            return wanted;
        }
        return lower.strength().compareTo(higher.strength()) > 0 ? wanted.opposite() : wanted;
    }

    /**
     * True when both players must have the same colour, so one of them will be
     * denied an absolute preference.
     */
    public static boolean hasAbsoluteConflict(Player a, Player b) {
        ColorPreference pa = a.colorPreference();
        ColorPreference pb = b.colorPreference();
        return pa.isAbsolute() && pb.isAbsolute() && pa.color().equals(pb.color());
    }
}
