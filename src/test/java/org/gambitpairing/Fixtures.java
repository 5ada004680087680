package org.gambitpairing;

import com.google.common.collect.ImmutableList;
import org.gambitpairing.model.Color;
import org.gambitpairing.model.Player;
import org.gambitpairing.model.PlayerRegistry;
import org.gambitpairing.model.RegistrySnapshot;
import org.gambitpairing.model.RoundRecord;
import org.gambitpairing.model.Scores;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Shared builders for tests.
 */
public final class Fixtures {

    private Fixtures() {}

    public static Player player(String id, int rating, RoundRecord... history) {
        return new Player(id, id, OptionalInt.of(rating), ImmutableList.copyOf(history), Optional.empty());
    }

    public static RoundRecord won(String opponent, Color color) {
        return RoundRecord.game(opponent, color, Scores.WIN);
    }

    public static RoundRecord drew(String opponent, Color color) {
        return RoundRecord.game(opponent, color, Scores.DRAW);
    }

    public static RoundRecord lost(String opponent, Color color) {
        return RoundRecord.game(opponent, color, Scores.LOSS);
    }

    public static RegistrySnapshot snapshot(Player... players) {
        return RegistrySnapshot.of(List.of(players));
    }

    /**
     * Players P1..Pn, rated 2000 downwards in steps of 100.
     */
    public static List<Player> ratedPlayers(int count) {
        List<Player> players = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            players.add(Player.of("P" + i, "Player " + i, 2100 - 100 * i));
        }
        return players;
    }

    public static PlayerRegistry registry(int count) {
        return new PlayerRegistry(ratedPlayers(count));
    }
}
