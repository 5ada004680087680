package org.gambitpairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * Immutable view of the registry at one moment. Pairing engines, tiebreaks and metrics
 * only ever receive snapshots, so nothing they do can reach the live registry.
 *
 * <p>Iteration order is registration order, which doubles as the pairing number order.
 */
public record RegistrySnapshot(
    @JsonProperty("players") ImmutableMap<String, Player> players,
    @JsonProperty("roundsCompleted") int roundsCompleted
) {
    public RegistrySnapshot {
        Preconditions.checkArgument(players != null, "players");
        Preconditions.checkArgument(roundsCompleted >= 0, "roundsCompleted");
    }

    public static RegistrySnapshot of(Iterable<Player> players) {
        ImmutableMap.Builder<String, Player> map = ImmutableMap.builder();
        int rounds = -1;
        for (Player p : players) {
            map.put(p.id(), p);
            Preconditions.checkArgument(rounds < 0 || rounds == p.roundsPlayed(),
                "all players must have the same number of recorded rounds");
            rounds = p.roundsPlayed();
        }
        return new RegistrySnapshot(map.buildOrThrow(), Math.max(rounds, 0));
    }

    public Optional<Player> find(String id) {
        return Optional.ofNullable(players.get(id));
    }

    public Player require(String id) {
        Player player = players.get(id);
        if (player == null) {
            throw new IllegalArgumentException("Unknown player: " + id);
        }
        return player;
    }

    public boolean contains(String id) {
        return players.containsKey(id);
    }

    public ImmutableList<Player> playerList() {
        return players.values().asList();
    }

    public int size() {
        return players.size();
    }

    /**
     * 1-based position in registration order.
     */
    public int pairingNumber(String id) {
        int index = players.keySet().asList().indexOf(id);
        Preconditions.checkArgument(index >= 0, "Unknown player: %s", id);
        return index + 1;
    }

    public double scoreOf(String id) {
        return require(id).score();
    }
}
