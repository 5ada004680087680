package org.gambitpairing.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * The single mutable source of truth for standings.
 *
 * <p>Readers take {@link #snapshot()}s. The only writer is the result recorder, which
 * builds a complete replacement off a snapshot and hands it to {@link #commit}; a commit
 * based on a stale snapshot is refused, so two recorders racing on the same registry
 * cannot both succeed.
 */
public class PlayerRegistry {

    private static final Logger log = LoggerFactory.getLogger(PlayerRegistry.class);

    private volatile RegistrySnapshot current = new RegistrySnapshot(ImmutableMap.of(), 0);

    public PlayerRegistry() {}

    public PlayerRegistry(Iterable<Player> players) {
        players.forEach(this::register);
    }

    /**
     * Adds a player before the first round is recorded.
     *
     * @throws IllegalArgumentException if the id is already registered
     * @throws IllegalStateException    if rounds have already been recorded
     */
    public synchronized void register(Player player) {
        Preconditions.checkArgument(!current.contains(player.id()), "Duplicate player id: %s", player.id());
        Preconditions.checkState(current.roundsCompleted() == 0,
            "Players cannot join after round %s has been recorded", current.roundsCompleted());
        Preconditions.checkArgument(player.roundsPlayed() == 0, "New players must have an empty history");
        ImmutableMap<String, Player> next = ImmutableMap.<String, Player>builder()
            .putAll(current.players())
            .put(player.id(), player)
            .buildOrThrow();
        current = new RegistrySnapshot(next, 0);
    }

    public RegistrySnapshot snapshot() {
        return current;
    }

    public int size() {
        return current.size();
    }

    public int roundsCompleted() {
        return current.roundsCompleted();
    }

    /**
     * Atomically replaces every player.
     *
     * @param base            the snapshot the replacement was computed from
     * @param updated         the full replacement, same ids in the same order
     * @param roundsCompleted rounds recorded after the replacement
     * @throws IllegalStateException if another commit happened since {@code base} was taken
     */
    public synchronized void commit(RegistrySnapshot base, Map<String, Player> updated, int roundsCompleted) {
        if (base != current) {
            throw new IllegalStateException("Registry changed since the snapshot was taken");
        }
        Preconditions.checkArgument(updated.keySet().equals(current.players().keySet()),
            "A commit must replace exactly the registered players");
        ImmutableMap.Builder<String, Player> next = ImmutableMap.builder();
        for (String id : current.players().keySet()) {
            next.put(id, updated.get(id));
        }
        current = new RegistrySnapshot(next.buildOrThrow(), roundsCompleted);
        log.debug("Registry now at {} completed rounds", roundsCompleted);
    }
}
