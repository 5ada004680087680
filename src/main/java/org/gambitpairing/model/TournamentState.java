package org.gambitpairing.model;

import com.google.common.base.Preconditions;

/**
 * Everything a pairing engine needs to pair one round.
 */
public record TournamentState(
    String tournamentId,
    RegistrySnapshot snapshot,
    TournamentConfig config,
    int roundNumber
) {
    public TournamentState {
        Preconditions.checkArgument(snapshot != null && config != null, "snapshot and config are required");
        Preconditions.checkArgument(roundNumber >= 1, "round numbers start at 1");
        tournamentId = tournamentId == null ? config.name() : tournamentId;
    }

    public static TournamentState nextRound(String tournamentId, PlayerRegistry registry, TournamentConfig config) {
        RegistrySnapshot snapshot = registry.snapshot();
        return new TournamentState(tournamentId, snapshot, config, snapshot.roundsCompleted() + 1);
    }
}
