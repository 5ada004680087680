package org.gambitpairing.pairing;

import org.gambitpairing.exception.PairingInfeasibleException;
import org.gambitpairing.model.PairingResult;
import org.gambitpairing.model.RegistrySnapshot;
import org.gambitpairing.model.TournamentConfig;

/**
 * Produces one round's pairings from an immutable registry snapshot.
 *
 * <p>Implementations must be deterministic: the same snapshot, config and round number
 * always give an equal result. They must not keep state between calls.
 */
public interface PairingEngine {

    /**
     * Short name used in logs and reports.
     */
    String name();

    /**
     * Pairs a round.
     *
     * @param snapshot    standings before the round
     * @param config      tournament settings
     * @param roundNumber the round to pair, {@code snapshot.roundsCompleted() + 1}
     * @return the round's pairings
     * @throws PairingInfeasibleException if no pairing satisfies the hard rules
     */
    PairingResult pairRound(RegistrySnapshot snapshot, TournamentConfig config, int roundNumber);
}
