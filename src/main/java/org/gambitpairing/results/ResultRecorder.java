package org.gambitpairing.results;

import org.gambitpairing.exception.ResultMismatchException;
import org.gambitpairing.model.Color;
import org.gambitpairing.model.MatchResult;
import org.gambitpairing.model.Pairing;
import org.gambitpairing.model.PairingResult;
import org.gambitpairing.model.Player;
import org.gambitpairing.model.PlayerRegistry;
import org.gambitpairing.model.RegistrySnapshot;
import org.gambitpairing.model.RoundRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies a completed round to a {@link PlayerRegistry}.
 *
 * <p>Every check runs against a snapshot before anything is written, and the new player
 * states are committed in one step, so a rejected round leaves the registry untouched.
 */
public class ResultRecorder {

    private static final Logger log = LoggerFactory.getLogger(ResultRecorder.class);

    /**
     * Records one round.
     *
     * @param registry the registry to update
     * @param round    the pairings the results belong to
     * @param results  exactly one result per board, with the board's colours
     * @return the registry state after the round
     * @throws ResultMismatchException if the results do not match the pairings one-to-one,
     *                                 or the pairings do not fit the registry
     */
    public RegistrySnapshot applyResults(PlayerRegistry registry, PairingResult round, List<MatchResult> results) {
        RegistrySnapshot base = registry.snapshot();
        validateRound(base, round);
        Map<Pairing, MatchResult> byBoard = matchResults(round, results);

        Map<String, Player> updated = new HashMap<>(base.players());
        for (Pairing board : round.pairings()) {
            MatchResult result = byBoard.get(board);
            updated.put(board.whiteId(), base.require(board.whiteId())
                .withRound(RoundRecord.game(board.blackId(), Color.WHITE, result.whiteScore())));
            updated.put(board.blackId(), base.require(board.blackId())
                .withRound(RoundRecord.game(board.whiteId(), Color.BLACK, result.blackScore())));
        }
        round.byePlayerId().ifPresent(id -> updated.put(id, base.require(id).withRound(RoundRecord.bye())));

        registry.commit(base, updated, round.roundNumber());
        log.info("Recorded round {}: {} results, bye {}",
            round.roundNumber(), results.size(), round.byePlayerId().orElse("none"));
        return registry.snapshot();
    }

    /**
     * Removes the most recent round from every player.
     *
     * @return the registry state after the undo
     * @throws ResultMismatchException if no round is recorded or players disagree on how
     *                                 many rounds they have played
     */
    public RegistrySnapshot undoLastRound(PlayerRegistry registry) {
        RegistrySnapshot base = registry.snapshot();
        int rounds = base.roundsCompleted();
        if (rounds == 0) {
            throw new ResultMismatchException("No recorded round to undo");
        }
        Map<String, Player> updated = new LinkedHashMap<>();
        for (Player p : base.playerList()) {
            if (p.roundsPlayed() != rounds) {
                throw new ResultMismatchException("Player " + p.id() + " has " + p.roundsPlayed()
                    + " rounds recorded, expected " + rounds);
            }
            updated.put(p.id(), p.withoutLastRound());
        }
        registry.commit(base, updated, rounds - 1);
        log.info("Undid round {}", rounds);
        return registry.snapshot();
    }

    private void validateRound(RegistrySnapshot snapshot, PairingResult round) {
        int expected = snapshot.roundsCompleted() + 1;
        if (round.roundNumber() != expected) {
            throw new ResultMismatchException("Results for round " + round.roundNumber()
                + " but the next round to record is " + expected);
        }
        Set<String> seated = round.playerIds();
        if (seated.size() != round.seatCount()) {
            throw new ResultMismatchException("Round " + round.roundNumber() + " seats a player more than once");
        }
        for (String id : seated) {
            if (!snapshot.contains(id)) {
                throw new ResultMismatchException("Round " + round.roundNumber() + " names unknown player " + id);
            }
        }
        if (seated.size() != snapshot.size()) {
            throw new ResultMismatchException("Round " + round.roundNumber() + " seats " + seated.size()
                + " of " + snapshot.size() + " registered players");
        }
    }

    private Map<Pairing, MatchResult> matchResults(PairingResult round, List<MatchResult> results) {
        Set<Pairing> boards = Set.copyOf(round.pairings());
        Map<Pairing, MatchResult> byBoard = new HashMap<>();
        for (MatchResult result : results) {
            Pairing board = result.pairing();
            if (!boards.contains(board)) {
                Pairing reversed = new Pairing(board.blackId(), board.whiteId());
                String hint = boards.contains(reversed) ? " (colours reversed)" : "";
                throw new ResultMismatchException("Result " + board.whiteId() + " vs " + board.blackId()
                    + " is not a pairing of round " + round.roundNumber() + hint);
            }
            if (byBoard.putIfAbsent(board, result) != null) {
                throw new ResultMismatchException("More than one result for " + board.whiteId()
                    + " vs " + board.blackId());
            }
        }
        for (Pairing board : round.pairings()) {
            if (!byBoard.containsKey(board)) {
                throw new ResultMismatchException("No result for " + board.whiteId() + " vs " + board.blackId());
            }
        }
        return byBoard;
    }
}
