package org.gambitpairing.tiebreak;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * One line of the standings table.
 *
 * @param rank      1-based position; unique, since the ranking is a total order
 * @param playerId  player id
 * @param score     primary score
 * @param tiebreaks tiebreak values in configured order
 */
public record StandingsEntry(
    @JsonProperty("rank") int rank,
    @JsonProperty("playerId") String playerId,
    @JsonProperty("score") double score,
    @JsonProperty("tiebreaks") ImmutableList<Double> tiebreaks
) {}
