package org.gambitpairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Two player ids without colour, stored in lexicographic order so equal pairs compare equal.
 */
public record PlayerPair(
    @JsonProperty("first") String first,
    @JsonProperty("second") String second
) implements Comparable<PlayerPair> {

    public static PlayerPair of(String a, String b) {
        return a.compareTo(b) <= 0 ? new PlayerPair(a, b) : new PlayerPair(b, a);
    }

    @Override
    public int compareTo(PlayerPair other) {
        int cmp = first.compareTo(other.first);
        return cmp != 0 ? cmp : second.compareTo(other.second);
    }

    @Override
    public String toString() {
        return first + "-" + second;
    }
}
