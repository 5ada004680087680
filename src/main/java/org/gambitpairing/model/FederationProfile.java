package org.gambitpairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.gambitpairing.federation.Federation;
import org.gambitpairing.federation.FederationDirectory;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Optional federation data attached to a {@link Player}. Pairing and tiebreak logic never
 * need it; it only feeds federation-aware rules such as same-federation avoidance.
 *
 * @param federationCode code as registered in a {@link FederationDirectory}
 * @param title          title such as GM or IM, if any
 * @param federationId   the player's id within that federation, if known
 */
public record FederationProfile(
    @JsonProperty("federationCode") String federationCode,
    @JsonProperty("title") Optional<String> title,
    @JsonProperty("federationId") OptionalLong federationId
) {
    public static FederationProfile of(String federationCode) {
        return new FederationProfile(federationCode, Optional.empty(), OptionalLong.empty());
    }

    /**
     * Resolves the profile's code against a directory.
     *
     * @throws org.gambitpairing.exception.UnknownFederationCodeException if the code is not registered
     */
    public Federation resolve(FederationDirectory directory) {
        return directory.lookup(federationCode);
    }
}
