package org.gambitpairing.federation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.Locale;

/**
 * Chess federation descriptor. The code is canonicalised to upper case on construction.
 *
 * <p>Instances only become resolvable once registered in a {@link FederationDirectory}.
 */
public record Federation(
    @JsonProperty("code") String code,
    @JsonProperty("name") String name
) {
    public Federation {
        Preconditions.checkArgument(code != null && !code.isBlank(), "federation code is required");
        Preconditions.checkArgument(name != null, "federation name is required");
        code = canonicalCode(code);
    }

    static String canonicalCode(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return code;
    }
}
