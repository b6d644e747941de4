package beacon.core.model.identity;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Result of verifying a bearer credential.
 */
public sealed interface CredentialCheck {

    /**
     * The credential's signature and validity period were accepted.
     *
     * @param userId the user id carried by the credential
     * @param claims all claims of the credential
     */
    record Valid(String userId, Map<String, Object> claims) implements CredentialCheck {
        public Valid {
            claims = claims != null ? Collections.unmodifiableMap(new HashMap<>(claims)) : Map.of();
        }

        /**
         * Get a claim as a string.
         *
         * @param name claim name
         * @return the claim value, or null when absent
         */
        public String claimAsString(String name) {
            final var value = claims.get(name);
            return value != null ? value.toString() : null;
        }
    }

    /**
     * The credential was rejected.
     *
     * @param reason short description of the failure
     */
    record Invalid(String reason) implements CredentialCheck {}
}
