package beacon.core.model.lifecycle;

import beacon.core.model.event.BrokerError;
import beacon.core.model.identity.Identity;

/**
 * Outcome of a handshake before the transport is upgraded.
 */
public sealed interface Admission {

    /**
     * The handshake may be upgraded.
     *
     * @param identity the resolved identity
     */
    record Admitted(Identity identity) implements Admission {}

    /**
     * The handshake is refused.
     *
     * @param error             the error kind
     * @param reason            human readable reason
     * @param retryAfterSeconds seconds until a retry may succeed, zero when not applicable
     */
    record Rejected(BrokerError error, String reason, long retryAfterSeconds) implements Admission {

        public static Rejected of(BrokerError error, String reason) {
            return new Rejected(error, reason, 0);
        }
    }
}
