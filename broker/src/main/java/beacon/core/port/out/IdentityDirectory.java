package beacon.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import beacon.core.model.identity.CredentialCheck;
import beacon.core.model.identity.Identity;

/**
 * Port interface for looking up the identity referenced by a verified credential.
 */
public interface IdentityDirectory {

    /**
     * Find the active identity for a verified credential.
     *
     * @param credential the verified credential
     * @return the identity, or empty if it does not exist or is disabled. Fails on lookup errors.
     */
    Uni<Optional<Identity>> findActive(CredentialCheck.Valid credential);
}
