package beacon.core.port.out;

import io.smallrye.mutiny.Uni;

import beacon.core.model.identity.CredentialCheck;

/**
 * Port interface for verifying bearer credentials presented at handshake time.
 */
public interface TokenVerifier {

    /**
     * Verify a credential's signature and validity period.
     *
     * @param token the raw bearer credential
     * @return {@link CredentialCheck.Valid} or {@link CredentialCheck.Invalid}; never fails
     */
    Uni<CredentialCheck> verify(String token);
}
