package beacon.core.model.identity;

/**
 * Outcome of resolving a handshake credential to an identity.
 */
public sealed interface IdentityResolution {

    /**
     * Credential verified and identity found.
     *
     * @param identity the resolved identity
     */
    record Resolved(Identity identity) implements IdentityResolution {}

    /**
     * Credential missing or invalid.
     *
     * @param reason human readable reason
     */
    record Unauthenticated(String reason) implements IdentityResolution {}

    /**
     * Credential valid but the referenced identity no longer exists or is disabled.
     *
     * @param userId the subject of the credential
     */
    record IdentityNotFound(String userId) implements IdentityResolution {}
}
