package beacon.core.service;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import beacon.core.model.channel.InvalidChannelException;
import beacon.core.model.identity.CredentialCheck;
import beacon.core.model.identity.Identity;
import beacon.core.model.identity.IdentityResolution;
import beacon.core.port.out.IdentityDirectory;
import beacon.core.port.out.TokenVerifier;

/**
 * Resolves the bearer credential presented at handshake time to an identity.
 *
 * <p>The resolved identity stays attached to the connection for its whole lifetime; it is
 * never re-validated mid-session. Directory lookup failures fail closed, and so do identities
 * whose user id, role or organization cannot name a channel.
 */
@ApplicationScoped
public class IdentityGate {

    private static final Logger LOG = Logger.getLogger(IdentityGate.class);

    private final TokenVerifier tokenVerifier;
    private final IdentityDirectory identityDirectory;

    @Inject
    public IdentityGate(TokenVerifier tokenVerifier, IdentityDirectory identityDirectory) {
        this.tokenVerifier = tokenVerifier;
        this.identityDirectory = identityDirectory;
    }

    /**
     * Resolve a credential.
     *
     * @param token the bearer credential, if the client sent one
     * @return the resolution; never fails
     */
    public Uni<IdentityResolution> resolve(Optional<String> token) {
        if (token.isEmpty() || token.get().isBlank()) {
            return Uni.createFrom().item(new IdentityResolution.Unauthenticated("Authentication token required"));
        }

        return tokenVerifier.verify(token.get()).flatMap(check -> {
            if (check instanceof CredentialCheck.Invalid invalid) {
                LOG.debugv("Credential rejected: {0}", invalid.reason());
                return Uni.createFrom().item(new IdentityResolution.Unauthenticated(invalid.reason()));
            }
            return lookup((CredentialCheck.Valid) check);
        });
    }

    private Uni<IdentityResolution> lookup(CredentialCheck.Valid credential) {
        return identityDirectory
                .findActive(credential)
                .map(identity -> identity.map(IdentityGate::addressable)
                        .orElseGet(() -> {
                            LOG.warnv("Handshake refused: user {0} not found", credential.userId());
                            return new IdentityResolution.IdentityNotFound(credential.userId());
                        }))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Identity lookup failed for user {0}: {1}", credential.userId(), error.getMessage());
                    return new IdentityResolution.Unauthenticated("Identity lookup failed");
                });
    }

    private static IdentityResolution addressable(Identity identity) {
        try {
            ChannelManager.defaultChannelsFor(identity);
            return new IdentityResolution.Resolved(identity);
        } catch (InvalidChannelException e) {
            LOG.warnv("Handshake refused: user {0} has no valid default channels ({1})", identity.userId(), e.getMessage());
            return new IdentityResolution.Unauthenticated("Identity cannot be addressed");
        }
    }
}
