package beacon.adapter.out.auth;

import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import beacon.config.AuthConfig;
import beacon.core.model.identity.CredentialCheck;
import beacon.core.model.identity.Identity;
import beacon.core.port.out.IdentityDirectory;

/**
 * Builds identities from the verified token's own claims.
 *
 * <p>A token without a role claim does not describe a usable identity and resolves to not found.
 */
public class ClaimsIdentityDirectory implements IdentityDirectory {

    private static final Logger LOG = Logger.getLogger(ClaimsIdentityDirectory.class);

    private final AuthConfig.Claims claimNames;

    public ClaimsIdentityDirectory(AuthConfig.Claims claimNames) {
        this.claimNames = claimNames;
    }

    @Override
    public Uni<Optional<Identity>> findActive(CredentialCheck.Valid credential) {
        final var role = credential.claimAsString(claimNames.role());
        if (role == null || role.isBlank()) {
            LOG.debugv("Token for user {0} carries no {1} claim", credential.userId(), claimNames.role());
            return Uni.createFrom().item(Optional.empty());
        }

        return Uni.createFrom()
                .item(Optional.of(Identity.of(
                        credential.userId(),
                        credential.claimAsString(claimNames.email()),
                        role,
                        credential.claimAsString(claimNames.organizationId()))));
    }
}
