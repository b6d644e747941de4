package beacon.core.model.identity;

import java.util.Objects;
import java.util.Optional;

/**
 * The authenticated principal attached to a connection after credential verification.
 *
 * @param userId         stable user identifier
 * @param displayName    email or display handle
 * @param role           the user's role (see {@link Roles})
 * @param organizationId the organization the user belongs to, if any
 */
public record Identity(String userId, String displayName, String role, Optional<String> organizationId) {

    public Identity {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id cannot be blank");
        }
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("Role cannot be blank");
        }
        displayName = displayName != null ? displayName : userId;
        organizationId = Objects.requireNonNullElse(organizationId, Optional.<String>empty())
                .filter(id -> !id.isBlank());
    }

    public static Identity of(String userId, String displayName, String role, String organizationId) {
        return new Identity(userId, displayName, role, Optional.ofNullable(organizationId));
    }

    public boolean hasRole(String candidate) {
        return role.equals(candidate);
    }

    /**
     * Check if this identity is a platform administrator.
     *
     * @return true for {@code admin} and {@code super_admin}
     */
    public boolean isPlatformAdmin() {
        return Roles.isPlatformAdmin(role);
    }
}
