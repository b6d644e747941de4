package beacon.core.model.event;

import java.util.Optional;
import java.util.Set;

import beacon.core.model.ratelimit.RateLimitPolicy;

/**
 * Declarative access policy attached to an event handler.
 *
 * @param requiresAuthentication whether the connection must carry an identity
 * @param allowedRoles           roles allowed to send the event; empty means any role
 * @param rateLimit              per-identity limit for the event, if any
 */
public record HandlerPolicy(boolean requiresAuthentication, Set<String> allowedRoles, Optional<RateLimitPolicy> rateLimit) {

    public HandlerPolicy {
        allowedRoles = allowedRoles != null ? Set.copyOf(allowedRoles) : Set.of();
        rateLimit = rateLimit != null ? rateLimit : Optional.empty();
    }

    public static HandlerPolicy open() {
        return new HandlerPolicy(false, Set.of(), Optional.empty());
    }

    public static HandlerPolicy authenticated(RateLimitPolicy rateLimit) {
        return new HandlerPolicy(true, Set.of(), Optional.of(rateLimit));
    }

    public static HandlerPolicy restricted(Set<String> allowedRoles, RateLimitPolicy rateLimit) {
        return new HandlerPolicy(true, allowedRoles, Optional.of(rateLimit));
    }

    public boolean allowsRole(String role) {
        return allowedRoles.isEmpty() || allowedRoles.contains(role);
    }

    public HandlerPolicy withRateLimit(RateLimitPolicy policy) {
        return new HandlerPolicy(requiresAuthentication, allowedRoles, Optional.ofNullable(policy));
    }
}
