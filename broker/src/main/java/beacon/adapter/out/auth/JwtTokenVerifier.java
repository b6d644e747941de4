package beacon.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.runtime.Startup;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;

import beacon.config.AuthConfig;
import beacon.core.model.identity.CredentialCheck;
import beacon.core.port.out.TokenVerifier;

/**
 * Verifies HMAC-SHA256 signed JWTs.
 *
 * <p>Validates:
 * <ul>
 * <li>the signature against the shared secret (HS256 only)</li>
 * <li>the expiration (exp) claim, which is required</li>
 * <li>the issuer (iss) claim, when an expected issuer is configured</li>
 * </ul>
 *
 * <p>The user id is read from the configured claim, falling back to the subject. Created at
 * startup so a missing or short secret stops the broker from booting.
 */
@Startup
@ApplicationScoped
public class JwtTokenVerifier implements TokenVerifier {

    private static final Logger LOG = Logger.getLogger(JwtTokenVerifier.class);

    static final int MIN_SECRET_LENGTH = 32;

    private final JwtConsumer consumer;
    private final String userIdClaim;

    @Inject
    public JwtTokenVerifier(AuthConfig config) {
        this(config.jwtSecret(), config.issuer(), config.clockSkew(), config.claims().userId());
    }

    JwtTokenVerifier(String secret, Optional<String> issuer, Duration clockSkew, String userIdClaim) {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(
                    "beacon.auth.jwt-secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }

        final var builder = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds((int) clockSkew.toSeconds())
                .setSkipDefaultAudienceValidation()
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
                .setVerificationKey(new HmacKey(secret.getBytes(StandardCharsets.UTF_8)));
        issuer.filter(value -> !value.isBlank()).ifPresent(builder::setExpectedIssuer);

        this.consumer = builder.build();
        this.userIdClaim = userIdClaim;
    }

    @Override
    public Uni<CredentialCheck> verify(String token) {
        return Uni.createFrom().item(() -> {
            try {
                return buildResult(consumer.processToClaims(token));
            } catch (InvalidJwtException e) {
                LOG.debugv("JWT validation failed: {0}", e.getMessage());
                return new CredentialCheck.Invalid(summarizeJwtError(e));
            }
        });
    }

    private CredentialCheck buildResult(JwtClaims claims) {
        final var userId = Optional.ofNullable(claims.getClaimValue(userIdClaim))
                .map(Object::toString)
                .filter(value -> !value.isBlank())
                .or(() -> Optional.ofNullable(subjectOf(claims)));
        if (userId.isEmpty()) {
            return new CredentialCheck.Invalid("Token carries no user id");
        }

        final Map<String, Object> claimsMap = new HashMap<>(claims.getClaimsMap());
        return new CredentialCheck.Valid(userId.get(), claimsMap);
    }

    private static String subjectOf(JwtClaims claims) {
        try {
            return claims.getSubject();
        } catch (MalformedClaimException e) {
            return null;
        }
    }

    private String summarizeJwtError(InvalidJwtException e) {
        if (e.hasExpired()) {
            return "Token has expired";
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID)) {
            return "Invalid token issuer";
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return "Invalid token signature";
        }
        return "Invalid token";
    }
}
