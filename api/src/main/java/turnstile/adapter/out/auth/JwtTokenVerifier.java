package turnstile.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

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

import turnstile.core.config.TokenConfig;
import turnstile.core.model.auth.SubscriptionPlan;
import turnstile.core.model.auth.SubscriptionStatus;
import turnstile.core.model.auth.TokenFailure;
import turnstile.core.model.auth.TokenVerificationResult;
import turnstile.core.model.auth.UserClaims;
import turnstile.core.port.out.Metrics;
import turnstile.core.port.out.TokenVerifier;

/**
 * Verifies HS256-signed access tokens with jose4j.
 *
 * <p>Requires {@code sub} and {@code exp}. Issuer and audience are checked only when
 * configured. Without a usable secret (absent or shorter than 32 bytes) every token
 * is rejected.
 */
@ApplicationScoped
public class JwtTokenVerifier implements TokenVerifier {

    private static final Logger LOG = Logger.getLogger(JwtTokenVerifier.class);

    static final String PLAN_CLAIM = "subscription_plan";
    static final String STATUS_CLAIM = "subscription_status";
    static final int MIN_SECRET_BYTES = 32;

    private final Optional<JwtConsumer> consumer;
    private final Metrics metrics;

    @Inject
    public JwtTokenVerifier(TokenConfig config, Metrics metrics) {
        this.metrics = metrics;
        this.consumer = config.secret()
                .map(secret -> secret.getBytes(StandardCharsets.UTF_8))
                .filter(JwtTokenVerifier::isUsableSecret)
                .map(secret -> buildConsumer(secret, config));
        if (consumer.isEmpty()) {
            LOG.error("No usable token secret configured (turnstile.token.secret, at least "
                    + MIN_SECRET_BYTES + " bytes); all access tokens will be rejected");
        }
    }

    @Override
    public TokenVerificationResult verify(String token) {
        if (token == null || token.isBlank()) {
            return new TokenVerificationResult.NoToken();
        }
        if (consumer.isEmpty()) {
            return reject(TokenFailure.INVALID_SIGNATURE, "Token verification is not configured");
        }

        try {
            JwtClaims claims = consumer.get().processToClaims(token);
            return toClaims(claims);
        } catch (InvalidJwtException e) {
            LOG.debugv("JWT validation failed: {0}", e.getMessage());
            return reject(classify(e), summarizeJwtError(e));
        }
    }

    private TokenVerificationResult toClaims(JwtClaims claims) {
        try {
            var plan = claims.hasClaim(PLAN_CLAIM)
                    ? SubscriptionPlan.fromWireValue(claims.getStringClaimValue(PLAN_CLAIM))
                    : Optional.of(SubscriptionPlan.FREE);
            if (plan.isEmpty()) {
                return reject(TokenFailure.MALFORMED, "Unknown subscription plan");
            }
            var status = claims.hasClaim(STATUS_CLAIM)
                    ? SubscriptionStatus.fromWireValue(claims.getStringClaimValue(STATUS_CLAIM))
                    : Optional.of(SubscriptionStatus.ACTIVE);
            if (status.isEmpty()) {
                return reject(TokenFailure.MALFORMED, "Unknown subscription status");
            }
            var expiresAt = Instant.ofEpochSecond(claims.getExpirationTime().getValue());
            return new TokenVerificationResult.Verified(
                    new UserClaims(claims.getSubject(), plan.get(), status.get(), expiresAt));
        } catch (MalformedClaimException | IllegalArgumentException e) {
            return reject(TokenFailure.MALFORMED, "Malformed claims: " + e.getMessage());
        }
    }

    private TokenVerificationResult reject(TokenFailure failure, String reason) {
        metrics.recordTokenFailure(failure.name().toLowerCase(Locale.ROOT));
        return new TokenVerificationResult.Invalid(failure, reason);
    }

    private static TokenFailure classify(InvalidJwtException e) {
        if (e.hasExpired()) {
            return TokenFailure.EXPIRED;
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return TokenFailure.INVALID_SIGNATURE;
        }
        return TokenFailure.MALFORMED;
    }

    private static String summarizeJwtError(InvalidJwtException e) {
        if (e.hasExpired()) {
            return "Token has expired";
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return "Invalid token signature";
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID)) {
            return "Invalid token issuer";
        }
        if (e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID)) {
            return "Invalid token audience";
        }
        return "Token validation failed";
    }

    private static boolean isUsableSecret(byte[] secret) {
        return secret.length >= MIN_SECRET_BYTES;
    }

    private static JwtConsumer buildConsumer(byte[] secret, TokenConfig config) {
        JwtConsumerBuilder builder = new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds((int) config.clockSkew().toSeconds())
                .setJwsAlgorithmConstraints(new AlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256))
                .setVerificationKey(new HmacKey(secret));

        config.issuer().ifPresent(builder::setExpectedIssuer);
        if (config.audience().isPresent()) {
            builder.setExpectedAudience(config.audience().get());
        } else {
            builder.setSkipDefaultAudienceValidation();
        }
        return builder.build();
    }
}
