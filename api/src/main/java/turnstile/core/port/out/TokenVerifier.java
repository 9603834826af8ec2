package turnstile.core.port.out;

import turnstile.core.model.auth.TokenVerificationResult;

/**
 * Outbound port for access-token verification.
 *
 * <p>Verification is local (signature and expiry) and never retried.
 */
public interface TokenVerifier {

    /**
     * Verify a token and extract its claims.
     *
     * @param token the raw token, may be null or blank
     * @return {@code Verified}, {@code Invalid} or {@code NoToken}
     */
    TokenVerificationResult verify(String token);
}
