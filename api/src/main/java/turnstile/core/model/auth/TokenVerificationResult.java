package turnstile.core.model.auth;

/**
 * Result of verifying an access token.
 */
public sealed interface TokenVerificationResult {

    /**
     * Token signature and expiry checked out.
     *
     * @param claims the claims carried by the token
     */
    record Verified(UserClaims claims) implements TokenVerificationResult {
        public Verified {
            if (claims == null) {
                throw new IllegalArgumentException("Claims cannot be null");
            }
        }
    }

    /**
     * Token was rejected.
     *
     * @param failure the category of the rejection
     * @param reason description of why verification failed
     */
    record Invalid(TokenFailure failure, String reason) implements TokenVerificationResult {}

    /**
     * No token was presented.
     */
    record NoToken() implements TokenVerificationResult {}
}
