package turnstile.core.model.auth;

/**
 * Reason a presented token was rejected.
 */
public enum TokenFailure {
    INVALID_SIGNATURE,
    EXPIRED,
    MALFORMED
}
