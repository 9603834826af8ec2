package turnstile.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Access-token verification configuration.
 */
@ConfigMapping(prefix = "turnstile.token")
public interface TokenConfig {

    /**
     * HMAC secret shared with the token issuer. At least 32 bytes.
     *
     * <p>When absent every token is rejected.
     */
    Optional<String> secret();

    /**
     * Name of the cookie carrying the access token.
     */
    @WithDefault("access_token")
    String cookieName();

    @WithDefault("PT30S")
    Duration clockSkew();

    /**
     * Expected {@code iss} claim. Not checked when absent.
     */
    Optional<String> issuer();

    /**
     * Expected {@code aud} claim. Not checked when absent.
     */
    Optional<String> audience();
}
